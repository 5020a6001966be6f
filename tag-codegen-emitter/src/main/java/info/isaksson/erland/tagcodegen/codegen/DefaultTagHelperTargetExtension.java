package info.isaksson.erland.tagcodegen.codegen;

import info.isaksson.erland.tagcodegen.emitter.DiagnosticKind;
import info.isaksson.erland.tagcodegen.ir.IrBoundAttribute;
import info.isaksson.erland.tagcodegen.ir.IrHtmlContent;
import info.isaksson.erland.tagcodegen.ir.IrNode;
import info.isaksson.erland.tagcodegen.ir.IrNodeKind;
import info.isaksson.erland.tagcodegen.ir.IrTagHelperBody;
import info.isaksson.erland.tagcodegen.ir.IrTagHelperCreate;
import info.isaksson.erland.tagcodegen.ir.IrTagHelperExecute;
import info.isaksson.erland.tagcodegen.ir.IrTagHelperHtmlAttribute;
import info.isaksson.erland.tagcodegen.ir.IrTagHelperProperty;
import info.isaksson.erland.tagcodegen.ir.IrTagHelperRuntime;
import info.isaksson.erland.tagcodegen.ir.IrToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static info.isaksson.erland.tagcodegen.codegen.TagHelperSymbols.*;

/**
 * Emits C# against the tag helper runtime: scope begin/end, creation, execution, attribute and
 * property binding, and the per-class scaffolding fields.
 *
 * <p>Every runtime-only statement is gated on {@link CodeRenderingContext#isDesignTime()}. Design-time
 * output still visits the same nodes so tooling sees the same structure.</p>
 */
public final class DefaultTagHelperTargetExtension implements TagHelperTargetExtension {

    private static final Logger log = LoggerFactory.getLogger(DefaultTagHelperTargetExtension.class);

    private static final String PRIVATE = "private";

    @Override
    public void writeTagHelperBody(CodeRenderingContext context, IrTagHelperBody node) {
        if (context.isDesignTime()) {
            context.renderChildren(node);
            return;
        }

        TagHelperRenderingContext occurrence = context.requireTagHelperContext(node);
        CodeWriter writer = context.codeWriter();

        writer.writeStartAssignment(EXECUTION_CONTEXT_VARIABLE)
                .writeStartInstanceMethodInvocation(SCOPE_MANAGER_VARIABLE, SCOPE_MANAGER_BEGIN_METHOD);

        // One id per call site: the same tag twice on a page gets two ids.
        String uniqueId = context.nextUniqueId();

        writer.writeStringLiteral(occurrence.tagName())
                .writeParameterSeparator()
                .write(TAG_MODE_TYPE)
                .write(".")
                .write(occurrence.tagMode().runtimeName())
                .writeParameterSeparator()
                .writeStringLiteral(uniqueId)
                .writeParameterSeparator();

        // The body is deferred so the tag helper can read or replace its own content.
        try (CodeRenderingContext.WriterScope body = context.push(new TagHelperBodyNodeWriter());
             CodeWriter.Block lambda = writer.buildAsyncLambda()) {
            context.renderChildren(node);
        }

        writer.writeEndMethodInvocation();
    }

    @Override
    public void writeTagHelperCreate(CodeRenderingContext context, IrTagHelperCreate node) {
        CodeWriter writer = context.codeWriter();
        writer.writeStartAssignment(node.field)
                .write(CREATE_TAG_HELPER_METHOD)
                .writeLine("<global::" + node.typeName + ">();");

        if (!context.isDesignTime()) {
            writer.writeInstanceMethodInvocation(EXECUTION_CONTEXT_VARIABLE, EXECUTION_CONTEXT_ADD_METHOD, node.field);
        }
    }

    @Override
    public void writeTagHelperExecute(CodeRenderingContext context, IrTagHelperExecute node) {
        if (context.isDesignTime()) return;

        CodeWriter writer = context.codeWriter();
        writer.write("await ")
                .writeStartInstanceMethodInvocation(RUNNER_VARIABLE, RUN_ASYNC_METHOD)
                .write(EXECUTION_CONTEXT_VARIABLE)
                .writeEndMethodInvocation();

        String output = EXECUTION_CONTEXT_VARIABLE + "." + EXECUTION_CONTEXT_OUTPUT_PROPERTY;

        writer.write("if (!")
                .write(output)
                .write(".")
                .write(IS_CONTENT_MODIFIED_PROPERTY)
                .writeLine(")");
        try (CodeWriter.Block scope = writer.buildScope()) {
            writer.write("await ")
                    .writeInstanceMethodInvocation(EXECUTION_CONTEXT_VARIABLE, SET_OUTPUT_CONTENT_ASYNC_METHOD);
        }

        writer.writeStartMethodInvocation(WRITE_TAG_HELPER_OUTPUT_METHOD)
                .write(output)
                .writeEndMethodInvocation()
                .writeStartAssignment(EXECUTION_CONTEXT_VARIABLE)
                .writeInstanceMethodInvocation(SCOPE_MANAGER_VARIABLE, SCOPE_MANAGER_END_METHOD);
    }

    @Override
    public void writeTagHelperHtmlAttribute(CodeRenderingContext context, IrTagHelperHtmlAttribute node) {
        if (context.isDesignTime()) {
            context.renderChildren(node);
            return;
        }

        CodeWriter writer = context.codeWriter();
        String valueStyle = HTML_ATTRIBUTE_VALUE_STYLE_TYPE + "." + node.attributeStructure.runtimeName();

        if (isConditionalAttributeValue(node)) {
            // Unbound attribute with code: the runtime may drop it when the value resolves to nothing.
            writer.writeStartMethodInvocation(BEGIN_ADD_HTML_ATTRIBUTE_VALUES_METHOD)
                    .write(EXECUTION_CONTEXT_VARIABLE)
                    .writeParameterSeparator()
                    .writeStringLiteral(node.attributeName)
                    .writeParameterSeparator()
                    .write(Integer.toString(countValuePieces(node)))
                    .writeParameterSeparator()
                    .write(valueStyle)
                    .writeEndMethodInvocation();

            try (CodeRenderingContext.WriterScope pieces = context.push(new TagHelperHtmlAttributeRuntimeNodeWriter())) {
                context.renderChildren(node);
            }

            writer.writeMethodInvocation(END_ADD_HTML_ATTRIBUTE_VALUES_METHOD, EXECUTION_CONTEXT_VARIABLE);
        } else {
            // Buffered through the page writer so everything written while rendering is captured.
            writer.writeMethodInvocation(BEGIN_WRITE_TAG_HELPER_ATTRIBUTE_METHOD);

            try (CodeRenderingContext.WriterScope buffered = context.push(new RuntimeNodeWriter())) {
                context.renderChildren(node);
            }

            writer.writeStartAssignment(STRING_VALUE_BUFFER_VARIABLE)
                    .writeMethodInvocation(END_WRITE_TAG_HELPER_ATTRIBUTE_METHOD)
                    .writeStartInstanceMethodInvocation(EXECUTION_CONTEXT_VARIABLE, ADD_HTML_ATTRIBUTE_METHOD)
                    .writeStringLiteral(node.attributeName)
                    .writeParameterSeparator()
                    .writeStartMethodInvocation(MARK_AS_HTML_ENCODED_METHOD)
                    .write(STRING_VALUE_BUFFER_VARIABLE)
                    .writeEndMethodInvocation(false)
                    .writeParameterSeparator()
                    .write(valueStyle)
                    .writeEndMethodInvocation();
        }
    }

    @Override
    public void writeTagHelperProperty(CodeRenderingContext context, IrTagHelperProperty node) {
        TagHelperRenderingContext occurrence = context.requireTagHelperContext(node);
        IrBoundAttribute bound = node.boundAttribute;
        boolean stringValued = bound.isStringProperty || (node.indexerNameMatch && bound.isIndexerStringProperty);

        if (!stringValued && reportUnsupportedContent(context, node)) {
            return;
        }

        CodeWriter writer = context.codeWriter();
        String propertyName = bound.propertyName;
        String accessor = propertyAccessor(node);

        if (!context.isDesignTime() && node.indexerNameMatch
                && occurrence.verifiedPropertyDictionaries().add(node.tagHelperTypeName + "." + propertyName)) {
            writer.write("if (")
                    .write(node.field)
                    .write(".")
                    .write(propertyName)
                    .writeLine(" == null)");
            try (CodeWriter.Block scope = writer.buildScope()) {
                // InvalidOperationException resolves through the System import of every generated view.
                writer.write("throw ")
                        .writeStartNewObject("InvalidOperationException")
                        .writeStartMethodInvocation(INVALID_INDEXER_ASSIGNMENT_METHOD)
                        .writeStringLiteral(node.attributeName)
                        .writeParameterSeparator()
                        .writeStringLiteral(node.tagHelperTypeName)
                        .writeParameterSeparator()
                        .writeStringLiteral(propertyName)
                        .writeEndMethodInvocation(false)
                        .writeEndMethodInvocation();
            }
        }

        String previousAccessor = occurrence.renderedBoundAttributes().get(node.attributeName);
        if (previousAccessor != null) {
            writer.writeStartAssignment(accessor).write(previousAccessor).writeLine(";");
            return;
        }
        occurrence.renderedBoundAttributes().put(node.attributeName, accessor);

        if (stringValued) {
            writeStringPropertyValue(context, node, accessor);
        } else {
            writeInlinePropertyValue(context, node, accessor);
        }

        if (!context.isDesignTime()) {
            writer.writeStartInstanceMethodInvocation(EXECUTION_CONTEXT_VARIABLE, ADD_TAG_HELPER_ATTRIBUTE_METHOD)
                    .writeStringLiteral(node.attributeName)
                    .writeParameterSeparator()
                    .write(accessor)
                    .writeParameterSeparator()
                    .write(HTML_ATTRIBUTE_VALUE_STYLE_TYPE + "." + node.attributeStructure.runtimeName())
                    .writeEndMethodInvocation();
        }
    }

    @Override
    public void writeTagHelperRuntime(CodeRenderingContext context, IrTagHelperRuntime node) {
        if (context.isDesignTime()) return;
        if (!context.claimRuntimeScaffolding()) {
            log.debug("Runtime scaffolding already written; skipping duplicate node");
            return;
        }

        CodeWriter writer = context.codeWriter();
        writer.writeLine("#line hidden");

        // Whether the buffer is used depends on the tag helpers on the page.
        writer.writeLine("#pragma warning disable 0169");
        writer.writeField(PRIVATE, "string", STRING_VALUE_BUFFER_VARIABLE);
        writer.writeLine("#pragma warning restore 0169");

        writer.writeField(PRIVATE, EXECUTION_CONTEXT_TYPE, EXECUTION_CONTEXT_VARIABLE);

        writer.write(PRIVATE + " ")
                .write(RUNNER_TYPE)
                .write(" ")
                .write(RUNNER_VARIABLE)
                .write(" = new ")
                .write(RUNNER_TYPE)
                .writeLine("();");

        writer.write(PRIVATE + " ")
                .writeVariableDeclaration(SCOPE_MANAGER_TYPE, BACKED_SCOPE_MANAGER_VARIABLE, null);

        writer.write(PRIVATE + " ")
                .write(SCOPE_MANAGER_TYPE)
                .write(" ")
                .writeLine(SCOPE_MANAGER_VARIABLE);
        try (CodeWriter.Block property = writer.buildScope()) {
            writer.writeLine("get");
            try (CodeWriter.Block getter = writer.buildScope()) {
                writer.write("if (")
                        .write(BACKED_SCOPE_MANAGER_VARIABLE)
                        .writeLine(" == null)");
                try (CodeWriter.Block init = writer.buildScope()) {
                    writer.writeStartAssignment(BACKED_SCOPE_MANAGER_VARIABLE)
                            .writeStartNewObject(SCOPE_MANAGER_TYPE)
                            .write(START_WRITING_SCOPE_METHOD)
                            .writeParameterSeparator()
                            .write(END_WRITING_SCOPE_METHOD)
                            .writeEndMethodInvocation();
                }
                writer.write("return ")
                        .write(BACKED_SCOPE_MANAGER_VARIABLE)
                        .writeLine(";");
            }
        }
    }

    private static void writeStringPropertyValue(CodeRenderingContext context, IrTagHelperProperty node, String accessor) {
        CodeWriter writer = context.codeWriter();
        if (context.isDesignTime()) {
            context.renderChildren(node);

            String literal = node.children.size() == 1 ? literalText(node.children.get(0)) : null;
            writer.writeStartAssignment(accessor);
            if (literal != null) {
                writer.writeStringLiteral(literal);
            } else {
                writer.write("string.Empty");
            }
            writer.writeLine(";");
            return;
        }

        writer.writeMethodInvocation(BEGIN_WRITE_TAG_HELPER_ATTRIBUTE_METHOD);

        try (CodeRenderingContext.WriterScope literal = context.push(new LiteralRuntimeNodeWriter())) {
            context.renderChildren(node);
        }

        writer.writeStartAssignment(STRING_VALUE_BUFFER_VARIABLE)
                .writeMethodInvocation(END_WRITE_TAG_HELPER_ATTRIBUTE_METHOD)
                .writeStartAssignment(accessor)
                .write(STRING_VALUE_BUFFER_VARIABLE)
                .writeLine(";");
    }

    private static void writeInlinePropertyValue(CodeRenderingContext context, IrTagHelperProperty node, String accessor) {
        CodeWriter writer = context.codeWriter();
        IrBoundAttribute bound = node.boundAttribute;
        boolean qualifyEnum = bound.isEnum
                && node.children.size() == 1
                && node.children.get(0) instanceof IrToken
                && ((IrToken) node.children.get(0)).code();
        String enumPrefix = "global::" + bound.typeName + ".";

        try (CodeWriter.Block pragma = writer.buildLinePragma(node.source)) {
            if (context.isDesignTime() && hasMappedChild(node)) {
                int prefixLength = accessor.length() + " = ".length() + (qualifyEnum ? enumPrefix.length() : 0);
                writer.writePadding(prefixLength, node.source);
            }

            writer.writeStartAssignment(accessor);
            if (qualifyEnum) {
                writer.write(enumPrefix);
            }
            for (IrNode child : node.children) {
                renderInline(context, child);
            }
            writer.writeLine(";");
        }
    }

    private static void renderInline(CodeRenderingContext context, IrNode node) {
        if (node instanceof IrToken) {
            if (context.isDesignTime()) {
                context.addLineMappingFor(node);
            }
            context.codeWriter().write(((IrToken) node).content);
            return;
        }
        if (node.kind() == IrNodeKind.EXPRESSION || node.kind() == IrNodeKind.HTML_CONTENT) {
            for (IrNode child : node.children) {
                renderInline(context, child);
            }
            return;
        }
        throw new IllegalStateException(node.kind() + " cannot be rendered as part of a property value expression");
    }

    /**
     * Code blocks and inline templates cannot become a single value expression. Reports each one
     * and returns true when the property must be skipped.
     */
    private static boolean reportUnsupportedContent(CodeRenderingContext context, IrTagHelperProperty property) {
        int before = context.diagnostics().size();
        for (IrNode child : property.children) {
            collectUnsupported(context, property, child);
        }
        int reported = context.diagnostics().size() - before;
        if (reported > 0) {
            log.debug("Skipping property '{}' on {}: {} unsupported value node(s)",
                    property.attributeName, property.tagHelperTypeName, reported);
        }
        return reported > 0;
    }

    private static void collectUnsupported(CodeRenderingContext context, IrTagHelperProperty property, IrNode node) {
        switch (node.kind()) {
            case CODE_BLOCK:
                context.diagnostics().add(DiagnosticKind.CODE_BLOCK_NOT_SUPPORTED_IN_ATTRIBUTE, property.source);
                break;
            case TEMPLATE:
                String expectedType = property.indexerNameMatch
                        ? property.boundAttribute.indexerTypeName
                        : property.boundAttribute.typeName;
                context.diagnostics().add(DiagnosticKind.TEMPLATE_NOT_SUPPORTED_IN_ATTRIBUTE, property.source, expectedType);
                break;
            case EXPRESSION:
            case HTML_CONTENT:
                for (IrNode child : node.children) {
                    collectUnsupported(context, property, child);
                }
                break;
            default:
                break;
        }
    }

    /** Text of a markup-only value node, or null when the node carries code. */
    private static String literalText(IrNode node) {
        if (node instanceof IrHtmlContent) {
            return ((IrHtmlContent) node).textContent();
        }
        if (node instanceof IrToken && ((IrToken) node).html()) {
            return ((IrToken) node).content;
        }
        return null;
    }

    private static boolean hasMappedChild(IrNode node) {
        for (IrNode child : node.children) {
            if (child.source != null) return true;
        }
        return false;
    }

    private static boolean isConditionalAttributeValue(IrTagHelperHtmlAttribute node) {
        for (IrNode child : node.children) {
            if (child.kind() == IrNodeKind.EXPRESSION_ATTRIBUTE_VALUE || child.kind() == IrNodeKind.CODE_ATTRIBUTE_VALUE) {
                return true;
            }
        }
        return false;
    }

    private static int countValuePieces(IrTagHelperHtmlAttribute node) {
        int count = 0;
        for (IrNode child : node.children) {
            switch (child.kind()) {
                case HTML_ATTRIBUTE_VALUE:
                case EXPRESSION_ATTRIBUTE_VALUE:
                case CODE_ATTRIBUTE_VALUE:
                    count++;
                    break;
                default:
                    break;
            }
        }
        return count;
    }

    /** {@code field.Property} or {@code field.Property["key"]} for an indexer match. */
    static String propertyAccessor(IrTagHelperProperty node) {
        String accessor = node.field + "." + node.boundAttribute.propertyName;
        if (node.indexerNameMatch) {
            accessor += "[\"" + node.indexerKey() + "\"]";
        }
        return accessor;
    }
}
