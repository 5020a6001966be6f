package info.isaksson.erland.tagcodegen.codegen;

import info.isaksson.erland.tagcodegen.ir.IrCodeAttributeValue;
import info.isaksson.erland.tagcodegen.ir.IrExpressionAttributeValue;
import info.isaksson.erland.tagcodegen.ir.IrHtmlAttributeValue;
import info.isaksson.erland.tagcodegen.ir.IrNode;
import info.isaksson.erland.tagcodegen.ir.IrSourceSpan;
import info.isaksson.erland.tagcodegen.ir.IrToken;

/**
 * Streams the pieces of a conditional attribute to the execution context's accumulator:
 * {@code AddHtmlAttributeValue(prefix, prefixStart, value, valueStart, valueLength, isLiteral);}
 */
public final class TagHelperHtmlAttributeRuntimeNodeWriter extends RuntimeNodeWriter {

    @Override
    public void writeHtmlAttributeValue(CodeRenderingContext context, IrHtmlAttributeValue node) {
        CodeWriter writer = context.codeWriter();
        startPiece(writer, node.prefix, node.source);
        writer.writeStringLiteral(htmlText(node));
        endPiece(writer, node.prefix, node.source, true);
    }

    @Override
    public void writeExpressionAttributeValue(CodeRenderingContext context, IrExpressionAttributeValue node) {
        CodeWriter writer = context.codeWriter();
        if (node.children.size() == 1 && isCodeToken(node.children.get(0))) {
            startPiece(writer, node.prefix, node.source);
            writer.write(((IrToken) node.children.get(0)).content);
            endPiece(writer, node.prefix, node.source, false);
            return;
        }
        // Anything richer than a single expression is rendered through a nested writer.
        startPiece(writer, node.prefix, node.source);
        writeHelperResult(context, node, true);
        endPiece(writer, node.prefix, node.source, false);
    }

    @Override
    public void writeCodeAttributeValue(CodeRenderingContext context, IrCodeAttributeValue node) {
        CodeWriter writer = context.codeWriter();
        startPiece(writer, node.prefix, node.source);
        writeHelperResult(context, node, false);
        endPiece(writer, node.prefix, node.source, false);
    }

    private static void writeHelperResult(CodeRenderingContext context, IrNode node, boolean expression) {
        CodeWriter writer = context.codeWriter();
        writer.writeStartNewObject(TagHelperSymbols.TEMPLATE_TYPE);
        try (CodeWriter.Block lambda = writer.buildAsyncLambda(TagHelperSymbols.ATTRIBUTE_VALUE_WRITER_VARIABLE);
             CodeRenderingContext.WriterScope redirect = context.push(new RuntimeNodeWriter())) {
            writer.writeMethodInvocation(TagHelperSymbols.PUSH_WRITER_METHOD, TagHelperSymbols.ATTRIBUTE_VALUE_WRITER_VARIABLE);
            try (CodeWriter.Block pragma = writer.buildLinePragma(node.source)) {
                if (expression) writer.writeStartMethodInvocation(TagHelperSymbols.WRITE_METHOD);
                renderCode(context, node);
                if (expression) {
                    writer.writeEndMethodInvocation();
                } else {
                    writer.ensureNewLine();
                }
            }
            writer.writeMethodInvocation(TagHelperSymbols.POP_WRITER_METHOD);
        }
        writer.writeEndMethodInvocation(false);
    }

    private static void startPiece(CodeWriter writer, String prefix, IrSourceSpan span) {
        writer.writeStartMethodInvocation(TagHelperSymbols.ADD_HTML_ATTRIBUTE_VALUE_METHOD)
                .writeStringLiteral(prefix)
                .writeParameterSeparator()
                .write(Integer.toString(span == null ? 0 : span.absoluteIndex))
                .writeParameterSeparator();
    }

    private static void endPiece(CodeWriter writer, String prefix, IrSourceSpan span, boolean literal) {
        int valueStart = span == null ? 0 : span.absoluteIndex + prefix.length();
        int valueLength = span == null ? 0 : Math.max(0, span.length - prefix.length());
        writer.writeParameterSeparator()
                .write(Integer.toString(valueStart))
                .writeParameterSeparator()
                .write(Integer.toString(valueLength))
                .writeParameterSeparator()
                .write(literal ? "true" : "false")
                .writeEndMethodInvocation();
    }

    private static boolean isCodeToken(IrNode node) {
        return node instanceof IrToken && ((IrToken) node).code();
    }
}
