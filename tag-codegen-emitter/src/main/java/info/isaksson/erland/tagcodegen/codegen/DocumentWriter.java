package info.isaksson.erland.tagcodegen.codegen;

import info.isaksson.erland.tagcodegen.ir.IrCodeAttributeValue;
import info.isaksson.erland.tagcodegen.ir.IrCodeBlock;
import info.isaksson.erland.tagcodegen.ir.IrExpression;
import info.isaksson.erland.tagcodegen.ir.IrExpressionAttributeValue;
import info.isaksson.erland.tagcodegen.ir.IrHtmlAttributeValue;
import info.isaksson.erland.tagcodegen.ir.IrHtmlContent;
import info.isaksson.erland.tagcodegen.ir.IrNode;
import info.isaksson.erland.tagcodegen.ir.IrTagHelper;
import info.isaksson.erland.tagcodegen.ir.IrTagHelperBody;
import info.isaksson.erland.tagcodegen.ir.IrTagHelperCreate;
import info.isaksson.erland.tagcodegen.ir.IrTagHelperExecute;
import info.isaksson.erland.tagcodegen.ir.IrTagHelperHtmlAttribute;
import info.isaksson.erland.tagcodegen.ir.IrTagHelperProperty;
import info.isaksson.erland.tagcodegen.ir.IrTagHelperRuntime;
import info.isaksson.erland.tagcodegen.ir.IrTemplate;
import info.isaksson.erland.tagcodegen.ir.IrToken;

import java.util.List;

/**
 * Depth-first driver: dispatches each node to the tag helper extension or to the active node writer.
 */
public final class DocumentWriter {

    private final TagHelperTargetExtension extension;

    public DocumentWriter(TagHelperTargetExtension extension) {
        if (extension == null) throw new IllegalArgumentException("extension must not be null");
        this.extension = extension;
    }

    public void visit(CodeRenderingContext context, IrNode node) {
        switch (node.kind()) {
            case DOCUMENT:
                context.renderChildren(node);
                break;
            case TAG_HELPER:
                writeTagHelper(context, (IrTagHelper) node);
                break;
            case TAG_HELPER_BODY:
                extension.writeTagHelperBody(context, (IrTagHelperBody) node);
                break;
            case TAG_HELPER_CREATE:
                extension.writeTagHelperCreate(context, (IrTagHelperCreate) node);
                break;
            case TAG_HELPER_EXECUTE:
                extension.writeTagHelperExecute(context, (IrTagHelperExecute) node);
                break;
            case TAG_HELPER_HTML_ATTRIBUTE:
                extension.writeTagHelperHtmlAttribute(context, (IrTagHelperHtmlAttribute) node);
                break;
            case TAG_HELPER_PROPERTY:
                extension.writeTagHelperProperty(context, (IrTagHelperProperty) node);
                break;
            case TAG_HELPER_RUNTIME:
                extension.writeTagHelperRuntime(context, (IrTagHelperRuntime) node);
                break;
            case HTML_CONTENT:
                context.nodeWriter().writeHtmlContent(context, (IrHtmlContent) node);
                break;
            case EXPRESSION:
                context.nodeWriter().writeExpression(context, (IrExpression) node);
                break;
            case CODE_BLOCK:
                context.nodeWriter().writeCodeBlock(context, (IrCodeBlock) node);
                break;
            case HTML_ATTRIBUTE_VALUE:
                context.nodeWriter().writeHtmlAttributeValue(context, (IrHtmlAttributeValue) node);
                break;
            case EXPRESSION_ATTRIBUTE_VALUE:
                context.nodeWriter().writeExpressionAttributeValue(context, (IrExpressionAttributeValue) node);
                break;
            case CODE_ATTRIBUTE_VALUE:
                context.nodeWriter().writeCodeAttributeValue(context, (IrCodeAttributeValue) node);
                break;
            case TEMPLATE:
                writeTemplate(context, (IrTemplate) node);
                break;
            case TOKEN:
                writeToken(context, (IrToken) node);
                break;
            default:
                throw new IllegalStateException("Unhandled IR node kind: " + node.kind());
        }
    }

    private static void writeTagHelper(CodeRenderingContext context, IrTagHelper node) {
        NodeWriter writer = context.nodeWriter();
        writer.beginTagHelper(context, node);
        try (CodeRenderingContext.WriterScope occurrence =
                     context.enterTagHelper(new TagHelperRenderingContext(node.tagName, node.tagMode))) {
            context.renderChildren(node);
        }
        writer.endTagHelper(context, node);
    }

    /** {@code item => new HelperResult(async(__razor_template_writer) => { ... })} */
    private static void writeTemplate(CodeRenderingContext context, IrTemplate node) {
        CodeWriter writer = context.codeWriter();
        writer.write("item => ").writeStartNewObject(TagHelperSymbols.TEMPLATE_TYPE);
        try (CodeWriter.Block lambda = writer.buildAsyncLambda(TagHelperSymbols.TEMPLATE_WRITER_VARIABLE)) {
            if (!context.isDesignTime()) {
                writer.writeMethodInvocation(TagHelperSymbols.PUSH_WRITER_METHOD, TagHelperSymbols.TEMPLATE_WRITER_VARIABLE);
            }
            context.renderChildren(node);
            if (!context.isDesignTime()) {
                writer.writeMethodInvocation(TagHelperSymbols.POP_WRITER_METHOD);
            }
        }
        writer.writeEndMethodInvocation(false);
    }

    /** A token outside a value node: markup goes through the active writer, code is written verbatim. */
    private static void writeToken(CodeRenderingContext context, IrToken token) {
        if (token.html()) {
            context.nodeWriter().writeHtmlContent(context, new IrHtmlContent(List.of(token), token.source));
        } else {
            context.codeWriter().write(token.content);
        }
    }
}
