package info.isaksson.erland.tagcodegen.codegen;

import info.isaksson.erland.tagcodegen.ir.IrCodeAttributeValue;
import info.isaksson.erland.tagcodegen.ir.IrCodeBlock;
import info.isaksson.erland.tagcodegen.ir.IrExpression;
import info.isaksson.erland.tagcodegen.ir.IrExpressionAttributeValue;
import info.isaksson.erland.tagcodegen.ir.IrHtmlAttributeValue;
import info.isaksson.erland.tagcodegen.ir.IrHtmlContent;
import info.isaksson.erland.tagcodegen.ir.IrNode;
import info.isaksson.erland.tagcodegen.ir.IrToken;

/** Default runtime writer: literals and expressions stream straight to the page. */
public class RuntimeNodeWriter extends NodeWriter {

    protected String writeExpressionMethod() {
        return TagHelperSymbols.WRITE_METHOD;
    }

    protected String writeLiteralMethod() {
        return TagHelperSymbols.WRITE_LITERAL_METHOD;
    }

    @Override
    public void writeHtmlContent(CodeRenderingContext context, IrHtmlContent node) {
        writeLiteral(context, node.textContent());
    }

    @Override
    public void writeExpression(CodeRenderingContext context, IrExpression node) {
        writeExpressionCall(context, node);
    }

    @Override
    public void writeCodeBlock(CodeRenderingContext context, IrCodeBlock node) {
        writeCode(context, node);
    }

    @Override
    public void writeHtmlAttributeValue(CodeRenderingContext context, IrHtmlAttributeValue node) {
        writeLiteral(context, node.prefix + htmlText(node));
    }

    @Override
    public void writeExpressionAttributeValue(CodeRenderingContext context, IrExpressionAttributeValue node) {
        writeLiteral(context, node.prefix);
        writeExpressionCall(context, node);
    }

    @Override
    public void writeCodeAttributeValue(CodeRenderingContext context, IrCodeAttributeValue node) {
        writeLiteral(context, node.prefix);
        writeCode(context, node);
    }

    protected void writeLiteral(CodeRenderingContext context, String text) {
        if (text == null || text.isEmpty()) return;
        context.codeWriter()
                .writeStartMethodInvocation(writeLiteralMethod())
                .writeStringLiteral(text)
                .writeEndMethodInvocation();
    }

    private void writeExpressionCall(CodeRenderingContext context, IrNode node) {
        CodeWriter writer = context.codeWriter();
        try (CodeWriter.Block pragma = writer.buildLinePragma(node.source)) {
            writer.writeStartMethodInvocation(writeExpressionMethod());
            renderCode(context, node);
            writer.writeEndMethodInvocation();
        }
    }

    private static void writeCode(CodeRenderingContext context, IrNode node) {
        CodeWriter writer = context.codeWriter();
        try (CodeWriter.Block pragma = writer.buildLinePragma(node.source)) {
            renderCode(context, node);
            writer.ensureNewLine();
        }
    }

    /** Code tokens are written verbatim; anything else (e.g. a template) goes back through the driver. */
    static void renderCode(CodeRenderingContext context, IrNode node) {
        for (IrNode child : node.children) {
            if (child instanceof IrToken && ((IrToken) child).code()) {
                context.codeWriter().write(((IrToken) child).content);
            } else {
                context.renderNode(child);
            }
        }
    }

    static String htmlText(IrNode node) {
        StringBuilder sb = new StringBuilder();
        for (IrNode child : node.children) {
            if (child instanceof IrToken && ((IrToken) child).html()) {
                sb.append(((IrToken) child).content);
            }
        }
        return sb.toString();
    }
}
