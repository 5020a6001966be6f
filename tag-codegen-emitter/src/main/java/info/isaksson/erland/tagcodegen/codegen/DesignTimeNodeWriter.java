package info.isaksson.erland.tagcodegen.codegen;

import info.isaksson.erland.tagcodegen.ir.IrCodeAttributeValue;
import info.isaksson.erland.tagcodegen.ir.IrCodeBlock;
import info.isaksson.erland.tagcodegen.ir.IrExpression;
import info.isaksson.erland.tagcodegen.ir.IrExpressionAttributeValue;
import info.isaksson.erland.tagcodegen.ir.IrHtmlAttributeValue;
import info.isaksson.erland.tagcodegen.ir.IrHtmlContent;
import info.isaksson.erland.tagcodegen.ir.IrNode;
import info.isaksson.erland.tagcodegen.ir.IrToken;

/**
 * Design-time writer. Markup is dropped; code is kept at its template column and mapped back to
 * the template so tooling can analyse it.
 */
public final class DesignTimeNodeWriter extends NodeWriter {

    private static final String EXPRESSION_PREFIX = TagHelperSymbols.DESIGN_TIME_VARIABLE + " = ";

    @Override
    public void writeHtmlContent(CodeRenderingContext context, IrHtmlContent node) {
        // markup has no design-time representation
    }

    @Override
    public void writeExpression(CodeRenderingContext context, IrExpression node) {
        writeDesignTimeExpression(context, node);
    }

    @Override
    public void writeCodeBlock(CodeRenderingContext context, IrCodeBlock node) {
        writeDesignTimeCode(context, node);
    }

    @Override
    public void writeHtmlAttributeValue(CodeRenderingContext context, IrHtmlAttributeValue node) {
    }

    @Override
    public void writeExpressionAttributeValue(CodeRenderingContext context, IrExpressionAttributeValue node) {
        writeDesignTimeExpression(context, node);
    }

    @Override
    public void writeCodeAttributeValue(CodeRenderingContext context, IrCodeAttributeValue node) {
        writeDesignTimeCode(context, node);
    }

    private static void writeDesignTimeExpression(CodeRenderingContext context, IrNode node) {
        CodeWriter writer = context.codeWriter();
        try (CodeWriter.Block pragma = writer.buildLinePragma(node.source)) {
            writer.writePadding(EXPRESSION_PREFIX.length(), node.source);
            writer.write(EXPRESSION_PREFIX);
            renderMappedCode(context, node);
            writer.writeLine(";");
        }
    }

    private static void writeDesignTimeCode(CodeRenderingContext context, IrNode node) {
        CodeWriter writer = context.codeWriter();
        try (CodeWriter.Block pragma = writer.buildLinePragma(node.source)) {
            writer.writePadding(0, node.source);
            renderMappedCode(context, node);
            writer.ensureNewLine();
        }
    }

    private static void renderMappedCode(CodeRenderingContext context, IrNode node) {
        for (IrNode child : node.children) {
            if (child instanceof IrToken && ((IrToken) child).code()) {
                context.addLineMappingFor(child);
                context.codeWriter().write(((IrToken) child).content);
            } else {
                context.renderNode(child);
            }
        }
    }
}
