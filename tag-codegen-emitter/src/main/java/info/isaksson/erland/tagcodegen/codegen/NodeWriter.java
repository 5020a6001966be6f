package info.isaksson.erland.tagcodegen.codegen;

import info.isaksson.erland.tagcodegen.ir.IrCodeAttributeValue;
import info.isaksson.erland.tagcodegen.ir.IrCodeBlock;
import info.isaksson.erland.tagcodegen.ir.IrExpression;
import info.isaksson.erland.tagcodegen.ir.IrExpressionAttributeValue;
import info.isaksson.erland.tagcodegen.ir.IrHtmlAttributeValue;
import info.isaksson.erland.tagcodegen.ir.IrHtmlContent;
import info.isaksson.erland.tagcodegen.ir.IrTagHelper;

/**
 * Decides how leaf content becomes statements in the current buffering scope.
 *
 * <p>The active writer is the top of the rendering context's writer stack.</p>
 */
public abstract class NodeWriter {

    public abstract void writeHtmlContent(CodeRenderingContext context, IrHtmlContent node);

    public abstract void writeExpression(CodeRenderingContext context, IrExpression node);

    public abstract void writeCodeBlock(CodeRenderingContext context, IrCodeBlock node);

    public abstract void writeHtmlAttributeValue(CodeRenderingContext context, IrHtmlAttributeValue node);

    public abstract void writeExpressionAttributeValue(CodeRenderingContext context, IrExpressionAttributeValue node);

    public abstract void writeCodeAttributeValue(CodeRenderingContext context, IrCodeAttributeValue node);

    /** Called before a nested tag occurrence is rendered under this writer. */
    public void beginTagHelper(CodeRenderingContext context, IrTagHelper node) {
    }

    /** Called after a nested tag occurrence has been rendered under this writer. */
    public void endTagHelper(CodeRenderingContext context, IrTagHelper node) {
    }
}
