package info.isaksson.erland.tagcodegen.codegen;

import info.isaksson.erland.tagcodegen.ir.IrTagHelper;

/**
 * Writer active inside a tag helper body lambda. Nested tag occurrences are hidden from line
 * mapping while their scaffolding is written.
 */
public final class TagHelperBodyNodeWriter extends RuntimeNodeWriter {

    @Override
    public void beginTagHelper(CodeRenderingContext context, IrTagHelper node) {
        context.codeWriter().ensureNewLine().writeLine("#line hidden");
    }

    @Override
    public void endTagHelper(CodeRenderingContext context, IrTagHelper node) {
        context.codeWriter().ensureNewLine().writeLine("#line default");
    }
}
