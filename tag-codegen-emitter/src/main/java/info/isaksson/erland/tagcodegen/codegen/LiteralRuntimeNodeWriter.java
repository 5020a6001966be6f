package info.isaksson.erland.tagcodegen.codegen;

import info.isaksson.erland.tagcodegen.ir.IrTagHelper;

/**
 * Captures a string-typed property value: expressions are written as literals into the
 * attribute buffer. Tag occurrences cannot be nested inside such a value.
 */
public final class LiteralRuntimeNodeWriter extends RuntimeNodeWriter {

    @Override
    protected String writeExpressionMethod() {
        return TagHelperSymbols.WRITE_LITERAL_METHOD;
    }

    @Override
    public void beginTagHelper(CodeRenderingContext context, IrTagHelper node) {
        throw new IllegalStateException("Tag helper '" + node.tagName + "' cannot be nested inside a string attribute value");
    }
}
