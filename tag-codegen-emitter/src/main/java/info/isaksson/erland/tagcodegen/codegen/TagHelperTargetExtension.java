package info.isaksson.erland.tagcodegen.codegen;

import info.isaksson.erland.tagcodegen.ir.IrTagHelperBody;
import info.isaksson.erland.tagcodegen.ir.IrTagHelperCreate;
import info.isaksson.erland.tagcodegen.ir.IrTagHelperExecute;
import info.isaksson.erland.tagcodegen.ir.IrTagHelperHtmlAttribute;
import info.isaksson.erland.tagcodegen.ir.IrTagHelperProperty;
import info.isaksson.erland.tagcodegen.ir.IrTagHelperRuntime;

/** Emits the statements for each tag helper node kind. */
public interface TagHelperTargetExtension {

    void writeTagHelperBody(CodeRenderingContext context, IrTagHelperBody node);

    void writeTagHelperCreate(CodeRenderingContext context, IrTagHelperCreate node);

    void writeTagHelperExecute(CodeRenderingContext context, IrTagHelperExecute node);

    void writeTagHelperHtmlAttribute(CodeRenderingContext context, IrTagHelperHtmlAttribute node);

    void writeTagHelperProperty(CodeRenderingContext context, IrTagHelperProperty node);

    void writeTagHelperRuntime(CodeRenderingContext context, IrTagHelperRuntime node);
}
