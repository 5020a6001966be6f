package info.isaksson.erland.tagcodegen.codegen;

import info.isaksson.erland.tagcodegen.emitter.EmitterOptions;
import info.isaksson.erland.tagcodegen.emitter.TagHelperEmitter;
import info.isaksson.erland.tagcodegen.emitter.UniqueIdStrategy;
import info.isaksson.erland.tagcodegen.ir.AttributeValueStyle;
import info.isaksson.erland.tagcodegen.ir.IrBoundAttribute;
import info.isaksson.erland.tagcodegen.ir.IrDocument;
import info.isaksson.erland.tagcodegen.ir.IrNode;
import info.isaksson.erland.tagcodegen.ir.IrSourceSpan;
import info.isaksson.erland.tagcodegen.ir.IrTagHelper;
import info.isaksson.erland.tagcodegen.ir.IrTagHelperProperty;
import info.isaksson.erland.tagcodegen.ir.TagMode;

import java.util.List;

/** Small builders for tag helper IR used across the code generation tests. */
public final class TagHelperFixtures {
    private TagHelperFixtures() {}

    public static final String FILE = "Views/Home/Index.cshtml";
    public static final String FIELD = "__FooTagHelper";
    public static final String TYPE = "Shop.Web.FooTagHelper";

    public static IrSourceSpan span(int absoluteIndex, int lineIndex, int characterIndex, int length) {
        return new IrSourceSpan(FILE, absoluteIndex, lineIndex, characterIndex, length);
    }

    public static IrDocument document(IrNode... children) {
        return IrDocument.of(FILE, children);
    }

    public static IrTagHelper tagHelper(String tagName, IrNode... children) {
        return new IrTagHelper(tagName, TagMode.START_TAG_AND_END_TAG, List.of(children), null);
    }

    public static IrTagHelperProperty property(String attributeName, IrBoundAttribute bound, IrNode... children) {
        return new IrTagHelperProperty(attributeName, AttributeValueStyle.DOUBLE_QUOTES, FIELD, TYPE, bound, false, List.of(children), null);
    }

    public static IrTagHelperProperty property(String attributeName, IrBoundAttribute bound, IrSourceSpan source, IrNode... children) {
        return new IrTagHelperProperty(attributeName, AttributeValueStyle.DOUBLE_QUOTES, FIELD, TYPE, bound, false, List.of(children), source);
    }

    public static IrTagHelperProperty indexerProperty(String attributeName, IrBoundAttribute bound, IrNode... children) {
        return new IrTagHelperProperty(attributeName, AttributeValueStyle.DOUBLE_QUOTES, FIELD, TYPE, bound, true, List.of(children), null);
    }

    public static EmitterOptions runtime() {
        return EmitterOptions.runtime().withUniqueIds(UniqueIdStrategy.counter());
    }

    public static EmitterOptions designTime() {
        return EmitterOptions.designTime().withUniqueIds(UniqueIdStrategy.counter());
    }

    public static TagHelperEmitter.Result emit(IrDocument document, EmitterOptions options) {
        return new TagHelperEmitter().emit(document, options);
    }

    public static int count(String haystack, String needle) {
        int n = 0;
        int i = haystack.indexOf(needle);
        while (i >= 0) {
            n++;
            i = haystack.indexOf(needle, i + needle.length());
        }
        return n;
    }
}
