package info.isaksson.erland.tagcodegen.codegen;

import info.isaksson.erland.tagcodegen.ir.TagMode;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/** State of one tag occurrence, alive while that occurrence's subtree is rendered. */
public final class TagHelperRenderingContext {

    private final String tagName;
    private final TagMode tagMode;
    private final Map<String, String> renderedBoundAttributes = new HashMap<>();
    private final Set<String> verifiedPropertyDictionaries = new HashSet<>();

    public TagHelperRenderingContext(String tagName, TagMode tagMode) {
        if (tagName == null || tagName.isBlank()) throw new IllegalArgumentException("tagName must not be blank");
        this.tagName = tagName;
        this.tagMode = tagMode == null ? TagMode.START_TAG_AND_END_TAG : tagMode;
    }

    public String tagName() {
        return tagName;
    }

    public TagMode tagMode() {
        return tagMode;
    }

    /** Attribute name to the access expression that already holds its value. */
    public Map<String, String> renderedBoundAttributes() {
        return renderedBoundAttributes;
    }

    /** {@code Type.Property} pairs whose dictionary storage has already been null-checked. */
    public Set<String> verifiedPropertyDictionaries() {
        return verifiedPropertyDictionaries;
    }
}
