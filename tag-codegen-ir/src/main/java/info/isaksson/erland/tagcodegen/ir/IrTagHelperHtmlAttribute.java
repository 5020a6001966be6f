package info.isaksson.erland.tagcodegen.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * An attribute on a tag occurrence that no tag helper property binds. Children are the value
 * pieces.
 */
@JsonPropertyOrder({"attributeName","attributeStructure","children","source"})
public final class IrTagHelperHtmlAttribute extends IrNode {
    public final String attributeName;
    public final AttributeValueStyle attributeStructure;

    @JsonCreator
    public IrTagHelperHtmlAttribute(
            @JsonProperty("attributeName") String attributeName,
            @JsonProperty("attributeStructure") AttributeValueStyle attributeStructure,
            @JsonProperty("children") List<IrNode> children,
            @JsonProperty("source") IrSourceSpan source
    ) {
        super(children, source);
        this.attributeName = requireText(attributeName, "an attributeName", IrTagHelperHtmlAttribute.class);
        this.attributeStructure = attributeStructure == null ? AttributeValueStyle.DOUBLE_QUOTES : attributeStructure;
    }

    @Override
    public IrNodeKind kind() {
        return IrNodeKind.TAG_HELPER_HTML_ATTRIBUTE;
    }
}
