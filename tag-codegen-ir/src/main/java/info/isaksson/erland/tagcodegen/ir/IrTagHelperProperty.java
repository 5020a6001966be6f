package info.isaksson.erland.tagcodegen.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Binds an attribute value to one property of a tag helper instance. Children are the value.
 */
@JsonPropertyOrder({"attributeName","attributeStructure","field","tagHelperTypeName","boundAttribute","indexerNameMatch","children","source"})
public final class IrTagHelperProperty extends IrNode {
    public final String attributeName;
    public final AttributeValueStyle attributeStructure;

    /** Field holding the tag helper instance (see {@link IrTagHelperCreate#field}). */
    public final String field;

    public final String tagHelperTypeName;
    public final IrBoundAttribute boundAttribute;

    /** True when the attribute matched the property's indexer prefix rather than its name. */
    public final boolean indexerNameMatch;

    @JsonCreator
    public IrTagHelperProperty(
            @JsonProperty("attributeName") String attributeName,
            @JsonProperty("attributeStructure") AttributeValueStyle attributeStructure,
            @JsonProperty("field") String field,
            @JsonProperty("tagHelperTypeName") String tagHelperTypeName,
            @JsonProperty("boundAttribute") IrBoundAttribute boundAttribute,
            @JsonProperty("indexerNameMatch") boolean indexerNameMatch,
            @JsonProperty("children") List<IrNode> children,
            @JsonProperty("source") IrSourceSpan source
    ) {
        super(children, source);
        this.attributeName = requireText(attributeName, "an attributeName", IrTagHelperProperty.class);
        this.field = requireText(field, "a field", IrTagHelperProperty.class);
        this.tagHelperTypeName = requireText(tagHelperTypeName, "a tagHelperTypeName", IrTagHelperProperty.class);
        if (boundAttribute == null) {
            throw new IllegalArgumentException("IrTagHelperProperty requires a boundAttribute: " + attributeName);
        }
        if (indexerNameMatch) {
            if (!boundAttribute.hasIndexer()) {
                throw new IllegalArgumentException("indexer match on '" + attributeName + "' but "
                        + boundAttribute.propertyName + " has no indexer prefix");
            }
            if (!attributeName.startsWith(boundAttribute.indexerNamePrefix)) {
                throw new IllegalArgumentException("attribute '" + attributeName + "' does not start with indexer prefix '"
                        + boundAttribute.indexerNamePrefix + "'");
            }
        }
        this.attributeStructure = attributeStructure == null ? AttributeValueStyle.DOUBLE_QUOTES : attributeStructure;
        this.boundAttribute = boundAttribute;
        this.indexerNameMatch = indexerNameMatch;
    }

    /** Key used in the indexer access expression: the attribute name without the indexer prefix. */
    public String indexerKey() {
        return indexerNameMatch ? attributeName.substring(boundAttribute.indexerNamePrefix.length()) : null;
    }

    @Override
    public IrNodeKind kind() {
        return IrNodeKind.TAG_HELPER_PROPERTY;
    }
}
