package info.isaksson.erland.tagcodegen.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * A node of the intermediate tree handed to the code generator.
 *
 * <p>Nodes are immutable; a parent owns its children, the tree has no cycles and no shared
 * subtrees. The concrete class is identified by {@link #kind()}, which is also the
 * {@code "kind"} discriminator in IR JSON.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = IrDocument.class, name = "DOCUMENT"),
        @JsonSubTypes.Type(value = IrTagHelper.class, name = "TAG_HELPER"),
        @JsonSubTypes.Type(value = IrTagHelperBody.class, name = "TAG_HELPER_BODY"),
        @JsonSubTypes.Type(value = IrTagHelperCreate.class, name = "TAG_HELPER_CREATE"),
        @JsonSubTypes.Type(value = IrTagHelperExecute.class, name = "TAG_HELPER_EXECUTE"),
        @JsonSubTypes.Type(value = IrTagHelperHtmlAttribute.class, name = "TAG_HELPER_HTML_ATTRIBUTE"),
        @JsonSubTypes.Type(value = IrTagHelperProperty.class, name = "TAG_HELPER_PROPERTY"),
        @JsonSubTypes.Type(value = IrTagHelperRuntime.class, name = "TAG_HELPER_RUNTIME"),
        @JsonSubTypes.Type(value = IrToken.class, name = "TOKEN"),
        @JsonSubTypes.Type(value = IrHtmlContent.class, name = "HTML_CONTENT"),
        @JsonSubTypes.Type(value = IrExpression.class, name = "EXPRESSION"),
        @JsonSubTypes.Type(value = IrCodeBlock.class, name = "CODE_BLOCK"),
        @JsonSubTypes.Type(value = IrTemplate.class, name = "TEMPLATE"),
        @JsonSubTypes.Type(value = IrHtmlAttributeValue.class, name = "HTML_ATTRIBUTE_VALUE"),
        @JsonSubTypes.Type(value = IrExpressionAttributeValue.class, name = "EXPRESSION_ATTRIBUTE_VALUE"),
        @JsonSubTypes.Type(value = IrCodeAttributeValue.class, name = "CODE_ATTRIBUTE_VALUE")
})
public abstract class IrNode {

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final List<IrNode> children;

    /** Optional position in the template; null for synthesized nodes. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final IrSourceSpan source;

    protected IrNode(List<IrNode> children, IrSourceSpan source) {
        if (children == null) {
            this.children = List.of();
        } else {
            for (IrNode child : children) {
                if (child == null) throw new IllegalArgumentException(getClass().getSimpleName() + " must not contain null children");
            }
            this.children = List.copyOf(children);
        }
        this.source = source;
    }

    public abstract IrNodeKind kind();

    /** Number of nodes in this subtree, this node included. */
    public int subtreeSize() {
        int n = 1;
        for (IrNode child : children) n += child.subtreeSize();
        return n;
    }

    @Override public String toString() {
        return kind() + (source == null ? "" : "@" + source) + (children.isEmpty() ? "" : children.toString());
    }

    static String requireText(String value, String what, Class<?> owner) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(owner.getSimpleName() + " requires " + what);
        }
        return value;
    }
}
