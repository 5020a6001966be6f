package info.isaksson.erland.tagcodegen.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * One occurrence of a tag bound to tag helpers. Its children are, in order, the body, the
 * create nodes, property and html attribute nodes, and the execute node.
 */
@JsonPropertyOrder({"tagName","tagMode","children","source"})
public final class IrTagHelper extends IrNode {
    public final String tagName;
    public final TagMode tagMode;

    @JsonCreator
    public IrTagHelper(
            @JsonProperty("tagName") String tagName,
            @JsonProperty("tagMode") TagMode tagMode,
            @JsonProperty("children") List<IrNode> children,
            @JsonProperty("source") IrSourceSpan source
    ) {
        super(children, source);
        this.tagName = requireText(tagName, "a tagName", IrTagHelper.class);
        this.tagMode = tagMode == null ? TagMode.START_TAG_AND_END_TAG : tagMode;
    }

    @Override
    public IrNodeKind kind() {
        return IrNodeKind.TAG_HELPER;
    }
}
