package info.isaksson.erland.tagcodegen.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** Expression piece of an attribute value; children are code tokens. */
@JsonPropertyOrder({"prefix","children","source"})
public final class IrExpressionAttributeValue extends IrNode {

    /** Whitespace (or other literal text) written before the value piece. */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final String prefix;

    @JsonCreator
    public IrExpressionAttributeValue(
            @JsonProperty("prefix") String prefix,
            @JsonProperty("children") List<IrNode> children,
            @JsonProperty("source") IrSourceSpan source
    ) {
        super(children, source);
        this.prefix = prefix == null ? "" : prefix;
    }

    @Override
    public IrNodeKind kind() {
        return IrNodeKind.EXPRESSION_ATTRIBUTE_VALUE;
    }
}
