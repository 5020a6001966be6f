package info.isaksson.erland.tagcodegen.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Runs the tag helpers of the enclosing occurrence and writes their output. */
public final class IrTagHelperExecute extends IrNode {

    @JsonCreator
    public IrTagHelperExecute(
            @JsonProperty("children") List<IrNode> children,
            @JsonProperty("source") IrSourceSpan source
    ) {
        super(children, source);
    }

    public static IrTagHelperExecute of(IrNode... children) {
        return new IrTagHelperExecute(List.of(children), null);
    }

    @Override
    public IrNodeKind kind() {
        return IrNodeKind.TAG_HELPER_EXECUTE;
    }
}
