package info.isaksson.erland.tagcodegen.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Content between the start and end tag of a tag occurrence. */
public final class IrTagHelperBody extends IrNode {

    @JsonCreator
    public IrTagHelperBody(
            @JsonProperty("children") List<IrNode> children,
            @JsonProperty("source") IrSourceSpan source
    ) {
        super(children, source);
    }

    public static IrTagHelperBody of(IrNode... children) {
        return new IrTagHelperBody(List.of(children), null);
    }

    @Override
    public IrNodeKind kind() {
        return IrNodeKind.TAG_HELPER_BODY;
    }
}
