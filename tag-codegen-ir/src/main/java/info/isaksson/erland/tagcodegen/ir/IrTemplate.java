package info.isaksson.erland.tagcodegen.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Inline markup passed around as a value (a delegate rendering its children). */
public final class IrTemplate extends IrNode {

    @JsonCreator
    public IrTemplate(
            @JsonProperty("children") List<IrNode> children,
            @JsonProperty("source") IrSourceSpan source
    ) {
        super(children, source);
    }

    public static IrTemplate of(IrNode... children) {
        return new IrTemplate(List.of(children), null);
    }

    @Override
    public IrNodeKind kind() {
        return IrNodeKind.TEMPLATE;
    }
}
