package info.isaksson.erland.tagcodegen.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Class-level scaffolding (buffer, execution context, runner, scope manager) for one generation unit. */
public final class IrTagHelperRuntime extends IrNode {

    @JsonCreator
    public IrTagHelperRuntime(
            @JsonProperty("children") List<IrNode> children,
            @JsonProperty("source") IrSourceSpan source
    ) {
        super(children, source);
    }

    public static IrTagHelperRuntime of(IrNode... children) {
        return new IrTagHelperRuntime(List.of(children), null);
    }

    @Override
    public IrNodeKind kind() {
        return IrNodeKind.TAG_HELPER_RUNTIME;
    }
}
