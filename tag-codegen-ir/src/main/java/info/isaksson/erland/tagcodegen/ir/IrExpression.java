package info.isaksson.erland.tagcodegen.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** An embedded host-language expression; its children are the expression's tokens. */
public final class IrExpression extends IrNode {

    @JsonCreator
    public IrExpression(
            @JsonProperty("children") List<IrNode> children,
            @JsonProperty("source") IrSourceSpan source
    ) {
        super(children, source);
    }

    public static IrExpression of(IrNode... children) {
        return new IrExpression(List.of(children), null);
    }

    /** Expression made of a single code token. */
    public static IrExpression code(String expression) {
        return new IrExpression(List.of(IrToken.code(expression)), null);
    }

    @Override
    public IrNodeKind kind() {
        return IrNodeKind.EXPRESSION;
    }
}
