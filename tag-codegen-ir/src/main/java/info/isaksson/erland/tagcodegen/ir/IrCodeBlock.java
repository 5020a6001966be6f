package info.isaksson.erland.tagcodegen.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** An embedded host-language statement block. */
public final class IrCodeBlock extends IrNode {

    @JsonCreator
    public IrCodeBlock(
            @JsonProperty("children") List<IrNode> children,
            @JsonProperty("source") IrSourceSpan source
    ) {
        super(children, source);
    }

    public static IrCodeBlock of(IrNode... children) {
        return new IrCodeBlock(List.of(children), null);
    }

    /** Code block made of a single code token. */
    public static IrCodeBlock code(String statements) {
        return new IrCodeBlock(List.of(IrToken.code(statements)), null);
    }

    @Override
    public IrNodeKind kind() {
        return IrNodeKind.CODE_BLOCK;
    }
}
