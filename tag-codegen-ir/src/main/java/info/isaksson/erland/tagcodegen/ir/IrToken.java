package info.isaksson.erland.tagcodegen.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Raw text leaf. Tokens never have children.
 */
@JsonPropertyOrder({"tokenKind","content","source"})
public final class IrToken extends IrNode {
    public final IrTokenKind tokenKind;

    @JsonInclude(JsonInclude.Include.ALWAYS)
    public final String content;

    @JsonCreator
    public IrToken(
            @JsonProperty("tokenKind") IrTokenKind tokenKind,
            @JsonProperty("content") String content,
            @JsonProperty("source") IrSourceSpan source
    ) {
        super(List.of(), source);
        if (tokenKind == null) throw new IllegalArgumentException("IrToken requires a tokenKind");
        this.tokenKind = tokenKind;
        this.content = content == null ? "" : content;
    }

    public static IrToken html(String content) {
        return new IrToken(IrTokenKind.HTML, content, null);
    }

    public static IrToken code(String content) {
        return new IrToken(IrTokenKind.CODE, content, null);
    }

    public static IrToken code(String content, IrSourceSpan source) {
        return new IrToken(IrTokenKind.CODE, content, source);
    }

    public boolean code() {
        return tokenKind == IrTokenKind.CODE;
    }

    public boolean html() {
        return tokenKind == IrTokenKind.HTML;
    }

    @Override
    public IrNodeKind kind() {
        return IrNodeKind.TOKEN;
    }
}
