package info.isaksson.erland.tagcodegen.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Literal markup; its children are HTML tokens. */
public final class IrHtmlContent extends IrNode {

    @JsonCreator
    public IrHtmlContent(
            @JsonProperty("children") List<IrNode> children,
            @JsonProperty("source") IrSourceSpan source
    ) {
        super(children, source);
    }

    public static IrHtmlContent text(String content) {
        return new IrHtmlContent(List.of(IrToken.html(content)), null);
    }

    /** Concatenated text of the HTML tokens directly below this node. */
    public String textContent() {
        StringBuilder sb = new StringBuilder();
        for (IrNode child : children) {
            if (child instanceof IrToken && ((IrToken) child).html()) {
                sb.append(((IrToken) child).content);
            }
        }
        return sb.toString();
    }

    @Override
    public IrNodeKind kind() {
        return IrNodeKind.HTML_CONTENT;
    }
}
