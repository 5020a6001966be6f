package info.isaksson.erland.tagcodegen.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Position of a node in the original template. All indexes are zero based.
 */
@JsonPropertyOrder({"filePath","absoluteIndex","lineIndex","characterIndex","length"})
public final class IrSourceSpan {
    public final String filePath;
    public final int absoluteIndex;
    public final int lineIndex;
    public final int characterIndex;
    public final int length;

    @JsonCreator
    public IrSourceSpan(
            @JsonProperty("filePath") String filePath,
            @JsonProperty("absoluteIndex") int absoluteIndex,
            @JsonProperty("lineIndex") int lineIndex,
            @JsonProperty("characterIndex") int characterIndex,
            @JsonProperty("length") int length
    ) {
        if (absoluteIndex < 0 || lineIndex < 0 || characterIndex < 0 || length < 0) {
            throw new IllegalArgumentException("source span indexes must not be negative");
        }
        this.filePath = filePath == null ? "" : filePath;
        this.absoluteIndex = absoluteIndex;
        this.lineIndex = lineIndex;
        this.characterIndex = characterIndex;
        this.length = length;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrSourceSpan)) return false;
        IrSourceSpan that = (IrSourceSpan) o;
        return absoluteIndex == that.absoluteIndex &&
                lineIndex == that.lineIndex &&
                characterIndex == that.characterIndex &&
                length == that.length &&
                Objects.equals(filePath, that.filePath);
    }

    @Override public int hashCode() {
        return Objects.hash(filePath, absoluteIndex, lineIndex, characterIndex, length);
    }

    @Override public String toString() {
        return filePath + "(" + (lineIndex + 1) + "," + (characterIndex + 1) + ")";
    }
}
