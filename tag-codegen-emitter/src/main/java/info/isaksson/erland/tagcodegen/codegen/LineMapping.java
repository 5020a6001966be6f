package info.isaksson.erland.tagcodegen.codegen;

import info.isaksson.erland.tagcodegen.ir.IrSourceSpan;

import java.util.Objects;

/** Maps a span of the template to the span of generated code that came from it. */
public final class LineMapping {

    public final IrSourceSpan original;
    public final IrSourceSpan generated;

    public LineMapping(IrSourceSpan original, IrSourceSpan generated) {
        this.original = Objects.requireNonNull(original, "original must not be null");
        this.generated = Objects.requireNonNull(generated, "generated must not be null");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LineMapping)) return false;
        LineMapping that = (LineMapping) o;
        return original.equals(that.original) && generated.equals(that.generated);
    }

    @Override
    public int hashCode() {
        return Objects.hash(original, generated);
    }

    @Override
    public String toString() {
        return original + " -> " + generated.absoluteIndex + "+" + generated.length;
    }
}
