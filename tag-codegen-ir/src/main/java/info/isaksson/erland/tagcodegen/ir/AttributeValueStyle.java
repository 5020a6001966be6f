package info.isaksson.erland.tagcodegen.ir;

/**
 * How an attribute value was written (quoted, unquoted or minimized). Passed through to the
 * runtime so the attribute is serialized back the same way.
 */
public enum AttributeValueStyle {
    DOUBLE_QUOTES("DoubleQuotes"),
    SINGLE_QUOTES("SingleQuotes"),
    NO_QUOTES("NoQuotes"),
    MINIMIZED("Minimized");

    private final String runtimeName;

    AttributeValueStyle(String runtimeName) {
        this.runtimeName = runtimeName;
    }

    public String runtimeName() {
        return runtimeName;
    }
}
