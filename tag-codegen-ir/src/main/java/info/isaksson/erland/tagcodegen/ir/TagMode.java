package info.isaksson.erland.tagcodegen.ir;

/** How a tag occurrence was written in the template. */
public enum TagMode {
    SELF_CLOSING("SelfClosing"),
    START_TAG_AND_END_TAG("StartTagAndEndTag"),
    START_TAG_ONLY("StartTagOnly");

    private final String runtimeName;

    TagMode(String runtimeName) {
        this.runtimeName = runtimeName;
    }

    /** Member name of the runtime library's tag mode enumeration. */
    public String runtimeName() {
        return runtimeName;
    }
}
