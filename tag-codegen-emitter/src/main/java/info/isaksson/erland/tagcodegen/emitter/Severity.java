package info.isaksson.erland.tagcodegen.emitter;

/** Diagnostic severity as reported to the host compiler. */
public enum Severity {
    ERROR("error");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
