package info.isaksson.erland.tagcodegen.emitter;

/**
 * Recoverable problems found while generating tag helper code.
 *
 * <p>Codes are stable across versions; message templates take positional {@code %s} arguments.</p>
 */
public enum DiagnosticKind {

    CODE_BLOCK_NOT_SUPPORTED_IN_ATTRIBUTE(
            "TH1001",
            Severity.ERROR,
            "Code blocks (e.g. @{var variable = 23;}) must not appear in non-string tag helper attribute values. "
                    + "Already in an expression (code) context. If necessary an explicit expression (e.g. @(@readonly)) may be used."),

    TEMPLATE_NOT_SUPPORTED_IN_ATTRIBUTE(
            "TH1002",
            Severity.ERROR,
            "Inline markup blocks (e.g. @<p>content</p>) must not appear in non-string tag helper attribute values. "
                    + "Expected a '%s' attribute value, not a string.");

    public final String code;
    public final Severity severity;
    private final String messageTemplate;

    DiagnosticKind(String code, Severity severity, String messageTemplate) {
        this.code = code;
        this.severity = severity;
        this.messageTemplate = messageTemplate;
    }

    public String format(Object... args) {
        return args == null || args.length == 0 ? messageTemplate : String.format(messageTemplate, args);
    }
}
