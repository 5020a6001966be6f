package info.isaksson.erland.tagcodegen.ir;

/** What a token's text is: literal markup content or embedded host-language code. */
public enum IrTokenKind {
    HTML,
    CODE
}
