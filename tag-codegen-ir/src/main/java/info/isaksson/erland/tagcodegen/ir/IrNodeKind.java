package info.isaksson.erland.tagcodegen.ir;

/**
 * Closed set of IR node kinds. The emitter dispatches on this tag, one handler per kind.
 */
public enum IrNodeKind {
    DOCUMENT,
    TAG_HELPER,
    TAG_HELPER_BODY,
    TAG_HELPER_CREATE,
    TAG_HELPER_EXECUTE,
    TAG_HELPER_HTML_ATTRIBUTE,
    TAG_HELPER_PROPERTY,
    TAG_HELPER_RUNTIME,
    TOKEN,
    HTML_CONTENT,
    EXPRESSION,
    CODE_BLOCK,
    TEMPLATE,
    HTML_ATTRIBUTE_VALUE,
    EXPRESSION_ATTRIBUTE_VALUE,
    CODE_ATTRIBUTE_VALUE
}
