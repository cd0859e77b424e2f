package ai.svgtranslate.prepare;

/**
 * Structural violations that make an SVG unsuitable for translation.
 */
public enum StructureError {
    NO_DOC_ELEMENT("no-doc-element"),
    CONTAINS_TREF("contains-tref"),
    CSS_TOO_COMPLEX("css-too-complex"),
    CSS_HAS_IDS("css-has-ids"),
    NESTED_TSPANS_NOT_SUPPORTED("nested-tspans-not-supported"),
    NON_TSPAN_INSIDE_TEXT("non-tspan-inside-text"),
    INVALID_NODE_ID("invalid-node-id"),
    TEXT_CONTAINS_DOLLAR("text-contains-dollar"),
    NO_PARENT_FOR_TEXT("no-parent-for-text"),
    SWITCH_CHILD_NOT_TEXT("switch-child-not-text"),
    SWITCH_TEXT_CONTENT_OUTSIDE_TEXT("switch-text-content-outside-text"),
    MULTIPLE_LANG_IN_TEXT("multiple-lang-in-text"),
    MULTIPLE_TEXT_SAME_LANG("multiple-text-same-lang");

    private final String code;

    StructureError(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public String messageKey() {
        return "structure-error-" + code;
    }
}
