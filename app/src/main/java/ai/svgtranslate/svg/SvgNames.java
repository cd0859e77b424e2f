package ai.svgtranslate.svg;

/**
 * Element and attribute names of the SVG vocabulary handled by the translator.
 */
public final class SvgNames {

    public static final String SVG_NAMESPACE = "http://www.w3.org/2000/svg";

    public static final String SWITCH = "switch";
    public static final String TEXT = "text";
    public static final String TSPAN = "tspan";
    public static final String TREF = "tref";
    public static final String STYLE = "style";

    public static final String ATTR_ID = "id";
    public static final String ATTR_SYSTEM_LANGUAGE = "systemLanguage";
    public static final String ATTR_STYLE = "style";

    private SvgNames() {
    }
}
