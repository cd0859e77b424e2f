package ai.svgtranslate.prepare;

import java.util.List;
import java.util.Objects;
import org.w3c.dom.Element;

/**
 * Raised when an SVG document violates the translatable structure. Carries the error code,
 * the offending element (diagnostics only) and optional context values such as the invalid id.
 */
public class SvgStructureException extends RuntimeException {

    private final StructureError error;
    private final transient Element element;
    private final List<String> extra;

    public SvgStructureException(StructureError error, Element element, List<String> extra) {
        super(formatMessage(error, extra));
        this.error = Objects.requireNonNull(error, "error");
        this.element = element;
        this.extra = extra == null ? List.of() : List.copyOf(extra);
    }

    public SvgStructureException(StructureError error, Element element) {
        this(error, element, List.of());
    }

    public SvgStructureException(StructureError error) {
        this(error, null, List.of());
    }

    public StructureError error() {
        return error;
    }

    public String code() {
        return error.code();
    }

    public Element element() {
        return element;
    }

    public List<String> extra() {
        return extra;
    }

    private static String formatMessage(StructureError error, List<String> extra) {
        String message = Objects.requireNonNull(error, "error").messageKey();
        if (extra == null || extra.isEmpty()) {
            return message;
        }
        return message + ": " + extra;
    }
}
