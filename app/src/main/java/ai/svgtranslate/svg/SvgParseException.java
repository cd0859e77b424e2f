package ai.svgtranslate.svg;

/**
 * Raised when an SVG source cannot be read or is not well-formed XML.
 */
public class SvgParseException extends RuntimeException {

    public static final String FILE_NOT_FOUND = "file-not-found";
    public static final String PARSE_ERROR = "parse-error";

    private final String code;

    public SvgParseException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String code() {
        return code;
    }
}
