package ai.svgtranslate.inject;

/**
 * @param overwrite       replace the text of languages the switch already carries
 * @param caseInsensitive match fallback texts against mapping keys ignoring case
 */
public record InjectionOptions(boolean overwrite, boolean caseInsensitive) {

    public static InjectionOptions defaults() {
        return new InjectionOptions(false, true);
    }
}
