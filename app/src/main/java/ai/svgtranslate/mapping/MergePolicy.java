package ai.svgtranslate.mapping;

/**
 * Decides which translation survives when two sources provide one for the same text and language.
 */
public enum MergePolicy {
    FIRST_WINS,
    LAST_WINS;

    boolean replaces(String existing) {
        return existing == null || this == LAST_WINS;
    }
}
