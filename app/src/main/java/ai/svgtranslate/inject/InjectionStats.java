package ai.svgtranslate.inject;

/**
 * Counters describing what an injection changed. Stats of several documents combine with {@link #plus}.
 */
public record InjectionStats(int processedSwitches,
                             int insertedTranslations,
                             int updatedTranslations,
                             int skippedTranslations,
                             int newLanguages,
                             int structuralErrors) {

    private static final InjectionStats EMPTY = new InjectionStats(0, 0, 0, 0, 0, 0);

    public InjectionStats {
        if (processedSwitches < 0 || insertedTranslations < 0 || updatedTranslations < 0
                || skippedTranslations < 0 || newLanguages < 0 || structuralErrors < 0) {
            throw new IllegalArgumentException("counters must not be negative");
        }
    }

    public static InjectionStats empty() {
        return EMPTY;
    }

    public static InjectionStats structuralError() {
        return new InjectionStats(0, 0, 0, 0, 0, 1);
    }

    public InjectionStats plus(InjectionStats other) {
        return new InjectionStats(
                processedSwitches + other.processedSwitches,
                insertedTranslations + other.insertedTranslations,
                updatedTranslations + other.updatedTranslations,
                skippedTranslations + other.skippedTranslations,
                newLanguages + other.newLanguages,
                structuralErrors + other.structuralErrors);
    }

    public boolean hasChanges() {
        return insertedTranslations > 0 || updatedTranslations > 0;
    }
}
