package ai.svgtranslate.config;

import java.util.Locale;

/**
 * What the command line does with its input files.
 */
public enum Mode {
    /** Write the translations found in the inputs to a mapping file. */
    EXTRACT,
    /** Add the translations of the mapping files to every input. */
    INJECT,
    /** Carry the translations of a source file over to the inputs. */
    COPY;

    public static Mode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return INJECT;
        }
        for (Mode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported mode: " + raw);
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
