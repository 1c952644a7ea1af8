package de.bsommerfeld.gridkeeper.client;

import java.util.Locale;

/**
 * Maps daemon error text to an {@link ErrorClass}.
 */
public final class DaemonErrorClassifier {

    private static final String NO_SUCH_TABLE = "no such table";
    private static final String METADATA_SUFFIX = "_metadata";
    private static final String DUPLICATE_COLUMN = "duplicate column name";

    private DaemonErrorClassifier() {
    }

    public static ErrorClass classify(String errorText) {
        if (errorText == null)
            return ErrorClass.FATAL;
        String text = errorText.toLowerCase(Locale.ROOT);
        if (text.contains(NO_SUCH_TABLE) && text.contains(METADATA_SUFFIX))
            return ErrorClass.MISSING_METADATA_TABLE;
        if (text.contains(DUPLICATE_COLUMN))
            return ErrorClass.DUPLICATE_COLUMN;
        return ErrorClass.FATAL;
    }
}
