package org.contextql.model;

/**
 * The two textual forms a context document can be written in.
 */
public enum SourceFormat {
    /** A {@code ---} delimited structured block followed by free-form prose. */
    STRUCTURED,
    /** Plain prose whose structure is inferred from heading conventions. */
    CONVENTION;

    private static final String DELIMITER = "---";

    /**
     * Cheap prefix check deciding which parsing strategy applies.
     */
    public static SourceFormat detect(String text) {
        String s = text.startsWith("\uFEFF") ? text.substring(1) : text;
        int lineEnd = s.indexOf('\n');
        String firstLine = lineEnd < 0 ? s : s.substring(0, lineEnd);
        return firstLine.strip().equals(DELIMITER) ? STRUCTURED : CONVENTION;
    }
}
