package app.toolwatch.audit;

/**
 * Where audit events go.
 */
public enum AuditMode {
    /** Kein Audit. */
    NONE,
    /** JSON Lines in eine lokale Datei. */
    FILE,
    /** POST an den Collector. */
    HTTP,
    /** Datei und HTTP, unabhängig voneinander. */
    BOTH,
    /** HTTP, bei Fehler in die Datei (später per {@code drain} nachsenden). */
    HTTP_WITH_FALLBACK;

    public boolean writesFile() {
        return this == FILE || this == BOTH;
    }
}
