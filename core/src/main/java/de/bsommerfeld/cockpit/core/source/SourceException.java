package de.bsommerfeld.cockpit.core.source;

/**
 * Failure reported by an upstream source. Callers in the core treat every
 * {@link Kind} the same way ("this poll failed"); the kind only matters for
 * the few places that react to {@link Kind#NOT_FOUND}, such as the search
 * fallback from id lookup to full-text search.
 */
public class SourceException extends Exception {

    public enum Kind {
        NETWORK,
        AUTH,
        RATE_LIMIT,
        NOT_FOUND,
        API_ERROR,
        PARSE_ERROR,
        CONFIG
    }

    private final Kind kind;

    public SourceException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SourceException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static SourceException notFound(String what) {
        return new SourceException(Kind.NOT_FOUND, "Resource not found: " + what);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isNotFound() {
        return kind == Kind.NOT_FOUND;
    }
}
