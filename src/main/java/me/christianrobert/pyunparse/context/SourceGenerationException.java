package me.christianrobert.pyunparse.context;

/**
 * Exception thrown while turning a syntax tree into source text.
 * Captures the kind of the node being processed when it is known.
 */
public class SourceGenerationException extends RuntimeException {

    private final String kind;

    public SourceGenerationException(String message) {
        super(message);
        this.kind = null;
    }

    public SourceGenerationException(String message, Throwable cause) {
        super(message, cause);
        this.kind = null;
    }

    public SourceGenerationException(String message, String kind) {
        super(message);
        this.kind = kind;
    }

    public SourceGenerationException(String message, String kind, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * @return Kind name of the offending node, or null if not node-specific
     */
    public String getKind() {
        return kind;
    }

    /**
     * Gets a detailed error message including the node kind.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (kind != null) {
            sb.append("\nNode kind: ").append(kind);
        }
        return sb.toString();
    }
}
