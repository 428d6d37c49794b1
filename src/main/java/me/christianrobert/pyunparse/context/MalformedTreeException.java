package me.christianrobert.pyunparse.context;

/**
 * Thrown when an ingested tree is structurally invalid: missing kind tag, missing required
 * field, wrong JSON shape, or a field combination a node constructor rejects.
 */
public class MalformedTreeException extends SourceGenerationException {

    public MalformedTreeException(String message) {
        super(message);
    }

    public MalformedTreeException(String message, String kind) {
        super(message, kind);
    }

    public MalformedTreeException(String message, String kind, Throwable cause) {
        super(message, kind, cause);
    }
}
