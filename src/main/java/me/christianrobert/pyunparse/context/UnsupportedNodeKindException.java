package me.christianrobert.pyunparse.context;

/**
 * Raised when a node kind has no rendering rule (or, on ingestion, no node class).
 *
 * <p>Never caught inside the generator: the whole conversion is aborted and no partial source
 * is returned. Dropping the subtree instead would produce valid-looking but wrong output.</p>
 */
public class UnsupportedNodeKindException extends SourceGenerationException {

    public UnsupportedNodeKindException(String kind) {
        super("Unsupported node kind: " + kind, kind);
    }
}
