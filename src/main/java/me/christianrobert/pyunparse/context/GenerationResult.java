package me.christianrobert.pyunparse.context;

/**
 * Result of a source generation request.
 * Contains either the complete generated source or an error message, never both.
 */
public class GenerationResult {

    private final boolean success;
    private final String source;
    private final String errorMessage;
    private final String kind;

    private GenerationResult(boolean success, String source, String errorMessage, String kind) {
        this.success = success;
        this.source = source;
        this.errorMessage = errorMessage;
        this.kind = kind;
    }

    /**
     * Creates a successful generation result.
     */
    public static GenerationResult success(String source) {
        return new GenerationResult(true, source, null, null);
    }

    /**
     * Creates a failed generation result.
     */
    public static GenerationResult failure(String errorMessage) {
        return new GenerationResult(false, null, errorMessage, null);
    }

    /**
     * Creates a failed generation result from an exception, keeping the offending node kind.
     */
    public static GenerationResult failure(SourceGenerationException exception) {
        return new GenerationResult(false, null, exception.getDetailedMessage(), exception.getKind());
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public String getSource() {
        return source;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    /**
     * @return Kind name of the node that caused the failure, or null
     */
    public String getKind() {
        return kind;
    }

    @Override
    public String toString() {
        if (success) {
            return "GenerationResult{success=true, source='" + source + "'}";
        } else {
            return "GenerationResult{success=false, error='" + errorMessage + "'}";
        }
    }
}
