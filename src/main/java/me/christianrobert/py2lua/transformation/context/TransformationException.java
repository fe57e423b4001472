package me.christianrobert.py2lua.transformation.context;

/**
 * Exception thrown during Python to Lua transformation.
 * Captures the offending source fragment and where in the pipeline it failed.
 */
public class TransformationException extends RuntimeException {

    private final String sourceFragment;
    private final String context;

    public TransformationException(String message) {
        super(message);
        this.sourceFragment = null;
        this.context = null;
    }

    public TransformationException(String message, String sourceFragment, String context) {
        super(message);
        this.sourceFragment = sourceFragment;
        this.context = context;
    }

    public TransformationException(String message, String sourceFragment, String context, Throwable cause) {
        super(message, cause);
        this.sourceFragment = sourceFragment;
        this.context = context;
    }

    public String getSourceFragment() {
        return sourceFragment;
    }

    public String getContext() {
        return context;
    }

    /**
     * Gets a detailed error message including the source fragment and context.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (sourceFragment != null) {
            sb.append("\nSource: ").append(sourceFragment);
        }
        if (context != null) {
            sb.append("\nContext: ").append(context);
        }
        return sb.toString();
    }
}
