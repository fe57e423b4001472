package me.christianrobert.py2lua.transformation.context;

/**
 * Result of a transformation operation.
 * Contains either the generated Lua code or an error message, never both.
 */
public class TransformationResult {

    private final boolean success;
    private final String luaCode;
    private final String errorMessage;
    private final String sourceTree;

    private TransformationResult(boolean success, String luaCode, String errorMessage, String sourceTree) {
        this.success = success;
        this.luaCode = luaCode;
        this.errorMessage = errorMessage;
        this.sourceTree = sourceTree;
    }

    /**
     * Creates a successful transformation result.
     */
    public static TransformationResult success(String sourceTree, String luaCode) {
        return new TransformationResult(true, luaCode, null, sourceTree);
    }

    /**
     * Creates a failed transformation result.
     */
    public static TransformationResult failure(String sourceTree, String errorMessage) {
        return new TransformationResult(false, null, errorMessage, sourceTree);
    }

    /**
     * Creates a failed transformation result from an exception.
     */
    public static TransformationResult failure(String sourceTree, TransformationException exception) {
        return new TransformationResult(false, null, exception.getDetailedMessage(), sourceTree);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public String getLuaCode() {
        return luaCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getSourceTree() {
        return sourceTree;
    }

    @Override
    public String toString() {
        if (success) {
            return "TransformationResult{success=true, luaCode='" + luaCode + "'}";
        } else {
            return "TransformationResult{success=false, error='" + errorMessage + "'}";
        }
    }
}
