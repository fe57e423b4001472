package me.christianrobert.py2lua.transformation.context;

/**
 * Thrown when the input uses a construct outside the translatable Python subset.
 * Translation stops immediately; no partial output is produced.
 */
public class UnsupportedConstructException extends TransformationException {

    public enum Reason {
        UNSUPPORTED_NODE("node kind"),
        UNSUPPORTED_OPERATOR("operator"),
        MULTIPLE_ASSIGNMENT_TARGETS("assignment with multiple targets"),
        NON_POSITIONAL_PARAMETER("parameter"),
        CHAINED_COMPARISON("chained comparison"),
        KEYWORD_ARGUMENT("keyword argument"),
        LOOP_ELSE("loop else branch");

        private final String label;

        Reason(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    private final Reason reason;
    private final String construct;

    public UnsupportedConstructException(Reason reason, String construct) {
        this(reason, construct, null);
    }

    public UnsupportedConstructException(Reason reason, String construct, String context) {
        super("Unsupported " + reason.getLabel() + ": " + construct, construct, context);
        this.reason = reason;
        this.construct = construct;
    }

    public Reason getReason() {
        return reason;
    }

    public String getConstruct() {
        return construct;
    }
}
