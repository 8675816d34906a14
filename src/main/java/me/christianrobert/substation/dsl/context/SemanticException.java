package me.christianrobert.substation.dsl.context;

import me.christianrobert.substation.dsl.ir.SourceLocation;

/**
 * Base class of all semantic failures (transform time and validate time).
 *
 * <p>The message is always {@code "<code>: <detail>"}, e.g.
 * {@code "E.VOLT.MISMATCH: Voltage mismatch between a(138) and b(13.8)."}</p>
 */
public abstract class SemanticException extends RuntimeException {

    private final SemanticErrorCode errorCode;
    private final String detail;
    private final SourceLocation location;

    protected SemanticException(SemanticErrorCode errorCode, String detail, SourceLocation location) {
        super(errorCode.code() + ": " + detail);
        this.errorCode = errorCode;
        this.detail = detail;
        this.location = location;
    }

    public SemanticErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * Shortcut for {@code getErrorCode().code()}.
     */
    public String getCode() {
        return errorCode.code();
    }

    /**
     * Message without the code prefix.
     */
    public String getDetail() {
        return detail;
    }

    /**
     * @return location of the offending statement, or null when the failure is not tied to one
     */
    public SourceLocation getLocation() {
        return location;
    }

    /**
     * Gets a detailed error message including the source location.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (location != null) {
            sb.append("\nLocation: ").append(location);
        }
        return sb.toString();
    }
}
