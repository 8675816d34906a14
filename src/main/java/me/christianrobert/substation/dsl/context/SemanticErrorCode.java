package me.christianrobert.substation.dsl.context;

/**
 * Stable error codes for semantic failures.
 *
 * <p>Codes are part of the public contract: callers and tests match on {@link #code()},
 * never on message text.</p>
 */
public enum SemanticErrorCode {

    // transform time
    ID_DUP("E.ID.DUP"),
    ID_MISSING("E.ID.MISSING"),
    ATTR_MISSING("E.ATTR.MISSING"),
    PAGE_DUP("E.PAGE.DUP"),

    // validate time
    CONNECT_EMPTY("E.CONNECT.EMPTY"),
    CONNECT_ENDPOINT("E.CONNECT.ENDPOINT"),
    VOLT_MISMATCH("E.VOLT.MISMATCH"),
    PROT_BRK_UNUSED("E.PROT.BRK_UNUSED"),

    // strict reference mode
    CONNECT_UNRESOLVED("E.CONNECT.UNRESOLVED"),
    COUPLER_SAME_BUS("E.COUPLER.SAME_BUS"),
    BAY_UNKNOWN("E.BAY.UNKNOWN");

    private final String code;

    SemanticErrorCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
