package me.christianrobert.substation.dsl.ir;

/**
 * Equipment kinds that an {@code ADD_<KIND>} statement can declare.
 *
 * <p>{@link #BUS} and {@link #TRANSFORMER} are voltage boundaries: the voltage
 * consistency check never compares across them.</p>
 */
public enum ObjectKind {
    BUS,
    BAY,
    BREAKER,
    DISCONNECTOR,
    COUPLER,
    TRANSFORMER,
    LINE,
    CABLE,
    EARTHING_SWITCH,
    CT,
    VT,
    RELAY_GROUP,
    SHUNT_CAP_BANK,
    SHUNT_REACTOR,
    SERIES_CAP,
    SVC,
    STATCOM,
    SURGE_ARRESTER,
    LINE_TRAP,
    STATION_SERVICE_TRANSFORMER,
    DC_SYSTEM;

    public boolean isVoltageBoundary() {
        return this == BUS || this == TRANSFORMER;
    }

    /**
     * The DSL statement keyword that declares this kind, e.g. {@code ADD_SHUNT_REACTOR}.
     */
    public String statementKeyword() {
        return "ADD_" + name();
    }
}
