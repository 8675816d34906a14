package me.christianrobert.substation.dsl.context;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import me.christianrobert.substation.dsl.ir.SubstationIr;
import me.christianrobert.substation.dsl.parser.ParseException;

/**
 * Result of compiling one DSL script (parse, build IR, optionally validate).
 * Contains either the IR summary or the first error, never both.
 * Optionally includes the syntax tree rendering for debugging.
 */
public class CompilationResult {

    private final boolean success;
    private final String errorCode;
    private final String errorMessage;
    private final Integer line;
    private final Integer column;
    private final SubstationIr model;
    private final JsonNode ir;
    private final boolean validated;
    private final String astTree;  // null unless requested

    private CompilationResult(boolean success, String errorCode, String errorMessage, Integer line, Integer column,
                              SubstationIr model, JsonNode ir, boolean validated, String astTree) {
        this.success = success;
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
        this.line = line;
        this.column = column;
        this.model = model;
        this.ir = ir;
        this.validated = validated;
        this.astTree = astTree;
    }

    /**
     * Creates a successful result.
     *
     * @param model the built IR
     * @param ir JSON rendering of the IR
     * @param validated whether the validator ran (and passed)
     * @param astTree syntax tree rendering, or null
     */
    public static CompilationResult success(SubstationIr model, JsonNode ir, boolean validated, String astTree) {
        return new CompilationResult(true, null, null, null, null, model, ir, validated, astTree);
    }

    /**
     * Creates a failed result from a syntax error.
     */
    public static CompilationResult failure(ParseException exception) {
        return new CompilationResult(false, ParseException.CODE, exception.getMessage(),
                exception.getLine(), exception.getColumn(), null, null, false, null);
    }

    /**
     * Creates a failed result from a semantic error.
     */
    public static CompilationResult failure(SemanticException exception, String astTree) {
        Integer line = exception.getLocation() != null ? exception.getLocation().getLine() : null;
        Integer column = exception.getLocation() != null ? exception.getLocation().getColumn() : null;
        return new CompilationResult(false, exception.getCode(), exception.getMessage(),
                line, column, null, null, false, astTree);
    }

    /**
     * Creates a failed result for an unexpected error.
     */
    public static CompilationResult failure(String errorMessage) {
        return new CompilationResult(false, null, errorMessage, null, null, null, null, false, null);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public Integer getLine() {
        return line;
    }

    public Integer getColumn() {
        return column;
    }

    public JsonNode getIr() {
        return ir;
    }

    @JsonIgnore
    public SubstationIr getModel() {
        return model;
    }

    public int getObjectCount() {
        return model != null ? model.objectCount() : 0;
    }

    public int getChainCount() {
        return model != null ? model.chainCount() : 0;
    }

    public boolean isValidated() {
        return validated;
    }

    public boolean isEmitRequested() {
        return model != null && model.isEmitRequested();
    }

    public String getAstTree() {
        return astTree;
    }

    public boolean hasAstTree() {
        return astTree != null;
    }

    @Override
    public String toString() {
        if (success) {
            return "CompilationResult{success=true, objects=" + getObjectCount() + ", chains=" + getChainCount()
                    + ", validated=" + validated + (astTree != null ? ", hasAstTree=true" : "") + "}";
        } else {
            return "CompilationResult{success=false, code=" + errorCode + ", error='" + errorMessage + "'"
                    + (astTree != null ? ", hasAstTree=true" : "") + "}";
        }
    }
}
