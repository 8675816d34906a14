package me.christianrobert.substation.dsl.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Syntax error in DSL text. Thrown on the first error; there is no recovery.
 *
 * <p>The message carries the offending source line with a caret under the column
 * and the set of tokens the parser would have accepted:</p>
 * <pre>
 * Syntax error at line 2, column 19: missing '=' at '138'
 * ADD_BUS id=b1, kv 138
 *                   ^
 * Expected one of: '='
 * </pre>
 */
public class ParseException extends RuntimeException {

    /** Error code used when a syntax error is reported alongside semantic codes. */
    public static final String CODE = "E.SYNTAX";

    private final int line;
    private final int column;
    private final String sourceLine;
    private final List<String> expectedTokens;

    public ParseException(String message, int line, int column, String sourceLine, List<String> expectedTokens) {
        super(message);
        this.line = line;
        this.column = column;
        this.sourceLine = sourceLine;
        this.expectedTokens = Collections.unmodifiableList(new ArrayList<>(expectedTokens));
    }

    /**
     * 1-based line of the offending token.
     */
    public int getLine() {
        return line;
    }

    /**
     * 1-based column of the offending token.
     */
    public int getColumn() {
        return column;
    }

    public String getSourceLine() {
        return sourceLine;
    }

    /**
     * Display names of acceptable tokens (e.g. {@code 'kv'}, {@code ID}); empty for lexer errors.
     */
    public List<String> getExpectedTokens() {
        return expectedTokens;
    }
}
