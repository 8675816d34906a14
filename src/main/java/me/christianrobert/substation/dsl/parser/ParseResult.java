package me.christianrobert.substation.dsl.parser;

import me.christianrobert.substation.antlr.SubstationDslParser;
import org.antlr.v4.runtime.atn.PredictionMode;

/**
 * Result of parsing a DSL script.
 * Only successful parses produce a result; syntax errors are thrown as {@link ParseException}.
 */
public class ParseResult {

    private final SubstationDslParser.ScriptContext tree;
    private final String source;
    private final PredictionMode predictionMode;

    public ParseResult(SubstationDslParser.ScriptContext tree, String source, PredictionMode predictionMode) {
        this.tree = tree;
        this.source = source;
        this.predictionMode = predictionMode;
    }

    /**
     * Gets the ANTLR parse tree root node.
     */
    public SubstationDslParser.ScriptContext getTree() {
        return tree;
    }

    /**
     * Gets the DSL text that was parsed.
     */
    public String getSource() {
        return source;
    }

    /**
     * Prediction mode that produced the tree: SLL when the fast path succeeded, LL otherwise.
     */
    public PredictionMode getPredictionMode() {
        return predictionMode;
    }

    public int getStatementCount() {
        return tree.statement().size();
    }

    @Override
    public String toString() {
        return "ParseResult{statements=" + getStatementCount() + ", mode=" + predictionMode + "}";
    }
}
