package me.christianrobert.substation.dsl.parser;

import jakarta.enterprise.context.Dependent;
import me.christianrobert.substation.antlr.SubstationDslLexer;
import me.christianrobert.substation.antlr.SubstationDslParser;
import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around the generated SubstationDslParser.
 * Handles parser instantiation and error reporting, and returns the syntax tree of a whole script.
 *
 * Uses two-stage parsing strategy:
 * 1. Try SLL(*) mode first with a bail-out error strategy (fast path)
 * 2. Fall back to LL(*) mode if SLL fails, reporting the first real error as {@link ParseException}
 *
 * Shared state: the generated parser keeps its deserialized ATN and DFA cache in static fields.
 * They are built lazily on first use, are safe for concurrent readers, and are the only state
 * shared between parses. Every call creates its own lexer, token stream and parser.
 * DSL scripts are small, so the caches are left to grow instead of being cleared after each parse.
 *
 * This is the only class that directly instantiates ANTLR parsers.
 */
@Dependent
public class AntlrParser {

    private static final Logger log = LoggerFactory.getLogger(AntlrParser.class);

    /**
     * Parses a complete DSL script using the two-stage strategy.
     *
     * @param source DSL text (may be empty)
     * @return ParseResult containing the parse tree
     * @throws ParseException on the first lexical or syntax error
     */
    public ParseResult parseScript(String source) {
        return parseScript(source, true);
    }

    /**
     * Parses a complete DSL script.
     *
     * @param source DSL text (may be empty)
     * @param twoStage true to try SLL first; false parses with LL directly
     * @return ParseResult containing the parse tree
     * @throws ParseException on the first lexical or syntax error
     */
    public ParseResult parseScript(String source, boolean twoStage) {
        if (source == null) {
            throw new IllegalArgumentException("DSL source cannot be null");
        }

        log.trace("Parsing DSL script ({} chars)", source.length());

        FailFastErrorListener errorListener = new FailFastErrorListener(source);

        CharStream input = CharStreams.fromString(source);
        SubstationDslLexer lexer = new SubstationDslLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(errorListener);  // lexer errors are always real errors

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        SubstationDslParser parser = new SubstationDslParser(tokens);
        parser.removeErrorListeners();

        if (twoStage) {
            // Stage 1: SLL(*), bail on the first problem
            parser.setErrorHandler(new BailErrorStrategy());
            parser.getInterpreter().setPredictionMode(PredictionMode.SLL);

            try {
                SubstationDslParser.ScriptContext tree = parser.script();
                log.trace("SLL(*) parse succeeded");
                return new ParseResult(tree, source, PredictionMode.SLL);
            } catch (ParseCancellationException sllException) {
                log.trace("SLL(*) parse failed, falling back to LL(*)");
                tokens.seek(0);
                parser.reset();
            }
        }

        // Stage 2 (or single stage): LL(*), first reported error aborts the parse
        parser.setErrorHandler(new DefaultErrorStrategy());
        parser.getInterpreter().setPredictionMode(PredictionMode.LL);
        parser.addErrorListener(errorListener);

        SubstationDslParser.ScriptContext tree = parser.script();
        log.debug("LL(*) parse completed");
        return new ParseResult(tree, source, PredictionMode.LL);
    }
}
