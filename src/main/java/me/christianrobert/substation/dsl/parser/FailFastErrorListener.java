package me.christianrobert.substation.dsl.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Vocabulary;
import org.antlr.v4.runtime.misc.IntervalSet;

import java.util.ArrayList;
import java.util.List;

/**
 * Error listener that turns the first syntax error into a {@link ParseException}.
 *
 * <p>Attached to both lexer and parser. Throwing from {@code syntaxError} aborts the
 * parse, so the generated parser never builds a recovered tree that reaches the IR builder.</p>
 */
public class FailFastErrorListener extends BaseErrorListener {

    private final String[] sourceLines;

    public FailFastErrorListener(String source) {
        this.sourceLines = source.split("\r?\n", -1);
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                            int line, int charPositionInLine, String msg,
                            RecognitionException e) {
        int column = charPositionInLine + 1;
        List<String> expected = expectedTokens(recognizer, e);
        String sourceLine = line >= 1 && line <= sourceLines.length ? sourceLines[line - 1] : "";

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Syntax error at line %d, column %d: %s", line, column, msg));
        sb.append('\n').append(sourceLine);
        sb.append('\n').append(" ".repeat(Math.max(0, column - 1))).append('^');
        if (!expected.isEmpty()) {
            sb.append("\nExpected one of: ").append(String.join(", ", expected));
        }

        throw new ParseException(sb.toString(), line, column, sourceLine, expected);
    }

    private static List<String> expectedTokens(Recognizer<?, ?> recognizer, RecognitionException e) {
        List<String> names = new ArrayList<>();
        if (!(recognizer instanceof Parser)) {
            return names;  // lexer: no token expectations
        }

        IntervalSet set = null;
        if (e != null) {
            set = e.getExpectedTokens();
        }
        if (set == null || set.isNil()) {
            set = ((Parser) recognizer).getExpectedTokens();
        }

        Vocabulary vocabulary = recognizer.getVocabulary();
        for (Integer tokenType : set.toList()) {
            names.add(vocabulary.getDisplayName(tokenType));
        }
        return names;
    }
}
