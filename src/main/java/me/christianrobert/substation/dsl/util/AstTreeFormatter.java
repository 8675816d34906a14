package me.christianrobert.substation.dsl.util;

import me.christianrobert.substation.antlr.SubstationDslParser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

/**
 * Formats DSL parse trees into an indented text outline.
 *
 * <p>Useful for checking how a statement was matched by the grammar.</p>
 *
 * <pre>
 * script
 *   statement
 *     addBus @1:1
 *       "ADD_BUS"
 *       "id"
 *       "="
 *       ident [b1]
 *         "b1" (ID)
 *       ...
 * </pre>
 */
public class AstTreeFormatter {

  private static final String INDENT = "  ";
  private static final int MAX_TEXT_LENGTH = 50;

  /**
   * Formats a parse tree into human-readable text.
   *
   * @param tree Root of the parse tree
   * @return Formatted string representation
   */
  public static String format(ParseTree tree) {
    if (tree == null) {
      return "(null tree)";
    }
    StringBuilder sb = new StringBuilder();
    formatNode(tree, 0, sb);
    return sb.toString();
  }

  private static void formatNode(ParseTree tree, int depth, StringBuilder sb) {
    sb.append(INDENT.repeat(depth));

    if (tree instanceof TerminalNode) {
      Token token = ((TerminalNode) tree).getSymbol();
      if (token.getType() == Token.EOF) {
        sb.append("<EOF>\n");
        return;
      }

      sb.append("\"").append(escapeAndTruncate(token.getText())).append("\"");
      // implicit literal tokens ('ADD_BUS', '=', ...) have no symbolic name
      String tokenName = SubstationDslParser.VOCABULARY.getSymbolicName(token.getType());
      if (tokenName != null) {
        sb.append(" (").append(tokenName).append(")");
      }
      sb.append("\n");

    } else if (tree instanceof ParserRuleContext) {
      ParserRuleContext ctx = (ParserRuleContext) tree;
      sb.append(getRuleName(ctx));

      // statements get their position, small nodes a text snippet
      if (ctx.getParent() instanceof SubstationDslParser.StatementContext && ctx.getStart() != null) {
        sb.append(" @").append(ctx.getStart().getLine())
          .append(":").append(ctx.getStart().getCharPositionInLine() + 1);
      } else if (ctx.getChildCount() <= 2) {
        String text = ctx.getText();
        if (text.length() <= 30) {
          sb.append(" [").append(escapeAndTruncate(text)).append("]");
        }
      }
      sb.append("\n");

      for (int i = 0; i < ctx.getChildCount(); i++) {
        formatNode(ctx.getChild(i), depth + 1, sb);
      }

    } else {
      sb.append("(unknown: ").append(tree.getClass().getSimpleName()).append(")\n");
    }
  }

  /**
   * Rule name from the generated parser tables, e.g. {@code addBus}.
   */
  private static String getRuleName(ParserRuleContext ctx) {
    int ruleIndex = ctx.getRuleIndex();
    if (ruleIndex >= 0 && ruleIndex < SubstationDslParser.ruleNames.length) {
      return SubstationDslParser.ruleNames[ruleIndex];
    }
    return ctx.getClass().getSimpleName();
  }

  private static String escapeAndTruncate(String text) {
    if (text == null) {
      return "";
    }

    text = text.replace("\n", "\\n")
               .replace("\r", "\\r")
               .replace("\t", "\\t");

    if (text.length() > MAX_TEXT_LENGTH) {
      text = text.substring(0, MAX_TEXT_LENGTH) + "...";
    }

    return text;
  }
}
