package mtnclgen.frontend;

import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import mtnclgen.frontend.Expression.Kind;

/**
 * Recursive descent parser for infix boolean equations.
 *
 * Grammar, lowest precedence first:
 * <pre>
 *   or    := and ('+' and)*      at most 3 operands, collapsed into one OR node
 *   and   := xor ('&amp;' xor)*      at most 3 operands, collapsed into one AND node
 *   xor   := factor ('^' factor)*  left-associative binary nodes
 *   factor:= IDENT | '(' or ')'
 * </pre>
 * '*' is accepted for '&amp;' and '|' for '+'. Negation ('!', '~', '\'') is rejected.
 */
public class EquationParser {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private enum TokenType { IDENT, AND, OR, XOR, LPAREN, RPAREN, END }

  private static class Token {
    final TokenType type;
    final String text;
    final int position;
    Token(TokenType type, String text, int position) {
      this.type = type;
      this.text = text;
      this.position = position;
    }
    @Override
    public String toString() {
      return type == TokenType.END ? "end of equation" : "'" + text + "'";
    }
  }

  private final String text;
  private List<Token> tokens;
  private int next = 0;

  private EquationParser(String text) { this.text = text; }

  /**
   * Parses an equation.
   * @param text equation text, e.g. "A &amp; (B + C)"
   * @return the expression tree
   * @throws EquationSyntaxException if the text is not a valid equation
   */
  public static Expression parse(String text) throws EquationSyntaxException {
    if (text == null || text.isBlank())
      throw new EquationSyntaxException("Empty equation");
    EquationParser parser = new EquationParser(text);
    parser.tokens = parser.tokenize();
    Expression result = parser.parseOr();
    Token trailing = parser.peek();
    if (trailing.type != TokenType.END) {
      if (trailing.type == TokenType.RPAREN)
        throw new EquationSyntaxException("Unmatched ')'", trailing.position);
      throw new EquationSyntaxException("Unexpected " + trailing, trailing.position);
    }
    logger.debug("Parsed equation '{}' as {}", text, result);
    return result;
  }

  private List<Token> tokenize() throws EquationSyntaxException {
    List<Token> out = new ArrayList<>();
    int pos = 0;
    while (pos < text.length()) {
      char c = text.charAt(pos);
      if (Character.isWhitespace(c)) {
        ++pos;
        continue;
      }
      if (c >= 'A' && c <= 'Z') {
        int start = pos;
        while (pos < text.length() && isIdentifierChar(text.charAt(pos)))
          ++pos;
        out.add(new Token(TokenType.IDENT, text.substring(start, pos), start));
        continue;
      }
      switch (c) {
      case '&':
      case '*':
        out.add(new Token(TokenType.AND, "&", pos));
        break;
      case '+':
      case '|':
        out.add(new Token(TokenType.OR, "+", pos));
        break;
      case '^':
        out.add(new Token(TokenType.XOR, "^", pos));
        break;
      case '(':
        out.add(new Token(TokenType.LPAREN, "(", pos));
        break;
      case ')':
        out.add(new Token(TokenType.RPAREN, ")", pos));
        break;
      case '!':
      case '~':
      case '\'':
        throw new EquationSyntaxException("Negation '" + c + "' is not supported", pos);
      default:
        throw new EquationSyntaxException("Invalid character '" + c + "'", pos);
      }
      ++pos;
    }
    out.add(new Token(TokenType.END, "", text.length()));
    return out;
  }

  private static boolean isIdentifierChar(char c) { return (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_'; }

  private Token peek() { return tokens.get(next); }
  private Token take() { return tokens.get(next++); }

  private Expression parseOr() throws EquationSyntaxException { return parseChain(TokenType.OR, Kind.OR); }

  private Expression parseAnd() throws EquationSyntaxException { return parseChain(TokenType.AND, Kind.AND); }

  private Expression parseChain(TokenType operator, Kind kind) throws EquationSyntaxException {
    int start = peek().position;
    List<Expression> operands = new ArrayList<>();
    operands.add(kind == Kind.OR ? parseAnd() : parseXor());
    while (peek().type == operator) {
      take();
      operands.add(kind == Kind.OR ? parseAnd() : parseXor());
    }
    if (operands.size() == 1)
      return operands.get(0);
    if (operands.size() > kind.maxArity())
      throw new EquationSyntaxException(String.format("Chain of %d %s operands exceeds the maximum gate arity of %d; use parentheses",
                                                      operands.size(), kind, kind.maxArity()),
                                        start);
    return Expression.operation(kind, operands);
  }

  private Expression parseXor() throws EquationSyntaxException {
    Expression left = parseFactor();
    while (peek().type == TokenType.XOR) {
      take();
      left = Expression.xor(left, parseFactor());
    }
    return left;
  }

  private Expression parseFactor() throws EquationSyntaxException {
    Token token = take();
    switch (token.type) {
    case IDENT:
      return Expression.variable(token.text);
    case LPAREN: {
      Expression inner = parseOr();
      Token closing = take();
      if (closing.type != TokenType.RPAREN)
        throw new EquationSyntaxException("Missing ')' for '(' opened", token.position);
      return inner;
    }
    case END:
      throw new EquationSyntaxException("Unexpected end of equation", token.position);
    default:
      throw new EquationSyntaxException("Expected a variable or '(' but found " + token, token.position);
    }
  }
}
