package edu.jhu.hlt.penman.lexer;

import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

/**
 * Raised when a PENMAN or triple document is malformed. Carries the token
 * that could not be consumed and what would have been accepted in its place.
 *
 * The message shows the offending line with a caret under the token, e.g.
 * <pre>
 * Expected: ATOM, LPAREN
 *   line 1, column 10
 *     (a :ARG0 / b)
 *              ^
 * </pre>
 *
 * @author travis
 */
public class PenmanSyntaxException extends RuntimeException {
  private static final long serialVersionUID = -4728591034917725580L;

  private final Token token;
  private final ImmutableList<String> expected;
  private final String reason;

  public PenmanSyntaxException(String reason, Token token, List<String> expected) {
    super(render(reason, token));
    this.reason = reason;
    this.token = token;
    this.expected = ImmutableList.copyOf(expected);
  }

  /** Builds the "Expected: A, B" error for a token of the wrong type. */
  public static PenmanSyntaxException expected(Token token, List<String> expected) {
    return new PenmanSyntaxException(
        "Expected: " + Joiner.on(", ").join(expected), token, expected);
  }

  public Token getToken() {
    return token;
  }

  /** Names of the token categories which would have been accepted, may be empty. */
  public ImmutableList<String> getExpected() {
    return expected;
  }

  public String getReason() {
    return reason;
  }

  public int getLine() {
    return token.lineno;
  }

  public int getColumn() {
    return token.column;
  }

  private static String render(String reason, Token token) {
    StringBuilder sb = new StringBuilder(reason);
    sb.append("\n  line ").append(token.lineno).append(", column ").append(token.column + 1);
    if (token.line != null) {
      sb.append("\n    ").append(token.line);
      sb.append("\n    ").append(Strings.repeat(" ", token.column)).append('^');
    }
    return sb.toString();
  }
}
