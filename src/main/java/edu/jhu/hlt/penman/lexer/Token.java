package edu.jhu.hlt.penman.lexer;

import edu.jhu.hlt.penman.datatypes.Atom;

/**
 * A lexed token along with where it came from, so that parse errors can
 * point at it.
 *
 * @author travis
 */
public class Token {
  public final TokenType type;
  public final String text;
  public final Atom value;    // non-null iff type is an atom
  public final int lineno;    // 1-based
  public final int column;    // 0-based offset into line
  public final String line;   // the source line this token was found on

  public Token(TokenType type, String text, Atom value, int lineno, int column, String line) {
    this.type = type;
    this.text = text;
    this.value = value;
    this.lineno = lineno;
    this.column = column;
    this.line = line;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Token t = (Token) o;
    if (type != t.type) return false;
    if (lineno != t.lineno || column != t.column) return false;
    return text != null ? text.equals(t.text) : t.text == null;
  }

  @Override
  public int hashCode() {
    int result = type.hashCode();
    result = 31 * result + (text != null ? text.hashCode() : 0);
    result = 31 * result + lineno;
    return 31 * result + column;
  }

  @Override
  public String toString() {
    if (type == TokenType.EOF)
      return TokenType.EOF.text;
    return "(" + type + ", '" + text + "')";
  }
}
