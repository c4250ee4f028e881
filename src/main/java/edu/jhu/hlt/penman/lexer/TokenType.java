package edu.jhu.hlt.penman.lexer;

import java.util.EnumSet;

/**
 * Codes for the tokens returned from lexing PENMAN or triple notation.
 *
 * @author travis
 */
public enum TokenType {

  EOF("<EOF>"),

  COMMENT,
  STRING,
  INTEGER,
  FLOAT,
  SYMBOL,
  ROLE,
  ALIGNMENT,

  LPAREN("("),
  RPAREN(")"),
  SLASH("/"),
  COMMA(","),
  CARET("^");

  /** Tokens which may appear as a constant (node label or edge target). */
  public static final EnumSet<TokenType> ATOMS = EnumSet.of(SYMBOL, STRING, INTEGER, FLOAT);

  /** Tokens which may be used as a node id. */
  public static final EnumSet<TokenType> IDENTIFIERS = EnumSet.of(SYMBOL);

  public final String text;   // null for tokens with variable text

  TokenType() {
    this(null);
  }

  TokenType(String text) {
    this.text = text;
  }

  public boolean isAtom() {
    return ATOMS.contains(this);
  }
}
