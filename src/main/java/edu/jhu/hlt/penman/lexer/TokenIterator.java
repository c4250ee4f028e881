package edu.jhu.hlt.penman.lexer;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

import com.google.common.collect.Iterators;
import com.google.common.collect.PeekingIterator;

/**
 * One token of lookahead over a lexed document. Once the input is used up
 * the final {@link TokenType#EOF} token is returned forever.
 *
 * @author travis
 */
public class TokenIterator {

  private final PeekingIterator<Token> tokens;
  private final Token eof;

  public TokenIterator(List<Token> tokens) {
    if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type != TokenType.EOF)
      throw new IllegalArgumentException("token list must end with EOF");
    this.eof = tokens.get(tokens.size() - 1);
    this.tokens = Iterators.peekingIterator(tokens.subList(0, tokens.size() - 1).iterator());
  }

  public Token peek() {
    return tokens.hasNext() ? tokens.peek() : eof;
  }

  public TokenType peekType() {
    return peek().type;
  }

  public Token next() {
    return tokens.hasNext() ? tokens.next() : eof;
  }

  /** Consumes and returns the next token if it has the given type, else null. */
  public Token accept(TokenType type) {
    if (peek().type == type)
      return next();
    return null;
  }

  /**
   * Consumes and returns the next token.
   * @throws PenmanSyntaxException if it is not one of the given types.
   */
  public Token expect(TokenType... types) {
    Token t = peek();
    for (TokenType type : types)
      if (t.type == type)
        return next();
    List<String> names = new ArrayList<>();
    for (TokenType type : types)
      names.add(type.toString());
    throw error(t, names);
  }

  public Token expect(EnumSet<TokenType> types) {
    return expect(types.toArray(new TokenType[types.size()]));
  }

  /** Builds (does not throw) an "Expected: ..." error located at the given token. */
  public PenmanSyntaxException error(Token at, List<String> expected) {
    return PenmanSyntaxException.expected(at, expected);
  }
}
