package edu.jhu.hlt.penman.lexer;

import static org.junit.Assert.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import edu.jhu.hlt.penman.datatypes.Atom;

public class PenmanLexerTest {

  private PenmanLexer graph = new PenmanLexer(PenmanLexer.Mode.GRAPH);
  private PenmanLexer triple = new PenmanLexer(PenmanLexer.Mode.TRIPLE);

  private static List<TokenType> types(List<Token> tokens) {
    List<TokenType> types = new ArrayList<>();
    for (Token t : tokens)
      types.add(t.type);
    return types;
  }

  @Test
  public void basicGraph() {
    List<Token> toks = graph.lex("(b / bark :ARG1 (d / dog))");
    assertEquals(Arrays.asList(
        TokenType.LPAREN, TokenType.SYMBOL, TokenType.SLASH, TokenType.SYMBOL,
        TokenType.ROLE, TokenType.LPAREN, TokenType.SYMBOL, TokenType.SLASH,
        TokenType.SYMBOL, TokenType.RPAREN, TokenType.RPAREN, TokenType.EOF),
        types(toks));
    assertEquals(":ARG1", toks.get(4).text);
    assertEquals(Atom.symbol("bark"), toks.get(3).value);
    assertNull(toks.get(4).value);
  }

  @Test
  public void positions() {
    List<Token> toks = graph.lex("# ::id 1\n(a :ARG0 / b)");
    Token comment = toks.get(0);
    assertEquals(TokenType.COMMENT, comment.type);
    assertEquals("# ::id 1", comment.text);
    assertEquals(1, comment.lineno);

    Token slash = toks.get(4);
    assertEquals(TokenType.SLASH, slash.type);
    assertEquals(2, slash.lineno);
    assertEquals(9, slash.column);
    assertEquals("(a :ARG0 / b)", slash.line);
  }

  @Test
  public void numbersAndStrings() {
    List<Token> toks = graph.lex("(a :quant 5 :value -1.5e3 :op1 \"Pierre \\\"V\\\"\" :polarity -)");
    assertEquals(TokenType.INTEGER, toks.get(3).type);
    assertEquals(Atom.integer(5), toks.get(3).value);
    assertEquals(TokenType.FLOAT, toks.get(5).type);
    assertEquals(Atom.real(-1500.0), toks.get(5).value);
    assertEquals(TokenType.STRING, toks.get(7).type);
    assertEquals(Atom.string("Pierre \"V\""), toks.get(7).value);
    assertEquals(TokenType.SYMBOL, toks.get(9).type);
    assertEquals(Atom.symbol("-"), toks.get(9).value);
  }

  @Test
  public void stringAcrossLines() {
    List<Token> toks = graph.lex("(a :snt \"line one\nline two\" :ARG0 b)");
    assertEquals(Arrays.asList(
        TokenType.LPAREN, TokenType.SYMBOL, TokenType.ROLE, TokenType.STRING,
        TokenType.ROLE, TokenType.SYMBOL, TokenType.RPAREN, TokenType.EOF),
        types(toks));
    Token snt = toks.get(3);
    assertEquals(Atom.string("line one\nline two"), snt.value);
    assertEquals(1, snt.lineno);
    assertEquals(8, snt.column);

    Token role = toks.get(4);
    assertEquals(":ARG0", role.text);
    assertEquals(2, role.lineno);
    assertEquals(10, role.column);
    assertEquals("line two\" :ARG0 b)", role.line);

    Token eof = toks.get(7);
    assertEquals(2, eof.lineno);
    assertEquals(18, eof.column);
  }

  @Test
  public void windowsLineEndings() {
    List<Token> toks = graph.lex("(a\r\n :ARG0 b)");
    Token role = toks.get(2);
    assertEquals(":ARG0", role.text);
    assertEquals(2, role.lineno);
    assertEquals(1, role.column);
    assertEquals(" :ARG0 b)", role.line);
    assertEquals("(a", toks.get(1).line);
  }

  @Test
  public void stringEscapesKeptAsWritten() {
    List<Token> toks = graph.lex("(a :name \"C:\\temp\\new\")");
    assertEquals("\"C:\\temp\\new\"", toks.get(3).value.toPenman());
    assertEquals(Atom.string("say \"hi\""), Atom.Str.unquote("\"say \\\"hi\\\"\""));
  }

  @Test
  public void bigIntegers() {
    List<Token> toks = graph.lex("123456789012345678901234567890");
    assertEquals(TokenType.INTEGER, toks.get(0).type);
    assertEquals(Atom.integer(new BigInteger("123456789012345678901234567890")), toks.get(0).value);
  }

  @Test
  public void alignments() {
    List<Token> toks = graph.lex("(a / alpha~e.1 :ARG0~2 b~)");
    assertEquals(Arrays.asList(
        TokenType.LPAREN, TokenType.SYMBOL, TokenType.SLASH, TokenType.SYMBOL,
        TokenType.ALIGNMENT, TokenType.ROLE, TokenType.ALIGNMENT, TokenType.SYMBOL,
        TokenType.ALIGNMENT, TokenType.RPAREN, TokenType.EOF),
        types(toks));
    assertEquals("~e.1", toks.get(4).text);
    assertEquals("~2", toks.get(6).text);
    assertEquals("~", toks.get(8).text);
  }

  @Test
  public void triples() {
    List<Token> toks = triple.lex("instance(b, bark) ^ ARG1(b, d)");
    assertEquals(Arrays.asList(
        TokenType.SYMBOL, TokenType.LPAREN, TokenType.SYMBOL, TokenType.COMMA,
        TokenType.SYMBOL, TokenType.RPAREN, TokenType.CARET,
        TokenType.SYMBOL, TokenType.LPAREN, TokenType.SYMBOL, TokenType.COMMA,
        TokenType.SYMBOL, TokenType.RPAREN, TokenType.EOF),
        types(toks));
  }

  @Test
  public void emptyInput() {
    List<Token> toks = graph.lex("");
    assertEquals(1, toks.size());
    assertEquals(TokenType.EOF, toks.get(0).type);
  }

  @Test
  public void unexpectedCharacter() {
    try {
      triple.lex("instance(b, \"bark)");
      fail("expected a syntax error");
    } catch (PenmanSyntaxException e) {
      assertEquals(12, e.getColumn());
      assertEquals(1, e.getLine());
      assertEquals("Unexpected character '\"'", e.getReason());
    }
  }

  @Test
  public void iteratorLookahead() {
    TokenIterator itr = graph.iterator("(a)");
    assertEquals(TokenType.LPAREN, itr.peekType());
    assertEquals(TokenType.LPAREN, itr.next().type);
    assertNull(itr.accept(TokenType.RPAREN));
    assertEquals("a", itr.expect(TokenType.SYMBOL).text);
    assertNotNull(itr.accept(TokenType.RPAREN));
    // EOF forever
    assertEquals(TokenType.EOF, itr.next().type);
    assertEquals(TokenType.EOF, itr.peekType());
  }

  @Test
  public void expectNamesAlternatives() {
    TokenIterator itr = graph.iterator("(a)");
    try {
      itr.expect(TokenType.ROLE, TokenType.RPAREN);
      fail("expected a syntax error");
    } catch (PenmanSyntaxException e) {
      assertEquals(Arrays.asList("ROLE", "RPAREN"), e.getExpected());
      assertEquals(TokenType.LPAREN, e.getToken().type);
      assertEquals("Expected: ROLE, RPAREN", e.getReason());
      assertTrue(e.getMessage(), e.getMessage().startsWith(e.getReason() + "\n  line 1, column 1"));
    }
  }
}
