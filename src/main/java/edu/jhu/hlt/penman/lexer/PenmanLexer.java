package edu.jhu.hlt.penman.lexer;

import static java.util.regex.Pattern.compile;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.log4j.Logger;

import edu.jhu.hlt.penman.datatypes.Atom;

/**
 * Splits PENMAN text (or the triple conjunction notation) into {@link Token}s.
 *
 * The whole text is scanned with one alternation of named groups; the first
 * group which matches at a position decides the token type. Quoted strings
 * may run over several lines. Anything which is not
 * whitespace and not matched by a real token type is an error.
 *
 * @author travis
 */
public class PenmanLexer {
  public static final Logger LOG = Logger.getLogger(PenmanLexer.class);

  /** Which notation is being lexed; they differ in punctuation. */
  public enum Mode {
    GRAPH(Arrays.asList("COMMENT", "STRING", "LPAREN", "RPAREN", "SLASH", "ROLE", "SYMBOL", "ALIGNMENT", "UNEXPECTED"),
        "(?<COMMENT>#.*)"
        + "|(?<STRING>\"[^\"\\\\]*(?:\\\\.[^\"\\\\]*)*\")"
        + "|(?<LPAREN>\\()"
        + "|(?<RPAREN>\\))"
        + "|(?<SLASH>/)"
        + "|(?<ROLE>:[^\\s()/:~]*)"
        + "|(?<SYMBOL>[^\\s()/:~\"]+)"
        // Malformed markers like a bare "~" are still ALIGNMENT tokens,
        // decoding them is lenient.
        + "|(?<ALIGNMENT>~[^\\s()/:~]*)"
        + "|(?<UNEXPECTED>\\S)"),
    TRIPLE(Arrays.asList("COMMENT", "STRING", "LPAREN", "RPAREN", "COMMA", "CARET", "SYMBOL", "UNEXPECTED"),
        "(?<COMMENT>#.*)"
        + "|(?<STRING>\"[^\"\\\\]*(?:\\\\.[^\"\\\\]*)*\")"
        + "|(?<LPAREN>\\()"
        + "|(?<RPAREN>\\))"
        + "|(?<COMMA>,)"
        + "|(?<CARET>\\^)"
        + "|(?<SYMBOL>[^\\s(),^\"]+)"
        + "|(?<UNEXPECTED>\\S)");

    private final List<String> groups;
    private final Pattern pattern;

    Mode(List<String> groups, String regex) {
      this.groups = Collections.unmodifiableList(groups);
      this.pattern = compile(regex);
    }
  }

  private static final Pattern INTEGER = compile("[-+]?\\d+");
  private static final Pattern FLOAT = compile(
      "[-+]?(?:(?:\\d+\\.\\d*|\\.\\d+)(?:[eE][-+]?\\d+)?|\\d+[eE][-+]?\\d+)");

  private final Mode mode;

  public PenmanLexer(Mode mode) {
    this.mode = mode;
  }

  public Mode getMode() {
    return mode;
  }

  /**
   * Lex all of the given text. The returned list always ends with an
   * {@link TokenType#EOF} token.
   *
   * @throws PenmanSyntaxException on a character which cannot start any token.
   */
  public List<Token> lex(String text) {
    List<Token> tokens = new ArrayList<>();
    // offset of the first character of each line, strings may span lines
    List<Integer> lineStarts = new ArrayList<>();
    lineStarts.add(0);
    for (int i = text.indexOf('\n'); i >= 0; i = text.indexOf('\n', i + 1))
      lineStarts.add(i + 1);

    Matcher m = mode.pattern.matcher(text);
    while (m.find()) {
      String group = matchedGroup(m);
      String tokText = m.group(group);
      int lineIdx = lineIndex(lineStarts, m.start());
      int lineno = lineIdx + 1;
      int column = m.start() - lineStarts.get(lineIdx);
      String line = line(text, lineStarts, lineIdx);
      if ("UNEXPECTED".equals(group)) {
        Token bad = new Token(TokenType.SYMBOL, tokText, null, lineno, column, line);
        throw new PenmanSyntaxException(
            "Unexpected character '" + tokText + "'", bad, Collections.<String>emptyList());
      }
      tokens.add(makeToken(TokenType.valueOf(group), tokText, lineno, column, line));
    }

    int last = lineStarts.size() - 1;
    String lastLine = line(text, lineStarts, last);
    tokens.add(new Token(TokenType.EOF, "", null, last + 1, lastLine.length(), lastLine));
    if (LOG.isDebugEnabled())
      LOG.debug("[lex] " + mode + " " + tokens.size() + " tokens from " + lineStarts.size() + " lines");
    return tokens;
  }

  /** Convenience for the iterator over {@link #lex(String)} */
  public TokenIterator iterator(String text) {
    return new TokenIterator(lex(text));
  }

  private static Token makeToken(TokenType type, String text, int lineno, int column, String line) {
    Atom value = null;
    switch (type) {
      case STRING:
        value = Atom.Str.unquote(text);
        break;
      case SYMBOL:
        if (INTEGER.matcher(text).matches()) {
          type = TokenType.INTEGER;
          value = Atom.integer(new BigInteger(text.startsWith("+") ? text.substring(1) : text));
        } else if (FLOAT.matcher(text).matches()) {
          type = TokenType.FLOAT;
          value = Atom.real(Double.parseDouble(text));
        } else {
          value = Atom.symbol(text);
        }
        break;
      default:
        break;
    }
    return new Token(type, text, value, lineno, column, line);
  }

  /** Index of the line containing the given offset. */
  static int lineIndex(List<Integer> lineStarts, int offset) {
    int i = Collections.binarySearch(lineStarts, offset);
    return i >= 0 ? i : -i - 2;
  }

  /** The text of a line without its terminator. */
  private static String line(String text, List<Integer> lineStarts, int lineIdx) {
    int start = lineStarts.get(lineIdx);
    int end = lineIdx + 1 < lineStarts.size() ? lineStarts.get(lineIdx + 1) - 1 : text.length();
    if (end > start && text.charAt(end - 1) == '\r')
      end--;
    return text.substring(start, end);
  }

  private String matchedGroup(Matcher m) {
    for (String g : mode.groups)
      if (m.group(g) != null)
        return g;
    throw new IllegalStateException("no group matched: " + m.group());
  }
}
