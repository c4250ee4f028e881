package edu.jhu.hlt.penman.codec;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

import edu.jhu.hlt.penman.datatypes.Atom;
import edu.jhu.hlt.penman.datatypes.Triple;
import edu.jhu.hlt.penman.lexer.TokenIterator;
import edu.jhu.hlt.penman.lexer.TokenType;

/**
 * Parses the conjunction notation, e.g.
 * "instance(b, bark) ^ instance(d, dog) ^ ARG1(b, d)",
 * straight into {@link Triple}s. A missing target, as in "ARG1(b, )", is
 * allowed and gives a null target.
 *
 * @author travis
 */
public class TripleParser {
  public static final Logger LOG = Logger.getLogger(TripleParser.class);

  private TripleParser() {}

  public static List<Triple> parse(TokenIterator tokens) {
    List<Triple> triples = new ArrayList<>();
    // comments are allowed before the first conjunct and ignored
    while (tokens.peekType() == TokenType.COMMENT)
      tokens.next();
    do {
      String relation = tokens.expect(TokenType.SYMBOL).text;
      tokens.expect(TokenType.LPAREN);
      String source = tokens.expect(TokenType.IDENTIFIERS).text;
      tokens.expect(TokenType.COMMA);
      Atom target = null;
      if (tokens.peekType().isAtom())
        target = tokens.next().value;
      tokens.expect(TokenType.RPAREN);
      triples.add(new Triple(source, relation, target));
    } while (tokens.accept(TokenType.CARET) != null);
    if (LOG.isDebugEnabled())
      LOG.debug("[parse] read " + triples.size() + " triples");
    return triples;
  }
}
