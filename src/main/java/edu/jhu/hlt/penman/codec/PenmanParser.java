package edu.jhu.hlt.penman.codec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

import edu.jhu.hlt.penman.datatypes.AlignmentMarker;
import edu.jhu.hlt.penman.datatypes.Atom;
import edu.jhu.hlt.penman.datatypes.Edge;
import edu.jhu.hlt.penman.datatypes.Node;
import edu.jhu.hlt.penman.datatypes.Target;
import edu.jhu.hlt.penman.datatypes.Tree;
import edu.jhu.hlt.penman.lexer.Token;
import edu.jhu.hlt.penman.lexer.TokenIterator;
import edu.jhu.hlt.penman.lexer.TokenType;

/**
 * Recursive descent parser from PENMAN tokens to a {@link Tree}.
 * <pre>
 * Tree      := Comment* Node
 * Node      := '(' (Id NodeLabel? Edge*)? ')'
 * NodeLabel := '/' Atom? Alignment?
 * Edge      := Role Alignment? (Atom Alignment? | Node)?
 * </pre>
 * Also accepted: empty nodes "()", labels missing after "/", and edges with
 * no target when the role is followed by another role or ")".
 *
 * Tokens after the closing paren of the top node are not read.
 *
 * @author travis
 */
public class PenmanParser {
  public static final Logger LOG = Logger.getLogger(PenmanParser.class);

  /** What may follow a role, for error messages. */
  private static final List<String> EDGE_TARGETS = Arrays.asList("ATOM", "LPAREN");

  private PenmanParser() {}

  public static Tree parse(TokenIterator tokens) {
    Map<String, String> metadata = parseComments(tokens);
    Node root = parseNode(tokens);
    if (LOG.isDebugEnabled())
      LOG.debug("[parse] root=" + root.getId() + " metadata=" + metadata.keySet());
    return new Tree(root, metadata);
  }

  /**
   * Reads any leading comments, collecting "::key value" pairs. One comment
   * may hold several pairs; they are split off from the right, so the last
   * pair on a line is stored first. A later duplicate key overwrites the
   * value but keeps its original position.
   */
  public static Map<String, String> parseComments(TokenIterator tokens) {
    Map<String, String> metadata = new LinkedHashMap<>();
    while (tokens.peekType() == TokenType.COMMENT) {
      String comment = tokens.next().text;
      int sep;
      while ((sep = comment.lastIndexOf("::")) >= 0) {
        String meta = comment.substring(sep + 2);
        comment = comment.substring(0, sep);
        int space = meta.indexOf(' ');
        if (space < 0)
          metadata.put(meta, "");
        else
          metadata.put(meta.substring(0, space), meta.substring(space + 1));
      }
    }
    return metadata;
  }

  public static Node parseNode(TokenIterator tokens) {
    tokens.expect(TokenType.LPAREN);
    if (tokens.accept(TokenType.RPAREN) != null)
      return Node.EMPTY;

    String id = tokens.expect(TokenType.IDENTIFIERS).text;
    List<Edge> edges = new ArrayList<>();
    if (tokens.peekType() == TokenType.SLASH)
      edges.add(parseNodeLabel(tokens));
    while (tokens.peekType() != TokenType.RPAREN)
      edges.add(parseEdge(tokens));
    tokens.expect(TokenType.RPAREN);
    return new Node(id, edges);
  }

  private static Edge parseNodeLabel(TokenIterator tokens) {
    tokens.expect(TokenType.SLASH);
    Atom label = null;
    List<AlignmentMarker> epis = new ArrayList<>(1);
    // a bare "/" is tolerated; the label is whatever atom follows, if any
    if (tokens.peekType().isAtom()) {
      label = tokens.next().value;
      if (tokens.peekType() == TokenType.ALIGNMENT)
        parseAlignment(tokens, AlignmentMarker.Mode.TARGET_EPIGRAPH, epis);
    }
    return new Edge(Edge.LABEL_ROLE, label, epis);
  }

  private static Edge parseEdge(TokenIterator tokens) {
    List<AlignmentMarker> epis = new ArrayList<>(2);
    String role = tokens.expect(TokenType.ROLE).text;
    if (tokens.peekType() == TokenType.ALIGNMENT)
      parseAlignment(tokens, AlignmentMarker.Mode.ROLE_EPIGRAPH, epis);

    Target target = null;
    Token next = tokens.peek();
    if (next.type.isAtom()) {
      target = tokens.next().value;
      if (tokens.peekType() == TokenType.ALIGNMENT)
        parseAlignment(tokens, AlignmentMarker.Mode.TARGET_EPIGRAPH, epis);
    } else if (next.type == TokenType.LPAREN) {
      target = parseNode(tokens);
    } else if (next.type != TokenType.ROLE && next.type != TokenType.RPAREN) {
      // only another role or ")" may follow a role with no target
      throw tokens.error(next, EDGE_TARGETS);
    }
    return new Edge(role, target, epis);
  }

  /**
   * Consumes an alignment token. Markers with no indices (e.g. a bare "~")
   * are dropped rather than attached to the edge.
   */
  private static void parseAlignment(TokenIterator tokens, AlignmentMarker.Mode mode,
      List<AlignmentMarker> addTo) {
    Token t = tokens.expect(TokenType.ALIGNMENT);
    AlignmentMarker m = AlignmentParser.decode(t.text, mode);
    if (m.isEmpty())
      LOG.debug("[parseAlignment] ignoring malformed marker " + t.text + " on line " + t.lineno);
    else
      addTo.add(m);
  }
}
