package edu.jhu.hlt.penman.codec;

import java.util.List;

import org.apache.log4j.Logger;

import edu.jhu.hlt.penman.datatypes.Graph;
import edu.jhu.hlt.penman.datatypes.Tree;
import edu.jhu.hlt.penman.datatypes.Triple;
import edu.jhu.hlt.penman.layout.DepthFirstLayout;
import edu.jhu.hlt.penman.layout.Layout;
import edu.jhu.hlt.penman.layout.Model;
import edu.jhu.hlt.penman.lexer.PenmanLexer;

/**
 * Reads and writes PENMAN notation, e.g. "(b / bark :ARG1 (d / dog))", and
 * the triple conjunction notation, e.g.
 * "instance(b, bark) ^ instance(d, dog) ^ ARG1(b, d)".
 *
 * {@link #parse(String)} and {@link #format(Tree)} work on the surface
 * {@link Tree}; {@link #decode(String)} and {@link #encode(Graph)} go on to
 * (or come from) a {@link Graph} using this codec's {@link Layout}.
 *
 * Instances are immutable and may be shared between threads.
 *
 * @author travis
 */
public class PenmanCodec {
  public static final Logger LOG = Logger.getLogger(PenmanCodec.class);

  private static final PenmanLexer GRAPH_LEXER = new PenmanLexer(PenmanLexer.Mode.GRAPH);
  private static final PenmanLexer TRIPLE_LEXER = new PenmanLexer(PenmanLexer.Mode.TRIPLE);

  private final Model model;
  private final Layout layout;

  public PenmanCodec() {
    this(new Model());
  }

  public PenmanCodec(Model model) {
    this(model, new DepthFirstLayout());
  }

  public PenmanCodec(Model model, Layout layout) {
    if (model == null || layout == null)
      throw new IllegalArgumentException("model=" + model + " layout=" + layout);
    this.model = model;
    this.layout = layout;
  }

  public Model getModel() {
    return model;
  }

  public Layout getLayout() {
    return layout;
  }

  /** Parse a single PENMAN document into its tree. */
  public Tree parse(String s) {
    return PenmanParser.parse(GRAPH_LEXER.iterator(s));
  }

  /** Parse a single triple conjunction. */
  public List<Triple> parseTriples(String s) {
    return TripleParser.parse(TRIPLE_LEXER.iterator(s));
  }

  public Graph decode(String s) {
    Tree t = parse(s);
    Graph g = layout.interpret(t, model);
    if (LOG.isDebugEnabled())
      LOG.debug("[decode] " + g.getTriples().size() + " triples, top=" + g.getTop());
    return g;
  }

  public Graph decodeTriples(String s) {
    return new Graph(parseTriples(s));
  }

  public String format(Tree tree) {
    return format(tree, Indent.AUTO, false);
  }

  public String format(Tree tree, Indent indent, boolean compact) {
    return new TreeFormatter(indent, compact).format(tree);
  }

  public String formatTriples(List<Triple> triples, boolean multiline) {
    return TripleFormatter.format(triples, multiline);
  }

  public String encode(Graph g) {
    return encode(g, null, Indent.AUTO, false);
  }

  /**
   * @param top the variable at the root of the output, or null for the graph's top
   */
  public String encode(Graph g, String top, Indent indent, boolean compact) {
    Tree t = layout.configure(g, top, model);
    return format(t, indent, compact);
  }

  public String encodeTriples(Graph g) {
    return encodeTriples(g, true);
  }

  public String encodeTriples(Graph g, boolean multiline) {
    return formatTriples(g.getTriples(), multiline);
  }
}
