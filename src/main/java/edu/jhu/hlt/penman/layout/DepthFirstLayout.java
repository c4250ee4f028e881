package edu.jhu.hlt.penman.layout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.apache.log4j.Logger;

import edu.jhu.hlt.penman.datatypes.Atom;
import edu.jhu.hlt.penman.datatypes.Edge;
import edu.jhu.hlt.penman.datatypes.Graph;
import edu.jhu.hlt.penman.datatypes.Node;
import edu.jhu.hlt.penman.datatypes.Target;
import edu.jhu.hlt.penman.datatypes.Tree;
import edu.jhu.hlt.penman.datatypes.Triple;

/**
 * Reads triples off a tree in preorder, and writes a graph back as a tree by
 * walking it depth first from the top, nesting each variable the first time
 * it is reached.
 *
 * Alignments are surface information and are not carried into the graph.
 *
 * @author travis
 */
public class DepthFirstLayout implements Layout {
  public static final Logger LOG = Logger.getLogger(DepthFirstLayout.class);

  @Override
  public Graph interpret(Tree tree, Model model) {
    List<Triple> triples = new ArrayList<>();
    Node root = tree.getRoot();
    if (!root.isEmpty())
      interpretNode(root, tree.nodeIds(), model, triples);
    return new Graph(triples, root.getId(), tree.getMetadata());
  }

  private void interpretNode(Node node, Set<String> ids, Model model, List<Triple> addTo) {
    String source = node.getId();
    for (Edge e : node.getEdges()) {
      String role = normalizeRole(e.getRole());
      Target target = e.getTarget();
      Node nested = null;
      Atom value;
      if (target == null) {
        value = null;
      } else if (target.isAtomic()) {
        value = (Atom) target;
      } else {
        nested = (Node) target;
        value = nested.isEmpty() ? null : Atom.symbol(nested.getId());
      }

      boolean refersToNode = nested != null || (value != null && value.isSymbolIn(ids));
      if (value != null && refersToNode && model.isInverted(role)) {
        String inverseSource = nested != null ? nested.getId() : ((Atom.Symbol) value).name;
        addTo.add(new Triple(inverseSource, model.invert(role), Atom.symbol(source)));
      } else {
        addTo.add(new Triple(source, role, value));
      }

      if (nested != null && !nested.isEmpty())
        interpretNode(nested, ids, model, addTo);
    }
  }

  /** "/" becomes "instance", and the leading ":" is dropped from other roles. */
  static String normalizeRole(String role) {
    if (Edge.LABEL_ROLE.equals(role))
      return Graph.INSTANCE;
    if (role.startsWith(":"))
      return role.substring(1);
    return role;
  }

  @Override
  public Tree configure(Graph graph, String top, Model model) {
    if (top == null)
      top = graph.getTop();
    if (graph.isEmpty()) {
      // "(a)" has a top but no triples
      Node root = top == null ? Node.EMPTY : new Node(top, Collections.<Edge>emptyList());
      return new Tree(root, graph.getMetadata());
    }
    Set<String> variables = graph.variables();
    if (!variables.contains(top))
      throw new LayoutException("top is not a variable in the graph: " + top);

    List<Triple> triples = graph.getTriples();
    boolean[] used = new boolean[triples.size()];
    Set<String> visited = new HashSet<>();
    Set<String> forward = reachableForward(top, triples, variables);
    Node root = configureNode(top, triples, used, visited, forward, variables, model);

    List<Triple> unused = new ArrayList<>();
    for (int i = 0; i < used.length; i++)
      if (!used[i])
        unused.add(triples.get(i));
    if (!unused.isEmpty())
      throw new LayoutException("triples not connected to top " + top + ": " + unused);
    return new Tree(root, graph.getMetadata());
  }

  /**
   * Variables reachable from top following triples from source to target.
   * These will be nested under a forward edge, so they are never pulled in
   * through an inverted one.
   */
  static Set<String> reachableForward(String top, List<Triple> triples, Set<String> variables) {
    Set<String> reached = new HashSet<>();
    reached.add(top);
    boolean grew = true;
    while (grew) {
      grew = false;
      for (Triple t : triples) {
        if (!reached.contains(t.source) || t.target == null || t.target.getType() != Atom.Type.SYMBOL)
          continue;
        String v = ((Atom.Symbol) t.target).name;
        if (variables.contains(v) && reached.add(v))
          grew = true;
      }
    }
    return reached;
  }

  private Node configureNode(String var, List<Triple> triples, boolean[] used,
      Set<String> visited, Set<String> forward, Set<String> variables, Model model) {
    visited.add(var);
    List<Edge> edges = new ArrayList<>();

    // label first
    for (int i = 0; i < triples.size(); i++) {
      Triple t = triples.get(i);
      if (!used[i] && t.source.equals(var) && Graph.INSTANCE.equals(t.relation)) {
        used[i] = true;
        if (edges.isEmpty())
          edges.add(new Edge(Edge.LABEL_ROLE, t.target));
        else
          LOG.warn("[configure] ignoring extra instance of " + var + ": " + t);
      }
    }

    // used[] may change during the recursive calls below, so check it as we go
    for (int i = 0; i < triples.size(); i++) {
      if (used[i])
        continue;
      Triple t = triples.get(i);
      if (Graph.INSTANCE.equals(t.relation))
        continue;
      if (t.source.equals(var)) {
        used[i] = true;
        String targetVar = t.target != null && t.target.getType() == Atom.Type.SYMBOL
            ? ((Atom.Symbol) t.target).name : null;
        if (targetVar != null && variables.contains(targetVar) && !visited.contains(targetVar)) {
          Node child = configureNode(targetVar, triples, used, visited, forward, variables, model);
          edges.add(new Edge(":" + t.relation, child));
        } else {
          edges.add(new Edge(":" + t.relation, t.target));
        }
      } else if (t.targetIs(var) && !visited.contains(t.source) && !forward.contains(t.source)) {
        used[i] = true;
        Node child = configureNode(t.source, triples, used, visited, forward, variables, model);
        edges.add(new Edge(":" + model.invert(t.relation), child));
      }
    }
    return new Node(var, edges);
  }
}
