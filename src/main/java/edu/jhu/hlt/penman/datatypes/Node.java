package edu.jhu.hlt.penman.datatypes;

import java.io.Serializable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * A node in a PENMAN tree: an identifier followed by edges, the first of
 * which is the "/" label edge when the node has a label.
 *
 * A node with no id and no edges is the empty node "()".
 *
 * @author travis
 */
public final class Node implements Target, Serializable {
  private static final long serialVersionUID = 7331957462058720905L;

  public static final Node EMPTY = new Node(null, Collections.<Edge>emptyList());

  private final String id;    // may be null
  private final ImmutableList<Edge> edges;

  public Node(String id, List<Edge> edges) {
    if (id == null && !edges.isEmpty())
      throw new IllegalArgumentException("only the empty node may omit its id");
    this.id = id;
    this.edges = ImmutableList.copyOf(edges);
  }

  public String getId() {
    return id;
  }

  public ImmutableList<Edge> getEdges() {
    return edges;
  }

  public boolean isEmpty() {
    return id == null && edges.isEmpty();
  }

  @Override
  public boolean isAtomic() {
    return false;
  }

  /** The label edge ("/"), or null if this node has none. */
  public Edge getLabelEdge() {
    if (!edges.isEmpty() && edges.get(0).isLabel())
      return edges.get(0);
    return null;
  }

  /** The label constant, or null if absent (including "(a / )"). */
  public Atom getLabel() {
    Edge e = getLabelEdge();
    return e == null ? null : (Atom) e.getTarget();
  }

  /** This node and every node nested under it, in preorder. */
  public List<Node> nodes() {
    List<Node> nodes = new ArrayList<>();
    Deque<Node> stack = new ArrayDeque<>();
    stack.push(this);
    while (!stack.isEmpty()) {
      Node n = stack.pop();
      nodes.add(n);
      for (int i = n.edges.size() - 1; i >= 0; i--) {
        Edge e = n.edges.get(i);
        if (e.hasNodeTarget())
          stack.push(e.getNodeTarget());
      }
    }
    return nodes;
  }

  @Override
  public String toString() {
    if (isEmpty())
      return "(Node EMPTY)";
    return "(Node " + id + " " + edges + ")";
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof Node))
      return false;
    Node n = (Node) other;
    return (id == null ? n.id == null : id.equals(n.id)) && edges.equals(n.edges);
  }

  @Override
  public int hashCode() {
    return 31 * (id == null ? 0 : id.hashCode()) + edges.hashCode();
  }
}
