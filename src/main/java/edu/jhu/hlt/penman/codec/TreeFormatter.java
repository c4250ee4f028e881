package edu.jhu.hlt.penman.codec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Joiner;
import com.google.common.base.Strings;

import edu.jhu.hlt.penman.datatypes.AlignmentMarker;
import edu.jhu.hlt.penman.datatypes.Atom;
import edu.jhu.hlt.penman.datatypes.Edge;
import edu.jhu.hlt.penman.datatypes.Node;
import edu.jhu.hlt.penman.datatypes.Tree;

/**
 * Writes a {@link Tree} back out as PENMAN text.
 *
 * Layout is decided per node. With {@link Indent#AUTO} a node opened at
 * column c puts its edges at c + len(id) + 2, and a node nested under an edge
 * starts counting from that edge's column + len(role) + len(role alignments)
 * + 1. With compact output, the leading edges of a node whose targets are
 * constants (and not references to some node's id) share the first line.
 *
 * Instances hold no state besides their settings, all layout bookkeeping is
 * passed down through the recursion.
 *
 * @author travis
 */
public class TreeFormatter {

  private final Indent indent;
  private final boolean compact;

  public TreeFormatter(Indent indent, boolean compact) {
    this.indent = indent;
    this.compact = compact;
  }

  public String format(Tree tree) {
    List<String> parts = new ArrayList<>();
    for (Map.Entry<String, String> kv : tree.getMetadata().entrySet())
      parts.add("# ::" + kv.getKey() + " " + kv.getValue());
    Set<String> ids = compact ? tree.nodeIds() : Collections.<String>emptySet();
    parts.add(formatNode(tree.getRoot(), 0, ids));
    return Joiner.on('\n').join(parts);
  }

  /**
   * @param column where the "(" of this node sits
   * @param ids node ids which block compact grouping, empty unless compact
   */
  String formatNode(Node node, int column, Set<String> ids) {
    String id = node.getId();
    if (id == null || id.isEmpty())
      return "()";
    if (node.getEdges().isEmpty())
      return "(" + id + ")";

    String joiner;
    switch (indent.kind) {
      case NONE:
        joiner = " ";
        break;
      case AUTO:
        column += id.length() + 2;    // "(" and a space
        joiner = "\n" + Strings.repeat(" ", column);
        break;
      case FIXED:
        column += indent.width;
        joiner = "\n" + Strings.repeat(" ", column);
        break;
      default:
        throw new IllegalStateException("unknown indent: " + indent);
    }

    // Leading edges go on one line until the first one which cannot.
    List<String> parts = new ArrayList<>();
    boolean grouping = compact;
    for (Edge edge : node.getEdges()) {
      if (grouping && breaksGroup(edge, ids)) {
        grouping = false;
        if (!parts.isEmpty())
          collapse(parts);
      }
      parts.add(formatEdge(edge, column, ids));
    }
    if (grouping)
      collapse(parts);

    return "(" + id + " " + Joiner.on(joiner).join(parts) + ")";
  }

  String formatEdge(Edge edge, int column, Set<String> ids) {
    String role = edge.getRole();
    if (!edge.isLabel() && !role.startsWith(":"))
      role = ":" + role;

    StringBuilder roleEpi = new StringBuilder();
    StringBuilder targetEpi = new StringBuilder();
    for (AlignmentMarker m : edge.getEpigraph()) {
      if (m.getMode() == AlignmentMarker.Mode.ROLE_EPIGRAPH)
        roleEpi.append(m.toPenman());
      else
        targetEpi.append(m.toPenman());
    }

    if (indent.kind == Indent.Kind.AUTO)
      column += role.length() + roleEpi.length() + 1;

    String target;
    if (edge.getTarget() == null)
      target = "";
    else if (edge.hasNodeTarget())
      target = formatNode(edge.getNodeTarget(), column, ids);
    else
      target = ((Atom) edge.getTarget()).toPenman();

    return role + roleEpi + " " + target + targetEpi;
  }

  private static boolean breaksGroup(Edge edge, Set<String> ids) {
    if (!edge.hasAtomicTarget())
      return true;
    return edge.getTarget() != null && ((Atom) edge.getTarget()).isSymbolIn(ids);
  }

  private static void collapse(List<String> parts) {
    String line = Joiner.on(' ').join(parts);
    parts.clear();
    parts.add(line);
  }
}
