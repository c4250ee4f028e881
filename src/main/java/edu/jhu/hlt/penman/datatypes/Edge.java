package edu.jhu.hlt.penman.datatypes;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A role pointing at a constant, a nested node, or nothing at all (which the
 * parser allows for robustness, e.g. "(a :ARG0 :ARG1 b)").
 *
 * The role keeps whatever text it was read with, so usually it includes the
 * leading colon. The special role "/" holds a node's label.
 *
 * @author travis
 */
public final class Edge implements Serializable {
  private static final long serialVersionUID = -2712958862147713541L;

  public static final String LABEL_ROLE = "/";

  private final String role;
  private final Target target;    // may be null
  private final ImmutableList<AlignmentMarker> epigraph;

  public Edge(String role, Target target) {
    this(role, target, Collections.<AlignmentMarker>emptyList());
  }

  public Edge(String role, Target target, List<AlignmentMarker> epigraph) {
    Preconditions.checkNotNull(role);
    this.role = role;
    this.target = target;
    this.epigraph = ImmutableList.copyOf(epigraph);
  }

  public String getRole() {
    return role;
  }

  /** Null for a dangling edge. */
  public Target getTarget() {
    return target;
  }

  public ImmutableList<AlignmentMarker> getEpigraph() {
    return epigraph;
  }

  public boolean isLabel() {
    return LABEL_ROLE.equals(role);
  }

  /** No target counts as atomic, only nested nodes do not. */
  public boolean hasAtomicTarget() {
    return target == null || target.isAtomic();
  }

  public boolean hasNodeTarget() {
    return target != null && !target.isAtomic();
  }

  public Node getNodeTarget() {
    if (!hasNodeTarget())
      throw new IllegalStateException("not a node target: " + this);
    return (Node) target;
  }

  @Override
  public String toString() {
    return "(Edge " + role + " " + target + " " + epigraph + ")";
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof Edge))
      return false;
    Edge e = (Edge) other;
    return role.equals(e.role)
        && (target == null ? e.target == null : target.equals(e.target))
        && epigraph.equals(e.epigraph);
  }

  @Override
  public int hashCode() {
    int h = role.hashCode();
    h = 31 * h + (target == null ? 0 : target.hashCode());
    return 31 * h + epigraph.hashCode();
  }
}
