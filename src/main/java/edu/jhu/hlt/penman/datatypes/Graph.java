package edu.jhu.hlt.penman.datatypes;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;

/**
 * A flat list of {@link Triple}s with a designated top variable. This is the
 * logical content of a PENMAN document; layout choices (nesting, inversion,
 * alignments) live in the {@link Tree}.
 *
 * @author travis
 */
public final class Graph implements Serializable {
  private static final long serialVersionUID = 3089561022948374715L;

  public static final String INSTANCE = "instance";

  private final ImmutableList<Triple> triples;
  private final String top;   // may be null, see getTop()
  private final Map<String, String> metadata;

  public Graph(List<Triple> triples) {
    this(triples, null, Collections.<String, String>emptyMap());
  }

  public Graph(List<Triple> triples, String top, Map<String, String> metadata) {
    this.triples = ImmutableList.copyOf(triples);
    this.top = top;
    this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public ImmutableList<Triple> getTriples() {
    return triples;
  }

  /**
   * The explicit top if one was given, otherwise the source of the first
   * triple, or null for an empty graph.
   */
  public String getTop() {
    if (top != null)
      return top;
    if (triples.isEmpty())
      return null;
    return triples.get(0).source;
  }

  public Map<String, String> getMetadata() {
    return metadata;
  }

  public boolean isEmpty() {
    return triples.isEmpty();
  }

  /** Every source of a triple, in order of first appearance. */
  public Set<String> variables() {
    Set<String> vars = new LinkedHashSet<>();
    for (Triple t : triples)
      vars.add(t.source);
    return vars;
  }

  @Override
  public String toString() {
    return "(Graph top=" + getTop() + " " + triples + ")";
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof Graph))
      return false;
    Graph g = (Graph) other;
    String t1 = getTop(), t2 = g.getTop();
    return triples.equals(g.triples) && (t1 == null ? t2 == null : t1.equals(t2));
  }

  @Override
  public int hashCode() {
    String t = getTop();
    return 31 * triples.hashCode() + (t == null ? 0 : t.hashCode());
  }
}
