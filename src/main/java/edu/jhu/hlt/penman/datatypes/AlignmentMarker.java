package edu.jhu.hlt.penman.datatypes;

import java.io.Serializable;
import java.util.List;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A surface alignment like "~e.1,2" attached to an {@link Edge}, recording
 * which tokens of the source sentence the role or target came from.
 *
 * The prefix is a single letter (e.g. "e") without the dot, which is added
 * back when the marker is written.
 *
 * @author travis
 */
public final class AlignmentMarker implements Serializable {
  private static final long serialVersionUID = 4102385327784117306L;

  public enum Mode {
    ROLE_EPIGRAPH,    // follows the role, e.g. ":ARG0~e.2"
    TARGET_EPIGRAPH   // follows an atomic target or node label
  }

  private final ImmutableList<Integer> indices;
  private final String prefix;    // may be null
  private final Mode mode;

  public AlignmentMarker(List<Integer> indices, String prefix, Mode mode) {
    Preconditions.checkNotNull(mode);
    for (Integer i : indices)
      Preconditions.checkArgument(i >= 0, "negative alignment index: %s", i);
    this.indices = ImmutableList.copyOf(indices);
    this.prefix = prefix;
    this.mode = mode;
  }

  public ImmutableList<Integer> getIndices() {
    return indices;
  }

  public String getPrefix() {
    return prefix;
  }

  public Mode getMode() {
    return mode;
  }

  public boolean isEmpty() {
    return indices.isEmpty();
  }

  /** "~" + optional "prefix." + comma separated indices */
  public String toPenman() {
    StringBuilder sb = new StringBuilder("~");
    if (prefix != null)
      sb.append(prefix).append('.');
    Joiner.on(',').appendTo(sb, indices);
    return sb.toString();
  }

  @Override
  public String toString() {
    return toPenman();
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof AlignmentMarker))
      return false;
    AlignmentMarker a = (AlignmentMarker) other;
    return mode == a.mode
        && indices.equals(a.indices)
        && (prefix == null ? a.prefix == null : prefix.equals(a.prefix));
  }

  @Override
  public int hashCode() {
    int h = indices.hashCode();
    h = 31 * h + (prefix == null ? 0 : prefix.hashCode());
    return 31 * h + mode.hashCode();
  }
}
