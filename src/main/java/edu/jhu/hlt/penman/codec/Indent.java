package edu.jhu.hlt.penman.codec;

import com.google.common.base.Preconditions;

/**
 * How {@link TreeFormatter} breaks and indents lines:
 * <ul>
 * <li>{@link #NONE}: everything on one line, separated by single spaces</li>
 * <li>{@link #AUTO}: each node's edges line up one column past its "(id"</li>
 * <li>{@link #fixed(int)}: each level of nesting indents by n more columns</li>
 * </ul>
 *
 * @author travis
 */
public final class Indent {

  public enum Kind { NONE, AUTO, FIXED }

  public static final Indent NONE = new Indent(Kind.NONE, 0);
  public static final Indent AUTO = new Indent(Kind.AUTO, 0);

  public final Kind kind;
  public final int width;   // only meaningful for FIXED

  private Indent(Kind kind, int width) {
    this.kind = kind;
    this.width = width;
  }

  public static Indent fixed(int width) {
    Preconditions.checkArgument(width >= 0, "indent width must be non-negative: %s", width);
    return new Indent(Kind.FIXED, width);
  }

  /** Accepts "none", "auto", or a non-negative integer. */
  public static Indent parse(String s) {
    String v = s.trim().toLowerCase();
    if ("none".equals(v))
      return NONE;
    if ("auto".equals(v))
      return AUTO;
    try {
      return fixed(Integer.parseInt(v));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("not an indent (none, auto, or a number): " + s, e);
    }
  }

  public boolean breaksLines() {
    return kind != Kind.NONE;
  }

  @Override
  public String toString() {
    return kind == Kind.FIXED ? String.valueOf(width) : kind.toString().toLowerCase();
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof Indent))
      return false;
    Indent i = (Indent) other;
    return kind == i.kind && width == i.width;
  }

  @Override
  public int hashCode() {
    return 31 * kind.hashCode() + width;
  }
}
