package edu.jhu.hlt.penman.datatypes;

/**
 * Something an {@link Edge} can point at: either an {@link Atom} or a nested
 * {@link Node}. Edges with no target hold null.
 *
 * @author travis
 */
public interface Target {

  /** True for constants, false for nested nodes. */
  public boolean isAtomic();
}
