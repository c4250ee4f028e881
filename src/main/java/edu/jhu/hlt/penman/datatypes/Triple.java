package edu.jhu.hlt.penman.datatypes;

import java.io.Serializable;

import com.google.common.base.Preconditions;

/**
 * relation(source, target), e.g. instance(b, bark). The target may be null
 * when it was left out, as in "ARG0(b, )".
 *
 * @author travis
 */
public final class Triple implements Serializable {
  private static final long serialVersionUID = 1836904478219031597L;

  public final String source;
  public final String relation;
  public final Atom target;   // may be null

  public Triple(String source, String relation, Atom target) {
    Preconditions.checkNotNull(source);
    Preconditions.checkNotNull(relation);
    this.source = source;
    this.relation = relation;
    this.target = target;
  }

  /** True if the target is a symbol with the given name. */
  public boolean targetIs(String id) {
    return target != null && target.getType() == Atom.Type.SYMBOL
        && ((Atom.Symbol) target).name.equals(id);
  }

  @Override
  public String toString() {
    return "(" + source + ", " + relation + ", " + target + ")";
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof Triple))
      return false;
    Triple t = (Triple) other;
    return source.equals(t.source) && relation.equals(t.relation)
        && (target == null ? t.target == null : target.equals(t.target));
  }

  @Override
  public int hashCode() {
    int h = source.hashCode();
    h = 31 * h + relation.hashCode();
    return 31 * h + (target == null ? 0 : target.hashCode());
  }
}
