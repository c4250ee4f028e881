package edu.jhu.hlt.penman.layout;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Knows which roles are written inverted. A role like "ARG0-of" is the
 * inverse of "ARG0" unless it is listed as an exception, e.g. AMR's
 * "consist-of" which is a role in its own right.
 *
 * @author travis
 */
public class Model {

  public static final String INVERSE_SUFFIX = "-of";

  /** AMR roles which end in "-of" but are not inversions. */
  public static final Set<String> AMR_NON_INVERTED =
      Collections.unmodifiableSet(new HashSet<>(Arrays.asList("consist-of", "prep-out-of", "prep-on-behalf-of")));

  private final Set<String> nonInverted;

  /** A model with no exceptions, every "-of" role is inverted. */
  public Model() {
    this(Collections.<String>emptySet());
  }

  public Model(Collection<String> nonInvertedRoles) {
    this.nonInverted = Collections.unmodifiableSet(new HashSet<>(nonInvertedRoles));
  }

  public static Model amr() {
    return new Model(AMR_NON_INVERTED);
  }

  /** @param role without a leading colon */
  public boolean isInverted(String role) {
    return role.endsWith(INVERSE_SUFFIX) && !nonInverted.contains(role);
  }

  /** "ARG0" <=> "ARG0-of" */
  public String invert(String role) {
    if (isInverted(role))
      return role.substring(0, role.length() - INVERSE_SUFFIX.length());
    return role + INVERSE_SUFFIX;
  }
}
