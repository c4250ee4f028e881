package edu.jhu.hlt.penman.layout;

/**
 * A {@link edu.jhu.hlt.penman.datatypes.Graph} could not be arranged as a
 * tree, e.g. some triples are not connected to the top.
 *
 * @author travis
 */
public class LayoutException extends RuntimeException {
  private static final long serialVersionUID = 5620497150731228903L;

  public LayoutException(String message) {
    super(message);
  }
}
