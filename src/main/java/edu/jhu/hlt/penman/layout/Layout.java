package edu.jhu.hlt.penman.layout;

import edu.jhu.hlt.penman.datatypes.Graph;
import edu.jhu.hlt.penman.datatypes.Tree;

/**
 * Converts between the nested {@link Tree} read from PENMAN text and the flat
 * {@link Graph} of triples it describes. Each direction builds a new object,
 * neither argument is modified.
 *
 * @author travis
 */
public interface Layout {

  public Graph interpret(Tree tree, Model model);

  /**
   * @param top the variable to put at the root, or null to use the graph's own
   * @throws LayoutException if some triples cannot be reached from the top
   */
  public Tree configure(Graph graph, String top, Model model);
}
