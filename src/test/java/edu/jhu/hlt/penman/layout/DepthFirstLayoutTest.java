package edu.jhu.hlt.penman.layout;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import edu.jhu.hlt.penman.codec.Indent;
import edu.jhu.hlt.penman.codec.PenmanCodec;
import edu.jhu.hlt.penman.datatypes.Atom;
import edu.jhu.hlt.penman.datatypes.Graph;
import edu.jhu.hlt.penman.datatypes.Node;
import edu.jhu.hlt.penman.datatypes.Tree;
import edu.jhu.hlt.penman.datatypes.Triple;

public class DepthFirstLayoutTest {

  private Model model = Model.amr();
  private Layout layout = new DepthFirstLayout();
  private PenmanCodec codec = new PenmanCodec(model, layout);

  @Test
  public void modelInversion() {
    assertTrue(model.isInverted("ARG0-of"));
    assertFalse(model.isInverted("ARG0"));
    assertFalse(model.isInverted("consist-of"));
    assertEquals("ARG0", model.invert("ARG0-of"));
    assertEquals("ARG0-of", model.invert("ARG0"));
    assertEquals("consist-of-of", model.invert("consist-of"));
    assertTrue(new Model().isInverted("consist-of"));
  }

  @Test
  public void interpretInvertedRole() {
    Graph g = layout.interpret(codec.parse("(d / dog :ARG1-of (b / bark))"), model);
    assertEquals("d", g.getTop());
    assertEquals(Arrays.asList(
        new Triple("d", "instance", Atom.symbol("dog")),
        new Triple("b", "ARG1", Atom.symbol("d")),
        new Triple("b", "instance", Atom.symbol("bark"))),
        g.getTriples());
  }

  @Test
  public void interpretInvertedReference() {
    Graph g = layout.interpret(codec.parse("(a / alpha :ARG0 (b / beta :ARG1-of a))"), model);
    assertEquals(new Triple("a", "ARG1", Atom.symbol("b")), g.getTriples().get(3));
  }

  @Test
  public void interpretKeepsConstantsAndDanglingEdges() {
    Graph g = layout.interpret(codec.parse("(a :mod-of 5 :ARG0)"), model);
    assertEquals(Arrays.asList(
        new Triple("a", "mod-of", Atom.integer(5)),
        new Triple("a", "ARG0", null)),
        g.getTriples());
  }

  @Test
  public void emptyTree() {
    Graph g = layout.interpret(codec.parse("()"), model);
    assertTrue(g.isEmpty());
    assertNull(g.getTop());
    assertTrue(layout.configure(g, null, model).getRoot().isEmpty());
  }

  @Test
  public void configureReentrancy() {
    String s = "(w / want-01\n"
        + "   :ARG0 (b / boy)\n"
        + "   :ARG1 (g / go-02\n"
        + "            :ARG0 b))";
    Graph g = codec.decode(s);
    assertEquals(s, codec.encode(g));
  }

  @Test
  public void configureInverts() {
    Graph g = new Graph(Arrays.asList(
        new Triple("d", "instance", Atom.symbol("dog")),
        new Triple("b", "ARG1", Atom.symbol("d")),
        new Triple("b", "instance", Atom.symbol("bark"))));
    Tree t = layout.configure(g, null, model);
    assertEquals("(d / dog :ARG1-of (b / bark))", codec.format(t, Indent.NONE, false));
  }

  @Test
  public void configureCycle() {
    Graph g = new Graph(Arrays.asList(
        new Triple("a", "instance", Atom.symbol("alpha")),
        new Triple("a", "ARG0", Atom.symbol("b")),
        new Triple("b", "instance", Atom.symbol("beta")),
        new Triple("b", "ARG0", Atom.symbol("a"))));
    assertEquals("(a / alpha :ARG0 (b / beta :ARG0 a))",
        codec.encode(g, null, Indent.NONE, false));
    assertEquals("(b / beta :ARG0 (a / alpha :ARG0 b))",
        codec.encode(g, "b", Indent.NONE, false));
  }

  @Test
  public void metadataCarriedThrough() {
    Graph g = codec.decode("# ::id 7\n(a / alpha)");
    assertEquals(Collections.singletonMap("id", "7"), g.getMetadata());
    assertEquals("# ::id 7\n(a / alpha)", codec.encode(g));
  }

  @Test(expected = LayoutException.class)
  public void disconnected() {
    Graph g = new Graph(Arrays.asList(
        new Triple("a", "instance", Atom.symbol("alpha")),
        new Triple("b", "instance", Atom.symbol("beta"))));
    layout.configure(g, null, model);
  }

  @Test(expected = LayoutException.class)
  public void unknownTop() {
    Graph g = new Graph(Arrays.asList(new Triple("a", "instance", Atom.symbol("alpha"))));
    layout.configure(g, "z", model);
  }

  @Test
  public void configureDoesNotModifyGraph() {
    Graph g = codec.decode("(b / bark :ARG1 (d / dog))");
    Graph copy = new Graph(g.getTriples(), g.getTop(), g.getMetadata());
    Node root = layout.configure(g, null, model).getRoot();
    assertEquals("b", root.getId());
    assertEquals(copy, g);
  }
}
