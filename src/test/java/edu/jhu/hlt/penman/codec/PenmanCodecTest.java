package edu.jhu.hlt.penman.codec;

import static org.junit.Assert.*;

import java.util.Arrays;

import org.junit.Test;

import edu.jhu.hlt.penman.datatypes.Atom;
import edu.jhu.hlt.penman.datatypes.Graph;
import edu.jhu.hlt.penman.datatypes.Tree;
import edu.jhu.hlt.penman.datatypes.Triple;
import edu.jhu.hlt.penman.layout.Model;

public class PenmanCodecTest {

  private static final String[] DOCS = new String[] {
    "()",
    "(a)",
    "(b / bark :ARG1 (d / dog))",
    "# ::id 1\n# ::snt The boy wants to go.\n(w / want-01 :ARG0 (b / boy) :ARG1 (g / go-02 :ARG0 b))",
    "(a / alpha~e.1 :ARG0~e.2 (b / beta~e.3 :quant 5 :value -1.25) :name \"x \\\"y\\\"\" :polarity -)",
    "(a :ARG0 :ARG1 b :ARG2)",
    "(a / :mod (b /))",
    "(d / dog :ARG1-of (b / bark :time (n / now)) :mod (s / small :degree (v / very)))",
  };

  private PenmanCodec codec = new PenmanCodec(Model.amr());

  @Test
  public void roundTrip() {
    for (String s : DOCS) {
      Tree t = codec.parse(s);
      assertEquals(s, t, codec.parse(codec.format(t, Indent.AUTO, false)));
    }
  }

  @Test
  public void reformattingIsStable() {
    for (String s : DOCS) {
      for (Indent indent : Arrays.asList(Indent.NONE, Indent.AUTO, Indent.fixed(4))) {
        for (boolean compact : Arrays.asList(false, true)) {
          Tree first = codec.parse(s);
          String once = codec.format(first, indent, compact);
          Tree second = codec.parse(once);
          assertEquals(once, first, second);
          assertEquals(once, codec.format(second, indent, compact));
        }
      }
    }
  }

  @Test
  public void emptyNodeFormatsAsParens() {
    assertEquals("()", codec.format(codec.parse("()")));
  }

  @Test
  public void decode() {
    Graph g = codec.decode("(b / bark :ARG1 (d / dog))");
    assertEquals("b", g.getTop());
    assertEquals(Arrays.asList(
        new Triple("b", "instance", Atom.symbol("bark")),
        new Triple("b", "ARG1", Atom.symbol("d")),
        new Triple("d", "instance", Atom.symbol("dog"))),
        g.getTriples());
  }

  @Test
  public void decodeTriples() {
    Graph g = codec.decodeTriples("instance(b, bark) ^ instance(d, dog) ^ ARG1(b, d)");
    assertEquals("b", g.getTop());
    assertEquals(3, g.getTriples().size());
    assertEquals("(b / bark\n   :ARG1 (d / dog))", codec.encode(g));
  }

  @Test
  public void encodeWithTop() {
    Graph g = codec.decode("(b / bark :ARG1 (d / dog))");
    assertEquals("(d / dog :ARG1-of (b / bark))", codec.encode(g, "d", Indent.NONE, false));
  }

  @Test
  public void encodeTriples() {
    Graph g = codec.decode("(b / bark :ARG1 (d / dog))");
    assertEquals("instance(b, bark) ^\nARG1(b, d) ^\ninstance(d, dog)", codec.encodeTriples(g));
    assertEquals("instance(b, bark) ^ ARG1(b, d) ^ instance(d, dog)", codec.encodeTriples(g, false));
    assertEquals(g.getTriples(), codec.parseTriples(codec.encodeTriples(g)));
  }

  @Test
  public void decodeEncode() {
    for (String s : DOCS) {
      Graph g = codec.decode(s);
      Graph again = codec.decode(codec.encode(g));
      assertEquals(s, g.getTriples(), again.getTriples());
      assertEquals(s, g.getTop(), again.getTop());
    }
  }
}
