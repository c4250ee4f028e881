package edu.jhu.hlt.penman.codec;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import edu.jhu.hlt.penman.datatypes.AlignmentMarker;
import edu.jhu.hlt.penman.datatypes.AlignmentMarker.Mode;

public class AlignmentParserTest {

  @Test
  public void prefixAndIndices() {
    AlignmentMarker m = AlignmentParser.decode("~e.1,2", Mode.TARGET_EPIGRAPH);
    assertEquals("e", m.getPrefix());
    assertEquals(Arrays.asList(1, 2), m.getIndices());
    assertEquals(Mode.TARGET_EPIGRAPH, m.getMode());
    assertEquals("~e.1,2", m.toPenman());
  }

  @Test
  public void noPrefix() {
    AlignmentMarker m = AlignmentParser.decode("~3", Mode.ROLE_EPIGRAPH);
    assertNull(m.getPrefix());
    assertEquals(Collections.singletonList(3), m.getIndices());
    assertEquals(Mode.ROLE_EPIGRAPH, m.getMode());
    assertEquals("~3", m.toPenman());
  }

  @Test
  public void prefixWithoutDot() {
    AlignmentMarker m = AlignmentParser.decode("~e4", Mode.ROLE_EPIGRAPH);
    assertEquals("e", m.getPrefix());
    assertEquals(Collections.singletonList(4), m.getIndices());
    assertEquals("~e.4", m.toPenman());
  }

  @Test
  public void malformed() {
    for (String s : Arrays.asList("~", "~e.", "~x.y", "~,1")) {
      AlignmentMarker m = AlignmentParser.decode(s, Mode.TARGET_EPIGRAPH);
      assertNull(s, m.getPrefix());
      assertTrue(s, m.isEmpty());
    }
  }
}
