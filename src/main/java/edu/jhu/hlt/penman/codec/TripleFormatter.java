package edu.jhu.hlt.penman.codec;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Joiner;

import edu.jhu.hlt.penman.datatypes.Triple;

/**
 * Writes triples as "relation(source, target)" conjoined with "^", either one
 * per line or all on one line. A null target is written as nothing, which
 * {@link TripleParser} reads back as null.
 *
 * @author travis
 */
public class TripleFormatter {

  private TripleFormatter() {}

  public static String format(List<Triple> triples, boolean multiline) {
    List<String> conjuncts = new ArrayList<>(triples.size());
    for (Triple t : triples) {
      String target = t.target == null ? "" : t.target.toPenman();
      conjuncts.add(t.relation + "(" + t.source + ", " + target + ")");
    }
    return Joiner.on(multiline ? " ^\n" : " ^ ").join(conjuncts);
  }
}
