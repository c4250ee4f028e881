package edu.jhu.hlt.penman.codec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Splitter;

import edu.jhu.hlt.penman.datatypes.AlignmentMarker;

/**
 * Decodes alignment token text such as "~e.1,2" or "~3". Text which does not
 * look like a marker decodes to a marker with no indices and no prefix; this
 * never fails.
 *
 * @author travis
 */
public class AlignmentParser {

  private static final Pattern MARKER = Pattern.compile("~(?:([a-zA-Z])\\.?)?(\\d+(?:,\\d+)*)");
  private static final Splitter COMMA = Splitter.on(',');

  private AlignmentParser() {}

  public static AlignmentMarker decode(String text, AlignmentMarker.Mode mode) {
    Matcher m = MARKER.matcher(text);
    if (!m.lookingAt())
      return new AlignmentMarker(Collections.<Integer>emptyList(), null, mode);
    List<Integer> indices = new ArrayList<>();
    try {
      for (String i : COMMA.split(m.group(2)))
        indices.add(Integer.valueOf(i));
    } catch (NumberFormatException e) {
      // digits too long for an int
      return new AlignmentMarker(Collections.<Integer>emptyList(), null, mode);
    }
    return new AlignmentMarker(indices, m.group(1), mode);
  }
}
