package edu.jhu.hlt.penman.experiment;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.apache.log4j.Logger;

import edu.jhu.hlt.penman.codec.Indent;
import edu.jhu.hlt.penman.codec.PenmanCodec;
import edu.jhu.hlt.penman.datatypes.Graph;
import edu.jhu.hlt.penman.datatypes.Tree;
import edu.jhu.hlt.penman.io.PenmanDocumentIterator;
import edu.jhu.hlt.penman.io.PenmanDocumentIterator.Document;
import edu.jhu.hlt.penman.layout.Model;
import edu.jhu.hlt.penman.lexer.PenmanSyntaxException;
import edu.jhu.hlt.penman.util.ExperimentProperties;

/**
 * Reads a file of PENMAN documents and writes each one back out with the
 * requested layout, or as triples.
 *
 * Usage: Reformat input FILE [output FILE] [indent none|auto|N]
 *   [compact true|false] [triples true|false] [amr true|false] [failFast true|false]
 *
 * @author travis
 */
public class Reformat {
  public static final Logger LOG = Logger.getLogger(Reformat.class);

  private final PenmanCodec codec;
  private final Indent indent;
  private final boolean compact;
  private final boolean triples;
  private final boolean failFast;

  public int numOk, numSkipped;

  public Reformat(ExperimentProperties config) {
    Model model = config.getBoolean("amr", false) ? Model.amr() : new Model();
    this.codec = new PenmanCodec(model);
    this.indent = config.getIndent("indent", Indent.AUTO);
    this.compact = config.getBoolean("compact", false);
    this.triples = config.getBoolean("triples", false);
    this.failFast = config.getBoolean("failFast", false);
  }

  /** Returns the reformatted document, or null if it was skipped. */
  public String reformat(Document doc) {
    try {
      Tree t = codec.parse(doc.text);
      String out;
      if (triples) {
        Graph g = codec.getLayout().interpret(t, codec.getModel());
        out = codec.encodeTriples(g, indent.breaksLines());
      } else {
        out = codec.format(t, indent, compact);
      }
      numOk++;
      return out;
    } catch (PenmanSyntaxException e) {
      if (failFast)
        throw e;
      numSkipped++;
      LOG.warn("[reformat] skipping document starting on line " + doc.firstLine + ": " + e.getMessage());
      return null;
    }
  }

  public void run(PenmanDocumentIterator docs, Writer w) throws IOException {
    boolean first = true;
    while (docs.hasNext()) {
      String out = reformat(docs.next());
      if (out == null)
        continue;
      if (!first)
        w.write("\n\n");
      w.write(out);
      first = false;
    }
    if (!first)
      w.write("\n");
    w.flush();
    LOG.info("[run] wrote " + numOk + " documents, skipped " + numSkipped);
  }

  public static void main(String[] args) throws IOException {
    ExperimentProperties config = ExperimentProperties.init(args);
    Reformat r = new Reformat(config);
    File input = config.getExistingFile("input");
    File output = config.getFile("output", null);
    try (PenmanDocumentIterator docs = new PenmanDocumentIterator(input)) {
      if (output == null) {
        r.run(docs, new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8)));
      } else {
        LOG.info("[main] writing to " + output.getPath());
        try (BufferedWriter w = Files.newBufferedWriter(output.toPath(), StandardCharsets.UTF_8)) {
          r.run(docs, w);
        }
      }
    }
    LOG.info("[main] config: " + config);
  }
}
