package edu.jhu.hlt.penman.io;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Iterator;
import java.util.NoSuchElementException;

import org.apache.log4j.Logger;

import edu.jhu.hlt.penman.io.PenmanDocumentIterator.Document;

/**
 * Splits a file of many PENMAN documents (or triple conjunctions) into one
 * string per document. Documents are separated by one or more blank lines;
 * "# ::" comment lines belong to the document which follows them.
 *
 * @author travis
 */
public class PenmanDocumentIterator implements Iterator<Document>, AutoCloseable {
  public static final Logger LOG = Logger.getLogger(PenmanDocumentIterator.class);

  public static class Document {
    public final String text;
    public final int firstLine;   // 1-based line number in the input

    public Document(String text, int firstLine) {
      this.text = text;
      this.firstLine = firstLine;
    }

    @Override
    public String toString() {
      return "(Document line=" + firstLine + " " + text + ")";
    }
  }

  private final File file;      // may be null
  private final BufferedReader reader;
  private Document next;
  private int lineNo;

  public PenmanDocumentIterator(File f) throws IOException {
    LOG.info("[init] reading documents from " + f.getPath());
    this.file = f;
    this.reader = Files.newBufferedReader(f.toPath(), StandardCharsets.UTF_8);
    advance();
  }

  public PenmanDocumentIterator(InputStream is) {
    this(new InputStreamReader(is, StandardCharsets.UTF_8));
  }

  public PenmanDocumentIterator(Reader r) {
    this.file = null;
    this.reader = r instanceof BufferedReader ? (BufferedReader) r : new BufferedReader(r);
    advance();
  }

  public int getLineNo() {
    return lineNo;
  }

  @Override
  public boolean hasNext() {
    return next != null;
  }

  @Override
  public Document next() {
    if (next == null)
      throw new NoSuchElementException();
    Document d = next;
    advance();
    return d;
  }

  private void advance() {
    next = null;
    StringBuilder sb = new StringBuilder();
    int start = -1;
    boolean onlyComments = true;
    try {
      for (String line = reader.readLine(); line != null; line = reader.readLine()) {
        lineNo++;
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
          if (start >= 0 && !onlyComments)
            break;
          continue;
        }
        if (!trimmed.startsWith("#"))
          onlyComments = false;
        if (start < 0)
          start = lineNo;
        else
          sb.append('\n');
        sb.append(line);
      }
    } catch (IOException e) {
      throw new RuntimeException("failed reading line " + (lineNo + 1) + " of " + this, e);
    }
    if (start >= 0)
      next = new Document(sb.toString(), start);
  }

  @Override
  public void close() throws IOException {
    // If a stream or reader was provided, then the onus is on the caller to close it
    if (file != null) {
      LOG.info("[close] " + file.getPath() + " after " + lineNo + " lines");
      reader.close();
    }
  }

  @Override
  public String toString() {
    if (file == null)
      return "(PenmanDocumentIterator stream lineNo=" + lineNo + ")";
    return "(PenmanDocumentIterator " + file.getPath() + " lineNo=" + lineNo + ")";
  }
}
