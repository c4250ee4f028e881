package edu.jhu.hlt.penman.datatypes;

import java.io.Serializable;
import java.math.BigInteger;
import java.util.Set;

import com.google.common.base.Preconditions;

/**
 * An atomic constant: a symbol, a quoted string, an integer, or a real.
 * The set of subclasses is closed (the constructor is private), so
 * {@link #toPenman()} is the one place each kind decides how it is written.
 *
 * @author travis
 */
public abstract class Atom implements Target, Serializable {
  private static final long serialVersionUID = -3380725318742108214L;

  public enum Type {
    SYMBOL, STRING, INTEGER, FLOAT
  }

  private Atom() {}

  public abstract Type getType();

  /** How this constant is written in PENMAN text. */
  public abstract String toPenman();

  @Override
  public boolean isAtomic() {
    return true;
  }

  @Override
  public String toString() {
    return toPenman();
  }

  public static Symbol symbol(String name) {
    return new Symbol(name);
  }

  public static Str string(String value) {
    return Str.of(value);
  }

  public static Int integer(BigInteger value) {
    return new Int(value);
  }

  public static Int integer(long value) {
    return new Int(BigInteger.valueOf(value));
  }

  public static Real real(double value) {
    return new Real(value);
  }

  /** True if this is a symbol whose name is one of the given identifiers. */
  public boolean isSymbolIn(Set<String> ids) {
    return getType() == Type.SYMBOL && ids.contains(((Symbol) this).name);
  }

  public static final class Symbol extends Atom {
    private static final long serialVersionUID = 5230991712604458617L;
    public final String name;

    private Symbol(String name) {
      Preconditions.checkNotNull(name);
      Preconditions.checkArgument(!name.isEmpty(), "empty symbol");
      this.name = name;
    }

    @Override
    public Type getType() {
      return Type.SYMBOL;
    }

    @Override
    public String toPenman() {
      return name;
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Symbol && name.equals(((Symbol) other).name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }
  }

  /**
   * A quoted string. {@link #value} has the backslash escapes removed, but the
   * body is also kept as it was written so that {@link #toPenman()} gives back
   * the source text, e.g. "C:\\temp" keeps its backslash.
   */
  public static final class Str extends Atom {
    private static final long serialVersionUID = -1489002713920474475L;
    public final String value;
    private final String escaped;   // between the quotes, as written

    private Str(String value, String escaped) {
      Preconditions.checkNotNull(value);
      Preconditions.checkNotNull(escaped);
      this.value = value;
      this.escaped = escaped;
    }

    @Override
    public Type getType() {
      return Type.STRING;
    }

    @Override
    public String toPenman() {
      return '"' + escaped + '"';
    }

    /** Builds a string constant from unescaped text, escaping '"' and '\\'. */
    static Str of(String value) {
      Preconditions.checkNotNull(value);
      StringBuilder sb = new StringBuilder(value.length() + 2);
      for (int i = 0; i < value.length(); i++) {
        char c = value.charAt(i);
        if (c == '"' || c == '\\')
          sb.append('\\');
        sb.append(c);
      }
      return new Str(value, sb.toString());
    }

    /** Reads a quoted string token, keeping its body as written. */
    public static Str unquote(String quoted) {
      Preconditions.checkArgument(quoted.length() >= 2
          && quoted.charAt(0) == '"' && quoted.charAt(quoted.length() - 1) == '"',
          "not a quoted string: %s", quoted);
      String body = quoted.substring(1, quoted.length() - 1);
      StringBuilder sb = new StringBuilder(body.length());
      for (int i = 0; i < body.length(); i++) {
        char c = body.charAt(i);
        if (c == '\\' && i + 1 < body.length())
          c = body.charAt(++i);
        sb.append(c);
      }
      return new Str(sb.toString(), body);
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Str && escaped.equals(((Str) other).escaped);
    }

    @Override
    public int hashCode() {
      return 31 * escaped.hashCode() + 1;
    }
  }

  public static final class Int extends Atom {
    private static final long serialVersionUID = 8140522307771386263L;
    public final BigInteger value;

    private Int(BigInteger value) {
      Preconditions.checkNotNull(value);
      this.value = value;
    }

    @Override
    public Type getType() {
      return Type.INTEGER;
    }

    @Override
    public String toPenman() {
      return value.toString();
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Int && value.equals(((Int) other).value);
    }

    @Override
    public int hashCode() {
      return value.hashCode();
    }
  }

  public static final class Real extends Atom {
    private static final long serialVersionUID = -6914377026281554391L;
    public final double value;

    private Real(double value) {
      this.value = value;
    }

    @Override
    public Type getType() {
      return Type.FLOAT;
    }

    @Override
    public String toPenman() {
      return Double.toString(value);
    }

    @Override
    public boolean equals(Object other) {
      return other instanceof Real
          && Double.compare(value, ((Real) other).value) == 0;
    }

    @Override
    public int hashCode() {
      return Double.hashCode(value);
    }
  }
}
