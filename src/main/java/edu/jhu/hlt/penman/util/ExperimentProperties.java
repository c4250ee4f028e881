package edu.jhu.hlt.penman.util;

import java.io.File;

import edu.jhu.hlt.penman.codec.Indent;

/**
 * Settings for a run, read from "key value" pairs on the command line.
 *
 * Getters which take a default return it when the key is missing and also
 * record it, so that dumping the properties at the end of a run shows every
 * setting that was actually used.
 *
 * @author travis
 */
public class ExperimentProperties extends java.util.Properties {
  private static final long serialVersionUID = 1L;

  public static ExperimentProperties init(String[] mainArgs) {
    ExperimentProperties config = new ExperimentProperties();
    config.putAll(mainArgs);
    return config;
  }

  public void putAll(String[] mainArgs) {
    putAll(mainArgs, false);
  }

  public void putAll(String[] mainArgs, boolean allowOverwrites) {
    if (mainArgs.length % 2 != 0)
      throw new IllegalArgumentException("expected key value pairs, got " + mainArgs.length + " args");
    for (int i = 0; i < mainArgs.length; i += 2) {
      Object old = put(mainArgs[i], mainArgs[i+1]);
      if (!allowOverwrites && old != null) {
        throw new IllegalArgumentException(mainArgs[i] + " has two values: "
            + mainArgs[i+1] + " and " + old);
      }
    }
  }

  public int getInt(String key, int defaultValue) {
    String value = getProperty(key);
    if (value == null) {
      put(key, String.valueOf(defaultValue));
      return defaultValue;
    }
    return Integer.parseInt(value);
  }

  public boolean getBoolean(String key, boolean defaultValue) {
    String value = getProperty(key);
    if (value == null) {
      put(key, String.valueOf(defaultValue));
      return defaultValue;
    }
    return Boolean.parseBoolean(value);
  }

  /** "none", "auto", or an integer number of columns per level. */
  public Indent getIndent(String key, Indent defaultValue) {
    String value = getProperty(key);
    if (value == null) {
      put(key, defaultValue.toString());
      return defaultValue;
    }
    return Indent.parse(value);
  }

  public String getString(String key, String defaultValue) {
    String value = getProperty(key);
    if (value == null) {
      if (defaultValue != null)
        put(key, defaultValue);
      return defaultValue;
    }
    return value;
  }

  public String getString(String key) {
    String value = getProperty(key);
    if (value == null)
      throw new IllegalArgumentException("missing required property: " + key);
    return value;
  }

  /** @return null if the key is missing */
  public File getFile(String key, File defaultValue) {
    String value = getProperty(key);
    if (value == null) {
      if (defaultValue != null)
        put(key, defaultValue.getPath());
      return defaultValue;
    }
    return new File(value);
  }

  public File getExistingFile(String key) {
    File f = new File(getString(key));
    if (!f.isFile())
      throw new IllegalArgumentException(key + "=" + f.getPath() + " is not a file");
    return f;
  }
}
