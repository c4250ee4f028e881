package edu.jhu.hlt.penman.datatypes;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;

/**
 * One parsed PENMAN document: a root {@link Node} plus the "# ::key value"
 * metadata that preceded it, in the order the keys were first seen.
 *
 * @author travis
 */
public final class Tree implements Serializable {
  private static final long serialVersionUID = -5153839014413232318L;

  private final Node root;
  private final Map<String, String> metadata;

  public Tree(Node root) {
    this(root, Collections.<String, String>emptyMap());
  }

  public Tree(Node root, Map<String, String> metadata) {
    Preconditions.checkNotNull(root);
    this.root = root;
    this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public Node getRoot() {
    return root;
  }

  public Map<String, String> getMetadata() {
    return metadata;
  }

  /** Every node id appearing anywhere in the tree. */
  public Set<String> nodeIds() {
    Set<String> ids = new LinkedHashSet<>();
    for (Node n : root.nodes())
      if (n.getId() != null)
        ids.add(n.getId());
    return ids;
  }

  @Override
  public String toString() {
    return "(Tree " + metadata + " " + root + ")";
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof Tree))
      return false;
    Tree t = (Tree) other;
    return root.equals(t.root) && metadata.equals(t.metadata);
  }

  @Override
  public int hashCode() {
    return 31 * root.hashCode() + metadata.hashCode();
  }
}
