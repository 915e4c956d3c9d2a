package com.flamingo.pagination.domain.source;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The document-tree node a group of blocks was converted from, as seen by the cache.
 *
 * <p>Only two things are read from it: the revision marker in {@link #REVISION_ATTR} (fast path)
 * and its canonical serialization (verified path).
 *
 * @param type node type name
 * @param attrs node attributes, including the revision marker when the editor maintains one
 * @param content child nodes
 * @param text text of a leaf text node, otherwise {@code null}
 */
public record SourceNode(
    String type, Map<String, Object> attrs, List<SourceNode> content, String text) {

  public static final String REVISION_ATTR = "blockRev";

  public SourceNode {
    attrs = attrs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attrs));
    content = content == null ? List.of() : List.copyOf(content);
  }

  public static SourceNode text(String text) {
    return new SourceNode("text", Map.of(), List.of(), text);
  }

  public static SourceNode element(
      String type, Map<String, Object> attrs, List<SourceNode> content) {
    return new SourceNode(type, attrs, content, null);
  }

  /** The caller-maintained revision marker, or {@code null} when the node carries none. */
  public Integer revisionMarker() {
    Object value = attrs.get(REVISION_ATTR);
    return value instanceof Number number ? number.intValue() : null;
  }
}
