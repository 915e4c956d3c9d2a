package com.flamingo.pagination.domain.block;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Attributes of an image or drawing block: an optional position span plus opaque properties.
 *
 * <p>Properties (anchoring flags, wrap settings, custom keys, ...) are never interpreted by the
 * pagination core except for the {@code width}/{@code height} hints read by the approximate
 * measurer, and they survive position shifts untouched.
 */
public record BlockAttrs(PositionSpan span, Map<String, Object> properties) {

  public static final String PM_START = "pmStart";
  public static final String PM_END = "pmEnd";

  public static final BlockAttrs EMPTY = new BlockAttrs(PositionSpan.EMPTY, Map.of());

  public BlockAttrs {
    span = span == null ? PositionSpan.EMPTY : span;
    properties =
        properties == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
  }

  /**
   * Lifts a loose attribute map into the typed form: {@code pmStart}/{@code pmEnd} become the span
   * when they are numbers, every other key is kept as a property.
   */
  public static BlockAttrs fromMap(Map<String, Object> raw) {
    if (raw == null || raw.isEmpty()) {
      return EMPTY;
    }
    Map<String, Object> properties = new LinkedHashMap<>(raw);
    Integer start = asInteger(properties.remove(PM_START));
    Integer end = asInteger(properties.remove(PM_END));
    return new BlockAttrs(new PositionSpan(start, end), properties);
  }

  public BlockAttrs shift(int delta) {
    return new BlockAttrs(span.shift(delta), properties);
  }

  public Object property(String key) {
    return properties.get(key);
  }

  /** Numeric property value, or {@code fallback} when absent or not a number. */
  public double numberProperty(String key, double fallback) {
    Object value = properties.get(key);
    return value instanceof Number number ? number.doubleValue() : fallback;
  }

  /** The loose map form, with positions written back under their usual keys. */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>(properties);
    if (span.pmStart() != null) {
      map.put(PM_START, span.pmStart());
    }
    if (span.pmEnd() != null) {
      map.put(PM_END, span.pmEnd());
    }
    return map;
  }

  private static Integer asInteger(Object value) {
    return value instanceof Number number ? number.intValue() : null;
  }
}
