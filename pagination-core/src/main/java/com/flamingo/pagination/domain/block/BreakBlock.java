package com.flamingo.pagination.domain.block;

import com.flamingo.pagination.domain.enums.BlockKind;
import com.flamingo.pagination.domain.enums.BreakKind;
import com.flamingo.pagination.domain.layout.PageGeometry;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A page, column or section break. Breaks always end the current page.
 *
 * @param id stable block id
 * @param breakKind which break this is
 * @param span top-level source positions (section breaks carry them), may be empty
 * @param attrs opaque break attributes
 * @param geometry page geometry for pages after a section break, or {@code null} to keep the
 *     current one
 */
public record BreakBlock(
    String id,
    BreakKind breakKind,
    PositionSpan span,
    Map<String, Object> attrs,
    PageGeometry geometry)
    implements FlowBlock {

  public BreakBlock {
    span = span == null ? PositionSpan.EMPTY : span;
    attrs = attrs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attrs));
  }

  public static BreakBlock pageBreak(String id) {
    return new BreakBlock(id, BreakKind.PAGE, PositionSpan.EMPTY, Map.of(), null);
  }

  public static BreakBlock columnBreak(String id) {
    return new BreakBlock(id, BreakKind.COLUMN, PositionSpan.EMPTY, Map.of(), null);
  }

  public static BreakBlock sectionBreak(String id, PositionSpan span, PageGeometry geometry) {
    return new BreakBlock(id, BreakKind.SECTION, span, Map.of(), geometry);
  }

  @Override
  public BlockKind kind() {
    return breakKind.blockKind();
  }

  @Override
  public PositionSpan positionSpan() {
    return span;
  }

  @Override
  public BreakBlock shiftPositions(int delta) {
    return new BreakBlock(id, breakKind, span.shift(delta), attrs, geometry);
  }
}
