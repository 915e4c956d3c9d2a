package com.flamingo.pagination.domain.block;

import com.flamingo.pagination.domain.enums.BlockKind;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A paragraph of text runs. Positions live on each run.
 *
 * @param id stable block id
 * @param runs formatted runs in reading order
 * @param attrs opaque paragraph attributes (alignment, spacing, ...) passed through to renderers
 */
public record ParagraphBlock(String id, List<TextRun> runs, Map<String, Object> attrs)
    implements FlowBlock {

  public ParagraphBlock {
    runs = runs == null ? List.of() : List.copyOf(runs);
    attrs = attrs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attrs));
  }

  public ParagraphBlock(String id, List<TextRun> runs) {
    this(id, runs, Map.of());
  }

  @Override
  public BlockKind kind() {
    return BlockKind.PARAGRAPH;
  }

  @Override
  public PositionSpan positionSpan() {
    PositionSpan span = PositionSpan.EMPTY;
    for (TextRun run : runs) {
      span = span.union(run.span());
    }
    return span;
  }

  @Override
  public ParagraphBlock shiftPositions(int delta) {
    return new ParagraphBlock(id, runs.stream().map(run -> run.shift(delta)).toList(), attrs);
  }

  public String text() {
    StringBuilder sb = new StringBuilder();
    for (TextRun run : runs) {
      sb.append(run.text());
    }
    return sb.toString();
  }
}
