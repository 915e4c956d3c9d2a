package com.flamingo.pagination.service.measure;

import com.flamingo.pagination.domain.block.FlowBlock;
import com.flamingo.pagination.domain.measure.Measure;
import com.flamingo.pagination.domain.measure.MeasureConstraints;
import java.util.concurrent.CompletableFuture;

/**
 * Computes layout metrics for a block. Implemented by the host (text shaping, font metrics); the
 * pagination core only calls it.
 *
 * <p>Implementations must be pure for identical block content and safe to call concurrently for
 * distinct blocks. They are never called for breaks.
 */
public interface MeasurementPort {

  /**
   * Measures one block.
   *
   * @param block paragraph, image or drawing block
   * @param constraints space available on the page
   * @return the block's measure; a {@link com.flamingo.pagination.domain.measure.ParagraphMeasure}
   *     for paragraphs
   */
  CompletableFuture<Measure> measure(FlowBlock block, MeasureConstraints constraints);
}
