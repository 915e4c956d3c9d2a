package com.flamingo.pagination.service.measure;

import com.flamingo.pagination.domain.block.FlowBlock;
import com.flamingo.pagination.domain.measure.Measure;
import com.flamingo.pagination.domain.measure.MeasureConstraints;
import com.flamingo.pagination.domain.measure.MeasuredBlock;
import com.flamingo.pagination.exception.MeasurementException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Drives the {@link MeasurementPort}: measures independent blocks concurrently on the measurement
 * executor and hands results back in input order.
 *
 * <p>Only the port calls run in parallel. Callers keep every cache read and write on their own
 * thread.
 */
@Service
@Slf4j
public class MeasurementService {

  private final MeasurementPort measurementPort;
  private final Executor measurementExecutor;
  private final MeterRegistry meterRegistry;

  public MeasurementService(
      MeasurementPort measurementPort,
      @Qualifier("measurementExecutor") Executor measurementExecutor,
      MeterRegistry meterRegistry) {
    this.measurementPort = measurementPort;
    this.measurementExecutor = measurementExecutor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Measures every block, returning them paired with their measures in input order.
   *
   * @param blocks blocks to measure; breaks get a {@code null} measure without calling the port
   * @param constraints space available on the page
   * @return measured blocks
   * @throws MeasurementException if the port fails, returns nothing or returns an unusable
   *     height for any block
   */
  public List<MeasuredBlock> measureAll(List<FlowBlock> blocks, MeasureConstraints constraints) {
    List<CompletableFuture<Measure>> pending = new ArrayList<>(blocks.size());
    for (FlowBlock block : blocks) {
      if (block.kind().isBreak()) {
        pending.add(CompletableFuture.completedFuture(null));
      } else {
        pending.add(
            CompletableFuture.supplyAsync(
                    () -> measurementPort.measure(block, constraints), measurementExecutor)
                .thenCompose(future -> future));
      }
    }

    List<MeasuredBlock> measured = new ArrayList<>(blocks.size());
    for (int i = 0; i < blocks.size(); i++) {
      FlowBlock block = blocks.get(i);
      Measure measure = await(block, pending.get(i));
      measured.add(new MeasuredBlock(block, measure));
    }
    log.debug("Measured {} blocks", blocks.size());
    return measured;
  }

  /**
   * Measures a single block on the calling thread's behalf.
   *
   * @throws MeasurementException if the port fails or returns nothing
   */
  public Measure measure(FlowBlock block, MeasureConstraints constraints) {
    if (block.kind().isBreak()) {
      return null;
    }
    CompletableFuture<Measure> future;
    try {
      future = measurementPort.measure(block, constraints);
    } catch (RuntimeException e) {
      future = CompletableFuture.failedFuture(e);
    }
    return await(block, future != null ? future : CompletableFuture.completedFuture(null));
  }

  private Measure await(FlowBlock block, CompletableFuture<Measure> future) {
    if (block.kind().isBreak()) {
      return null;
    }
    Measure measure;
    try {
      measure = future.join();
    } catch (CompletionException | CancellationException e) {
      meterRegistry.counter("pagination.measure.requests", "result", "failure").increment();
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw new MeasurementException(
          block.id(),
          "Measurement failed for block " + block.id() + ": " + cause.getMessage(),
          cause);
    }
    if (measure == null) {
      meterRegistry.counter("pagination.measure.requests", "result", "failure").increment();
      throw new MeasurementException(
          block.id(), "Measurement returned nothing for block " + block.id());
    }
    if (!measure.hasUsableHeights()) {
      meterRegistry.counter("pagination.measure.requests", "result", "failure").increment();
      throw new MeasurementException(
          block.id(), "Measurement returned an unusable height for block " + block.id());
    }
    meterRegistry.counter("pagination.measure.requests", "result", "success").increment();
    return measure;
  }
}
