package com.flamingo.pagination.service.layout;

import com.flamingo.pagination.config.PaginationConfig;
import com.flamingo.pagination.domain.block.BlockPositions;
import com.flamingo.pagination.domain.block.FlowBlock;
import com.flamingo.pagination.domain.layout.Layout;
import com.flamingo.pagination.domain.layout.PageGeometry;
import com.flamingo.pagination.domain.measure.MeasureConstraints;
import com.flamingo.pagination.domain.measure.MeasuredBlock;
import com.flamingo.pagination.service.cache.CacheLookup;
import com.flamingo.pagination.service.cache.FlowBlockCache;
import com.flamingo.pagination.service.cache.GenerationToken;
import com.flamingo.pagination.service.cache.SourceNodeSerializer;
import com.flamingo.pagination.service.footnote.FootnoteReserveOrchestrator;
import com.flamingo.pagination.service.footnote.ReserveLoopResult;
import com.flamingo.pagination.service.measure.MeasurementService;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of the IncrementalLayoutService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class IncrementalLayoutServiceImpl implements IncrementalLayoutService {

  private final MeasurementService measurementService;
  private final FootnoteReserveOrchestrator footnoteReserveOrchestrator;
  private final SourceNodeSerializer sourceNodeSerializer;
  private final PaginationConfig paginationConfig;
  private final MeterRegistry meterRegistry;

  @Override
  public LayoutSession createSession() {
    return new LayoutSession(new FlowBlockCache(sourceNodeSerializer, meterRegistry));
  }

  @Override
  @Timed(value = "pagination.layout.duration", description = "Time to lay out a document")
  public LayoutResult layout(LayoutSession session, LayoutRequest request) {
    PageGeometry geometry = request.geometry();
    if (geometry == null) {
      throw new IllegalArgumentException("Page geometry is required");
    }
    boolean cacheEnabled = paginationConfig.getCache().isEnabled();
    FlowBlockCache cache = session.getCache();
    if (session.getMeasuredGeometry() != null && !session.getMeasuredGeometry().equals(geometry)) {
      log.info("Page geometry changed; discarding {} cached measures", cache.size());
      cache.clear();
    }
    session.setMeasuredGeometry(geometry);

    List<SourceBlock> sources = request.sources();
    List<List<MeasuredBlock>> measured = new ArrayList<>(sources.size());
    List<CacheLookup> lookups = new ArrayList<>(sources.size());
    List<FlowBlock> toMeasure = new ArrayList<>();
    int hits = 0;

    GenerationToken token = cacheEnabled ? cache.begin() : null;
    try {
      if (cacheEnabled) {
        cache.setHasExternalChanges(request.externalChanges());
      }
      for (SourceBlock source : sources) {
        CacheLookup lookup = cacheEnabled ? cache.get(source.blockId(), source.node()) : null;
        lookups.add(lookup);
        if (lookup != null && lookup.isHit()) {
          measured.add(reuse(lookup.entry().blocks(), source.pmStart()));
          hits++;
        } else {
          measured.add(null);
          toMeasure.addAll(source.blocks());
        }
      }

      MeasureConstraints constraints =
          new MeasureConstraints(geometry.contentWidth(), geometry.contentHeight());
      List<MeasuredBlock> fresh = measurementService.measureAll(toMeasure, constraints);
      int next = 0;
      for (int i = 0; i < sources.size(); i++) {
        if (measured.get(i) == null) {
          int count = sources.get(i).blocks().size();
          measured.set(i, fresh.subList(next, next + count));
          next += count;
        }
      }

      List<MeasuredBlock> body = new ArrayList<>();
      for (int i = 0; i < sources.size(); i++) {
        List<MeasuredBlock> blocks = measured.get(i);
        if (cacheEnabled) {
          CacheLookup lookup = lookups.get(i);
          cache.set(sources.get(i).blockId(), lookup.nodeJson(), lookup.nodeRev(), blocks, i);
        }
        body.addAll(blocks);
      }

      ReserveLoopResult loop =
          footnoteReserveOrchestrator.paginate(body, geometry, request.footnotes());

      if (cacheEnabled) {
        cache.commit(token);
        token = null;
      }

      LayoutResult previous = session.getPreviousResult();
      int firstDirty =
          firstDirtyPageIndex(previous == null ? null : previous.layout(), loop.layout());
      LayoutResult result =
          new LayoutResult(
              loop.layout(),
              loop.reserves(),
              loop.passes(),
              loop.outcome(),
              loop.unresolvedFootnoteIds(),
              hits,
              sources.size() - hits,
              firstDirty);
      session.setPreviousResult(result);
      log.info(
          "Laid out {} source blocks onto {} pages ({} cached, {} measured, {} passes, {})",
          sources.size(),
          loop.layout().pageCount(),
          hits,
          sources.size() - hits,
          loop.passes(),
          loop.outcome());
      return result;
    } finally {
      if (token != null) {
        // Failed pass: close the generation so the session stays usable.
        cache.commit(token);
      }
    }
  }

  @Override
  public void resetSession(LayoutSession session) {
    session.reset();
    log.debug("Layout session reset");
  }

  /** Cached blocks moved to the node's current start position. */
  private static List<MeasuredBlock> reuse(List<MeasuredBlock> cached, Integer pmStart) {
    Integer cachedStart =
        BlockPositions.firstStart(cached.stream().map(MeasuredBlock::block).toList());
    if (pmStart == null || cachedStart == null || pmStart.equals(cachedStart)) {
      return cached;
    }
    return BlockPositions.shiftMeasuredBlocks(cached, pmStart - cachedStart);
  }

  /** First page index at which {@code current} differs from {@code previous}; -1 if none. */
  static int firstDirtyPageIndex(Layout previous, Layout current) {
    if (previous == null) {
      return 0;
    }
    int shared = Math.min(previous.pageCount(), current.pageCount());
    for (int i = 0; i < shared; i++) {
      if (!previous.page(i).equals(current.page(i))) {
        return i;
      }
    }
    return previous.pageCount() == current.pageCount() ? -1 : shared;
  }
}
