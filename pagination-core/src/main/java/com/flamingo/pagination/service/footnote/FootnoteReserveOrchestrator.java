package com.flamingo.pagination.service.footnote;

import com.flamingo.pagination.config.PaginationConfig;
import com.flamingo.pagination.domain.block.FlowBlock;
import com.flamingo.pagination.domain.enums.ConvergenceOutcome;
import com.flamingo.pagination.domain.layout.Layout;
import com.flamingo.pagination.domain.layout.PageGeometry;
import com.flamingo.pagination.domain.layout.ReservationVector;
import com.flamingo.pagination.domain.measure.Measure;
import com.flamingo.pagination.domain.measure.MeasureConstraints;
import com.flamingo.pagination.domain.measure.MeasuredBlock;
import com.flamingo.pagination.service.measure.MeasurementService;
import com.flamingo.pagination.service.pagination.FootnoteBandPlacer;
import com.flamingo.pagination.service.pagination.PaginationEngine;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Paginates a document while reserving room for footnotes at the bottom of the pages their
 * references land on.
 *
 * <p>Reserving space moves body content, which can move a reference to another page, which changes
 * the reservations. The orchestrator therefore repeats pagination: each pass is laid out with the
 * reservation vector proposed by the previous pass, starting from all zeros.
 *
 * <ul>
 *   <li>If a pass proposes exactly the vector it was laid out with, that layout is final.
 *   <li>If a pass proposes a vector already used by an earlier pass, proposals are cycling. The
 *       cycle member with the lowest total reservation is chosen (earliest on ties) and widened
 *       element-wise with the reservation its own layout proposed. The widened vector is laid out
 *       and widened again until it covers what its layout proposes.
 *   <li>If the pass budget runs out, the last proposal is laid out one last time.
 * </ul>
 *
 * <p>Every path returns a layout; non-convergence is reported through {@link ConvergenceOutcome}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FootnoteReserveOrchestrator {

  private final PaginationEngine paginationEngine;
  private final FootnotePageResolver pageResolver;
  private final FootnoteBandPlacer bandPlacer;
  private final MeasurementService measurementService;
  private final PaginationConfig paginationConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Paginates {@code blocks}, converging footnote reservations.
   *
   * @param blocks measured body blocks in document order
   * @param geometry page geometry
   * @param linkage footnote references and bodies; {@link FootnoteLinkage#NONE} for none
   * @return final layout and the reservation vector it was produced with
   */
  public ReserveLoopResult paginate(
      List<MeasuredBlock> blocks, PageGeometry geometry, FootnoteLinkage linkage) {
    List<FlowBlock> flowBlocks = new ArrayList<>(blocks.size());
    List<Measure> measures = new ArrayList<>(blocks.size());
    for (MeasuredBlock measured : blocks) {
      flowBlocks.add(measured.block());
      measures.add(measured.measure());
    }

    Run run =
        new Run(
            flowBlocks, measures, geometry, linkage == null ? FootnoteLinkage.NONE : linkage);
    if (run.linkage.isEmpty()) {
      Layout layout = run.layout(ReservationVector.ZERO);
      return run.finish(layout, ReservationVector.ZERO, ConvergenceOutcome.NO_FOOTNOTES);
    }
    return run.converge(Math.max(1, paginationConfig.getFootnotes().getMaxReservePasses()));
  }

  /** State of one orchestrator run. Footnote bodies are measured at most once per run. */
  private final class Run {

    private final List<FlowBlock> blocks;
    private final List<Measure> measures;
    private final PageGeometry geometry;
    private final FootnoteLinkage linkage;
    private final MeasureConstraints constraints;
    private final Map<String, Measure> footnoteMeasures = new HashMap<>();
    private int passes;

    Run(
        List<FlowBlock> blocks,
        List<Measure> measures,
        PageGeometry geometry,
        FootnoteLinkage linkage) {
      this.blocks = blocks;
      this.measures = measures;
      this.geometry = geometry;
      this.linkage = linkage;
      this.constraints = new MeasureConstraints(geometry.contentWidth(), geometry.contentHeight());
    }

    ReserveLoopResult converge(int maxPasses) {
      ReservationVector current = ReservationVector.ZERO;
      List<ReservationVector> history = new ArrayList<>();
      Map<ReservationVector, ReservationVector> proposedBy = new HashMap<>();

      for (int pass = 1; pass <= maxPasses; pass++) {
        Layout layout = layout(current);
        ReservationVector proposed = propose(pageResolver.resolve(layout, linkage.refs()));
        log.debug("Footnote pass {}: laid out with {}, proposes {}", pass, current, proposed);

        if (proposed.equals(current)) {
          return finish(layout, current, ConvergenceOutcome.CONVERGED);
        }
        history.add(current);
        proposedBy.put(current, proposed);

        int seenAt = history.indexOf(proposed);
        if (seenAt >= 0) {
          ReservationVector chosen = lowestTotal(history.subList(seenAt, history.size()));
          log.info(
              "Footnote reserves oscillate after {} passes (cycle of {}); settling from {}",
              pass,
              history.size() - seenAt,
              chosen);
          return settle(chosen.max(proposedBy.get(chosen)), maxPasses);
        }
        current = proposed;
      }

      log.warn(
          "Footnote reserves did not converge within {} passes; using last proposal {}",
          maxPasses,
          current);
      return finish(layout(current), current, ConvergenceOutcome.BUDGET_EXHAUSTED);
    }

    /**
     * Widens {@code settled} with what its own layout proposes until every page holding a
     * reference reserves enough, laying out at most {@code maxRounds} times.
     */
    ReserveLoopResult settle(ReservationVector settled, int maxRounds) {
      for (int round = 1; ; round++) {
        Layout layout = layout(settled);
        ReservationVector needed = propose(pageResolver.resolve(layout, linkage.refs()));
        if (settled.covers(needed)) {
          return finish(layout, settled, ConvergenceOutcome.OSCILLATION);
        }
        if (round >= maxRounds) {
          log.warn(
              "Footnote reserves {} still short of {} after {} widening passes",
              settled,
              needed,
              round);
          return finish(layout, settled, ConvergenceOutcome.BUDGET_EXHAUSTED);
        }
        log.debug("Widening footnote reserves {} with {}", settled, needed);
        settled = settled.max(needed);
      }
    }

    Layout layout(ReservationVector reserves) {
      passes++;
      return paginationEngine.layoutDocument(blocks, measures, geometry, reserves);
    }

    ReserveLoopResult finish(
        Layout layout, ReservationVector reserves, ConvergenceOutcome outcome) {
      Set<String> unresolved = new LinkedHashSet<>();
      Map<Integer, List<MeasuredBlock>> bodiesByPage = new LinkedHashMap<>();
      if (!linkage.isEmpty()) {
        FootnoteAssignment assignment = pageResolver.resolve(layout, linkage.refs());
        unresolved.addAll(assignment.unresolvedIds());
        for (Map.Entry<Integer, List<String>> entry : assignment.footnoteIdsByPage().entrySet()) {
          List<MeasuredBlock> bodies = new ArrayList<>();
          for (String footnoteId : entry.getValue()) {
            List<MeasuredBlock> body = measuredBody(footnoteId);
            if (body.isEmpty()) {
              unresolved.add(footnoteId);
            }
            bodies.addAll(body);
          }
          if (!bodies.isEmpty()) {
            bodiesByPage.put(entry.getKey(), bodies);
          }
        }
      }

      PaginationConfig.Footnotes settings = paginationConfig.getFootnotes();
      Layout placed =
          bandPlacer.placeFootnotes(
              layout, bodiesByPage, settings.getTopPadding(), settings.getDividerHeight());

      if (!unresolved.isEmpty()) {
        meterRegistry.counter("pagination.footnotes.unresolved").increment(unresolved.size());
        log.warn("No footnote reservation for {}: reference or body not found", unresolved);
      }
      meterRegistry
          .counter("pagination.footnotes.outcome", "outcome", outcome.name().toLowerCase())
          .increment();
      log.debug(
          "Paginated {} blocks onto {} pages in {} passes ({}), reserves {}",
          blocks.size(),
          placed.pageCount(),
          passes,
          outcome,
          reserves);
      return new ReserveLoopResult(placed, reserves, passes, outcome, new ArrayList<>(unresolved));
    }

    /** Reservation each page needs for the footnotes a layout assigns to it. */
    private ReservationVector propose(FootnoteAssignment assignment) {
      Map<Integer, List<String>> byPage = assignment.footnoteIdsByPage();
      int lastPage = byPage.keySet().stream().mapToInt(Integer::intValue).max().orElse(-1);
      double[] reserves = new double[lastPage + 1];
      PaginationConfig.Footnotes settings = paginationConfig.getFootnotes();
      for (Map.Entry<Integer, List<String>> entry : byPage.entrySet()) {
        double height = 0;
        boolean any = false;
        for (String footnoteId : entry.getValue()) {
          for (MeasuredBlock body : measuredBody(footnoteId)) {
            height += body.measure().totalHeight();
            any = true;
          }
        }
        if (any) {
          reserves[entry.getKey()] =
              settings.getTopPadding() + settings.getDividerHeight() + height;
        }
      }
      return ReservationVector.of(reserves);
    }

    private List<MeasuredBlock> measuredBody(String footnoteId) {
      List<MeasuredBlock> body = new ArrayList<>();
      for (FlowBlock block : linkage.bodyOf(footnoteId)) {
        if (block.kind().isBreak()) {
          continue;
        }
        Measure measure =
            footnoteMeasures.computeIfAbsent(
                block.id(), id -> measurementService.measure(block, constraints));
        body.add(new MeasuredBlock(block, measure));
      }
      return body;
    }
  }

  private static ReservationVector lowestTotal(List<ReservationVector> cycle) {
    ReservationVector best = cycle.get(0);
    for (ReservationVector candidate : cycle) {
      if (candidate.total() < best.total()) {
        best = candidate;
      }
    }
    return best;
  }
}
