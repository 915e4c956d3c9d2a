package com.flamingo.pagination.service.pagination;

import com.flamingo.pagination.domain.block.BreakBlock;
import com.flamingo.pagination.domain.block.FlowBlock;
import com.flamingo.pagination.domain.block.ParagraphBlock;
import com.flamingo.pagination.domain.block.PositionSpan;
import com.flamingo.pagination.domain.block.TextRun;
import com.flamingo.pagination.domain.enums.FragmentKind;
import com.flamingo.pagination.domain.layout.Fragment;
import com.flamingo.pagination.domain.layout.Layout;
import com.flamingo.pagination.domain.layout.Page;
import com.flamingo.pagination.domain.layout.PageGeometry;
import com.flamingo.pagination.domain.layout.ReservationVector;
import com.flamingo.pagination.domain.measure.BoxMeasure;
import com.flamingo.pagination.domain.measure.LineMeasure;
import com.flamingo.pagination.domain.measure.Measure;
import com.flamingo.pagination.domain.measure.MeasuredBlock;
import com.flamingo.pagination.domain.measure.ParagraphMeasure;
import com.flamingo.pagination.exception.MeasurementException;
import com.flamingo.pagination.exception.PageGeometryTooSmallException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Flows measured blocks onto pages.
 *
 * <p>Blocks are placed top to bottom in each page's body band, which spans from the top margin to
 * {@code pageHeight - bottomMargin - footnoteReserved[page]}. Paragraphs split between lines when
 * the next line does not fit; images and drawings move whole to the next page. Page, column and
 * section breaks always start a new page.
 *
 * <p>A single call is synchronous and side-effect free apart from metrics. Heights are used exactly
 * as measured; nothing is rounded.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PaginationEngine {

  /** Slack for floating-point sums of line heights. */
  private static final double EPSILON = 1e-6;

  private final MeterRegistry meterRegistry;

  /**
   * Lays out a document.
   *
   * @param blocks blocks in document order
   * @param measures one measure per block, aligned by index; {@code null} for breaks
   * @param geometry geometry of the first page
   * @param footnoteReservedByPageIndex height withheld for footnotes on each page
   * @return the paginated layout, with at least one page
   * @throws PageGeometryTooSmallException if a line or atomic block is taller than a page's
   *     content area
   * @throws MeasurementException if a measure has a negative or non-finite height
   * @throws IllegalArgumentException if blocks and measures are misaligned
   */
  public Layout layoutDocument(
      List<FlowBlock> blocks,
      List<Measure> measures,
      PageGeometry geometry,
      ReservationVector footnoteReservedByPageIndex) {
    if (blocks.size() != measures.size()) {
      throw new IllegalArgumentException(
          "Got " + blocks.size() + " blocks but " + measures.size() + " measures");
    }
    ReservationVector reserves =
        footnoteReservedByPageIndex == null ? ReservationVector.ZERO : footnoteReservedByPageIndex;
    requireUsable(geometry, blocks.isEmpty() ? "<document>" : blocks.get(0).id());

    PageFlow flow = new PageFlow(geometry, reserves);
    for (int i = 0; i < blocks.size(); i++) {
      FlowBlock block = blocks.get(i);
      Measure measure = measures.get(i);
      switch (block.kind()) {
        case PAGE_BREAK, COLUMN_BREAK, SECTION_BREAK -> flow.breakPage((BreakBlock) block);
        case PARAGRAPH ->
            flow.placeParagraph((ParagraphBlock) block, requireMeasure(block, measure));
        case IMAGE, DRAWING -> flow.placeBox(block, requireMeasure(block, measure));
      }
    }

    Layout layout = flow.finish();
    meterRegistry.counter("pagination.layout.passes").increment();
    meterRegistry.summary("pagination.layout.pages").record(layout.pageCount());
    log.debug(
        "Laid out {} blocks onto {} pages with reserves {}",
        blocks.size(),
        layout.pageCount(),
        reserves);
    return layout;
  }

  /** Convenience overload for pre-paired blocks and measures. */
  public Layout layoutDocument(
      List<MeasuredBlock> measuredBlocks,
      PageGeometry geometry,
      ReservationVector footnoteReservedByPageIndex) {
    List<FlowBlock> blocks = new ArrayList<>(measuredBlocks.size());
    List<Measure> measures = new ArrayList<>(measuredBlocks.size());
    for (MeasuredBlock measured : measuredBlocks) {
      blocks.add(measured.block());
      measures.add(measured.measure());
    }
    return layoutDocument(blocks, measures, geometry, footnoteReservedByPageIndex);
  }

  private static Measure requireMeasure(FlowBlock block, Measure measure) {
    if (measure == null) {
      throw new IllegalArgumentException("Block " + block.id() + " has no measure");
    }
    if (!measure.hasUsableHeights()) {
      throw new MeasurementException(
          block.id(), "Block " + block.id() + " has a negative or non-finite height: " + measure);
    }
    return measure;
  }

  private static void requireUsable(PageGeometry geometry, String blockId) {
    if (geometry == null) {
      throw new IllegalArgumentException("Page geometry is required");
    }
    if (geometry.contentHeight() <= 0) {
      throw new PageGeometryTooSmallException(blockId, EPSILON, geometry.contentHeight());
    }
  }

  /** Mutable state of one layout call: finished pages plus the page being filled. */
  private static final class PageFlow {

    private final ReservationVector reserves;
    private final List<Page> pages = new ArrayList<>();
    private final List<Fragment> current = new ArrayList<>();
    private PageGeometry geometry;
    private PageGeometry nextGeometry;
    private double cursor;

    PageFlow(PageGeometry geometry, ReservationVector reserves) {
      this.geometry = geometry;
      this.nextGeometry = geometry;
      this.reserves = reserves;
    }

    int pageIndex() {
      return pages.size();
    }

    /** Reserved height of the current page, clamped to its content height. */
    double reserved() {
      return Math.min(reserves.get(pageIndex()), geometry.contentHeight());
    }

    double bandHeight() {
      return geometry.contentHeight() - reserved();
    }

    double remaining() {
      return bandHeight() - cursor;
    }

    void newPage() {
      pages.add(
          new Page(pageIndex(), geometry.size(), geometry.margins(), reserved(), current));
      current.clear();
      cursor = 0;
      geometry = nextGeometry;
    }

    void breakPage(BreakBlock block) {
      if (block.geometry() != null) {
        requireUsable(block.geometry(), block.id());
        nextGeometry = block.geometry();
      }
      newPage();
    }

    void placeParagraph(ParagraphBlock block, Measure measure) {
      if (!(measure instanceof ParagraphMeasure paragraphMeasure)) {
        throw new IllegalArgumentException(
            "Paragraph " + block.id() + " needs a paragraph measure, got " + measure);
      }
      List<LineMeasure> lines = paragraphMeasure.lines();
      if (lines.isEmpty()) {
        PositionSpan span = block.positionSpan();
        current.add(
            new Fragment(
                block.id(),
                FragmentKind.PARAGRAPH,
                geometry.margins().left(),
                geometry.margins().top() + cursor,
                geometry.contentWidth(),
                0,
                0,
                0,
                span.pmStart(),
                span.pmEnd(),
                false,
                false));
        return;
      }

      int next = 0;
      while (next < lines.size()) {
        int start = next;
        double height = 0;
        double available = remaining();
        while (next < lines.size()
            && height + lines.get(next).lineHeight() <= available + EPSILON) {
          height += lines.get(next).lineHeight();
          next++;
        }
        if (next == start) {
          double lineHeight = lines.get(start).lineHeight();
          if (lineHeight > geometry.contentHeight() + EPSILON) {
            throw new PageGeometryTooSmallException(
                block.id(), lineHeight, geometry.contentHeight());
          }
          newPage();
          continue;
        }
        current.add(lineFragment(block, lines, start, next, height));
        cursor += height;
        if (next < lines.size()) {
          newPage();
        }
      }
    }

    void placeBox(FlowBlock block, Measure measure) {
      double height = measure.totalHeight();
      if (height > geometry.contentHeight() + EPSILON) {
        throw new PageGeometryTooSmallException(block.id(), height, geometry.contentHeight());
      }
      while (height > remaining() + EPSILON) {
        newPage();
      }
      double width = geometry.contentWidth();
      if (measure instanceof BoxMeasure box) {
        width = Math.min(box.width(), width);
      }
      PositionSpan span = block.positionSpan();
      current.add(
          new Fragment(
              block.id(),
              FragmentKind.forBlock(block.kind()),
              geometry.margins().left(),
              geometry.margins().top() + cursor,
              width,
              height,
              0,
              0,
              span.pmStart(),
              span.pmEnd(),
              false,
              false));
      cursor += height;
    }

    Layout finish() {
      newPage();
      return new Layout(pages);
    }

    private Fragment lineFragment(
        ParagraphBlock block, List<LineMeasure> lines, int from, int to, double height) {
      LineMeasure first = lines.get(from);
      LineMeasure last = lines.get(to - 1);
      PositionSpan blockSpan = block.positionSpan();
      Integer pmStart = positionAt(block.runs(), first.fromRun(), first.fromChar());
      Integer pmEnd = positionAt(block.runs(), last.toRun(), last.toChar());
      return new Fragment(
          block.id(),
          FragmentKind.PARAGRAPH,
          geometry.margins().left(),
          geometry.margins().top() + cursor,
          geometry.contentWidth(),
          height,
          from,
          to,
          pmStart != null ? pmStart : blockSpan.pmStart(),
          pmEnd != null ? pmEnd : blockSpan.pmEnd(),
          from > 0,
          to < lines.size());
    }

    private static Integer positionAt(List<TextRun> runs, int runIndex, int charOffset) {
      if (runs.isEmpty()) {
        return null;
      }
      if (runIndex >= runs.size()) {
        return runs.get(runs.size() - 1).pmEnd();
      }
      return runs.get(runIndex).positionAt(charOffset);
    }
  }
}
