package com.flamingo.pagination.service.pagination;

import com.flamingo.pagination.domain.block.PositionSpan;
import com.flamingo.pagination.domain.enums.FragmentKind;
import com.flamingo.pagination.domain.layout.Fragment;
import com.flamingo.pagination.domain.layout.Layout;
import com.flamingo.pagination.domain.layout.Page;
import com.flamingo.pagination.domain.measure.BoxMeasure;
import com.flamingo.pagination.domain.measure.MeasuredBlock;
import com.flamingo.pagination.domain.measure.ParagraphMeasure;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Places footnote bodies in the band reserved at the bottom of their page.
 *
 * <p>The band starts at {@link Page#footnoteBandTop()}: top padding, then a divider fragment with
 * id {@code footnote-separator-<page>}, then each footnote block stacked in the given order. Body
 * fragments are left untouched.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FootnoteBandPlacer {

  private static final double EPSILON = 1e-6;

  private final MeterRegistry meterRegistry;

  /**
   * Returns a copy of {@code layout} with footnote band fragments appended to each page.
   *
   * @param layout body layout
   * @param bodiesByPage page index to the measured footnote blocks it hosts, in reference order
   * @param topPadding space between the band top and the divider
   * @param dividerHeight divider height
   */
  public Layout placeFootnotes(
      Layout layout,
      Map<Integer, List<MeasuredBlock>> bodiesByPage,
      double topPadding,
      double dividerHeight) {
    if (bodiesByPage.isEmpty()) {
      return layout;
    }
    List<Page> pages = new ArrayList<>(layout.pageCount());
    for (Page page : layout.pages()) {
      List<MeasuredBlock> bodies = bodiesByPage.getOrDefault(page.index(), List.of());
      pages.add(
          bodies.isEmpty()
              ? page
              : page.withAppendedFragments(band(page, bodies, topPadding, dividerHeight)));
    }
    return new Layout(pages);
  }

  private List<Fragment> band(
      Page page, List<MeasuredBlock> bodies, double topPadding, double dividerHeight) {
    double x = page.margins().left();
    double width = page.size().width() - page.margins().left() - page.margins().right();
    double y = page.footnoteBandTop() + topPadding;

    List<Fragment> fragments = new ArrayList<>(bodies.size() + 1);
    fragments.add(
        new Fragment(
            Fragment.SEPARATOR_ID_PREFIX + page.index(),
            FragmentKind.SEPARATOR,
            x,
            y,
            width,
            dividerHeight,
            0,
            0,
            null,
            null,
            false,
            false));
    y += dividerHeight;

    for (MeasuredBlock body : bodies) {
      double height = body.measure().totalHeight();
      int lineCount =
          body.measure() instanceof ParagraphMeasure paragraph ? paragraph.lines().size() : 0;
      double placedWidth =
          body.measure() instanceof BoxMeasure box ? Math.min(box.width(), width) : width;
      PositionSpan span = body.block().positionSpan();
      fragments.add(
          new Fragment(
              body.block().id(),
              FragmentKind.forBlock(body.block().kind()),
              x,
              y,
              placedWidth,
              height,
              0,
              lineCount,
              span.pmStart(),
              span.pmEnd(),
              false,
              false));
      y += height;
    }

    double pageBottom = page.size().height() - page.margins().bottom();
    if (y > pageBottom + EPSILON) {
      meterRegistry.counter("pagination.footnotes.overflow").increment();
      log.warn(
          "Footnote band on page {} overflows the bottom margin by {} (reserved {})",
          page.index(),
          y - pageBottom,
          page.footnoteReserved());
    }
    return fragments;
  }
}
