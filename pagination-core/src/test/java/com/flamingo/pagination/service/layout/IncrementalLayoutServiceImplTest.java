package com.flamingo.pagination.service.layout;

import static com.flamingo.pagination.LayoutFixtures.geometry;
import static com.flamingo.pagination.LayoutFixtures.oneLine;
import static com.flamingo.pagination.LayoutFixtures.paragraph;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.pagination.config.PaginationConfig;
import com.flamingo.pagination.domain.block.FlowBlock;
import com.flamingo.pagination.domain.block.ParagraphBlock;
import com.flamingo.pagination.domain.enums.ConvergenceOutcome;
import com.flamingo.pagination.domain.layout.Fragment;
import com.flamingo.pagination.domain.layout.Layout;
import com.flamingo.pagination.domain.layout.PageGeometry;
import com.flamingo.pagination.domain.measure.Measure;
import com.flamingo.pagination.domain.source.SourceNode;
import com.flamingo.pagination.exception.MeasurementException;
import com.flamingo.pagination.service.cache.SourceNodeSerializer;
import com.flamingo.pagination.service.footnote.FootnoteLinkage;
import com.flamingo.pagination.service.footnote.FootnotePageResolver;
import com.flamingo.pagination.service.footnote.FootnoteRef;
import com.flamingo.pagination.service.footnote.FootnoteReserveOrchestrator;
import com.flamingo.pagination.service.measure.MeasurementPort;
import com.flamingo.pagination.service.measure.MeasurementService;
import com.flamingo.pagination.service.pagination.FootnoteBandPlacer;
import com.flamingo.pagination.service.pagination.PaginationEngine;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("IncrementalLayoutService Tests")
class IncrementalLayoutServiceImplTest {

  private final PageGeometry geometry = geometry(240);

  private SimpleMeterRegistry meterRegistry;
  private PaginationConfig paginationConfig;
  private AtomicInteger portCalls;
  private Set<String> failingIds;
  private IncrementalLayoutServiceImpl layoutService;
  private LayoutSession session;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    paginationConfig = new PaginationConfig();
    portCalls = new AtomicInteger();
    failingIds = new HashSet<>();

    MeasurementPort port =
        (block, constraints) -> {
          portCalls.incrementAndGet();
          if (failingIds.contains(block.id())) {
            return CompletableFuture.failedFuture(new IllegalStateException("no font"));
          }
          int length = block instanceof ParagraphBlock p ? p.text().length() : 1;
          return CompletableFuture.<Measure>completedFuture(oneLine(20, length));
        };
    MeasurementService measurementService =
        new MeasurementService(port, Runnable::run, meterRegistry);
    PaginationEngine engine = new PaginationEngine(meterRegistry);
    FootnoteReserveOrchestrator orchestrator =
        new FootnoteReserveOrchestrator(
            engine,
            new FootnotePageResolver(),
            new FootnoteBandPlacer(meterRegistry),
            measurementService,
            paginationConfig,
            meterRegistry);

    layoutService =
        new IncrementalLayoutServiceImpl(
            measurementService,
            orchestrator,
            new SourceNodeSerializer(),
            paginationConfig,
            meterRegistry);
    session = layoutService.createSession();
  }

  /** Builds one source block per text, positions advancing by text length plus one. */
  private static List<SourceBlock> document(List<String> texts, List<Integer> revisions) {
    List<SourceBlock> sources = new ArrayList<>();
    int pos = 0;
    for (int i = 0; i < texts.size(); i++) {
      String id = "p" + (i + 1);
      String text = texts.get(i);
      SourceNode node =
          SourceNode.element(
              "paragraph",
              Map.of(SourceNode.REVISION_ATTR, revisions.get(i)),
              List.of(SourceNode.text(text)));
      sources.add(new SourceBlock(id, node, pos, List.<FlowBlock>of(paragraph(id, text, pos))));
      pos += text.length() + 1;
    }
    return sources;
  }

  private static Fragment fragmentOf(Layout layout, String blockId) {
    return layout.pages().stream()
        .flatMap(page -> page.fragments().stream())
        .filter(fragment -> fragment.blockId().equals(blockId))
        .findFirst()
        .orElseThrow();
  }

  @Test
  @DisplayName("should measure everything on the first pass")
  void shouldMissEverything_onFirstPass() {
    LayoutResult result =
        layoutService.layout(
            session, LayoutRequest.of(document(List.of("one", "two"), List.of(1, 1)), geometry));

    assertThat(result.cacheHits()).isZero();
    assertThat(result.cacheMisses()).isEqualTo(2);
    assertThat(result.firstDirtyPageIndex()).isZero();
    assertThat(result.outcome()).isEqualTo(ConvergenceOutcome.NO_FOOTNOTES);
    assertThat(portCalls).hasValue(2);
    assertThat(session.getCache().isOpen()).isFalse();
  }

  @Test
  @DisplayName("should reuse every block when nothing changed")
  void shouldHitEverything_whenUnchanged() {
    List<SourceBlock> doc = document(List.of("one", "two", "three"), List.of(1, 1, 1));
    layoutService.layout(session, LayoutRequest.of(doc, geometry));

    LayoutResult second = layoutService.layout(session, LayoutRequest.of(doc, geometry));

    assertThat(second.cacheHits()).isEqualTo(3);
    assertThat(second.cacheMisses()).isZero();
    assertThat(second.firstDirtyPageIndex()).isEqualTo(-1);
    assertThat(portCalls).hasValue(3);
  }

  @Test
  @DisplayName("should remeasure only the edited node and shift the cached ones after it")
  void shouldShiftCachedBlocks_afterEdit() {
    layoutService.layout(
        session, LayoutRequest.of(document(List.of("one", "two"), List.of(1, 1)), geometry));

    LayoutResult edited =
        layoutService.layout(
            session,
            LayoutRequest.of(document(List.of("one more", "two"), List.of(2, 1)), geometry));

    assertThat(edited.cacheHits()).isEqualTo(1);
    assertThat(edited.cacheMisses()).isEqualTo(1);
    assertThat(portCalls).hasValue(3);
    Fragment shifted = fragmentOf(edited.layout(), "p2");
    assertThat(shifted.pmStart()).isEqualTo(9);
    assertThat(shifted.pmEnd()).isEqualTo(12);
    assertThat(edited.firstDirtyPageIndex()).isZero();
  }

  @Test
  @DisplayName("should evict nodes that left the document")
  void shouldEvictDeletedNodes() {
    layoutService.layout(
        session, LayoutRequest.of(document(List.of("one", "two"), List.of(1, 1)), geometry));

    layoutService.layout(
        session, LayoutRequest.of(document(List.of("one"), List.of(1)), geometry));

    assertThat(session.getCache().contains("p1")).isTrue();
    assertThat(session.getCache().contains("p2")).isFalse();
  }

  @Test
  @DisplayName("should verify content when the request reports external changes")
  void shouldVerifyContent_whenExternalChanges() {
    layoutService.layout(
        session, LayoutRequest.of(document(List.of("one", "two"), List.of(1, 1)), geometry));

    List<SourceBlock> merged = document(List.of("one", "TWO"), List.of(1, 1));
    LayoutResult result =
        layoutService.layout(
            session, new LayoutRequest(merged, geometry, FootnoteLinkage.NONE, true));

    assertThat(result.cacheHits()).isEqualTo(1);
    assertThat(result.cacheMisses()).isEqualTo(1);
    assertThat(session.getCache().hasExternalChanges()).isFalse();
  }

  @Test
  @DisplayName("should bypass the cache when disabled")
  void shouldBypassCache_whenDisabled() {
    paginationConfig.getCache().setEnabled(false);
    List<SourceBlock> doc = document(List.of("one", "two"), List.of(1, 1));

    layoutService.layout(session, LayoutRequest.of(doc, geometry));
    LayoutResult second = layoutService.layout(session, LayoutRequest.of(doc, geometry));

    assertThat(second.cacheHits()).isZero();
    assertThat(portCalls).hasValue(4);
    assertThat(session.getCache().size()).isZero();
  }

  @Test
  @DisplayName("should discard cached measures when the page geometry changes")
  void shouldRemeasure_whenGeometryChanges() {
    List<SourceBlock> doc = document(List.of("one", "two"), List.of(1, 1));
    layoutService.layout(session, LayoutRequest.of(doc, geometry));

    LayoutResult result = layoutService.layout(session, LayoutRequest.of(doc, geometry(300)));

    assertThat(result.cacheHits()).isZero();
    assertThat(portCalls).hasValue(4);
  }

  @Test
  @DisplayName("should close the cache generation when measuring fails")
  void shouldCloseGeneration_whenMeasurementFails() {
    failingIds.add("p2");
    List<SourceBlock> doc = document(List.of("one", "two"), List.of(1, 1));

    assertThatThrownBy(() -> layoutService.layout(session, LayoutRequest.of(doc, geometry)))
        .isInstanceOf(MeasurementException.class);
    assertThat(session.getCache().isOpen()).isFalse();

    failingIds.clear();
    LayoutResult retry = layoutService.layout(session, LayoutRequest.of(doc, geometry));
    assertThat(retry.layout().pageCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("should reserve footnotes through the orchestrator")
  void shouldReserveFootnotes() {
    List<SourceBlock> doc = document(List.of("one", "two"), List.of(1, 1));
    FootnoteLinkage footnotes =
        new FootnoteLinkage(
            List.of(new FootnoteRef("1", 5)),
            Map.of("1", List.<FlowBlock>of(paragraph("footnote-1-0", "Note.", 0))));

    LayoutResult result =
        layoutService.layout(session, new LayoutRequest(doc, geometry, footnotes, false));

    assertThat(result.outcome()).isEqualTo(ConvergenceOutcome.CONVERGED);
    assertThat(result.layout().pageOf("footnote-1-0")).isPresent();
    assertThat(result.reserves().get(0)).isEqualTo(4 + 2 + 20);
  }

  @Test
  @DisplayName("should forget everything on reset")
  void shouldForgetEverything_onReset() {
    List<SourceBlock> doc = document(List.of("one"), List.of(1));
    layoutService.layout(session, LayoutRequest.of(doc, geometry));

    layoutService.resetSession(session);
    LayoutResult result = layoutService.layout(session, LayoutRequest.of(doc, geometry));

    assertThat(result.cacheHits()).isZero();
    assertThat(result.firstDirtyPageIndex()).isZero();
  }
}
