package com.flamingo.pagination.service.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.pagination.domain.block.ParagraphBlock;
import com.flamingo.pagination.domain.block.TextRun;
import com.flamingo.pagination.domain.enums.LookupStatus;
import com.flamingo.pagination.domain.measure.MeasuredBlock;
import com.flamingo.pagination.domain.source.SourceNode;
import com.flamingo.pagination.exception.CacheGenerationException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("FlowBlockCache Tests")
class FlowBlockCacheTest {

  private static final List<MeasuredBlock> BLOCKS =
      List.of(
          new MeasuredBlock(
              new ParagraphBlock("p1", List.of(new TextRun("hello", "Arial", 12, 0, 5))), null));

  private SourceNodeSerializer serializer;
  private SimpleMeterRegistry meterRegistry;
  private FlowBlockCache cache;

  @BeforeEach
  void setUp() {
    serializer = new SourceNodeSerializer();
    meterRegistry = new SimpleMeterRegistry();
    cache = new FlowBlockCache(serializer, meterRegistry);
  }

  private static SourceNode paragraphNode(String blockId, String text, Integer rev) {
    Map<String, Object> attrs = new HashMap<>();
    attrs.put("sdBlockId", blockId);
    attrs.put("paraId", null);
    if (rev != null) {
      attrs.put(SourceNode.REVISION_ATTR, rev);
    }
    return SourceNode.element(
        "paragraph",
        attrs,
        List.of(SourceNode.element("run", Map.of(), List.of(SourceNode.text(text)))));
  }

  private void populate(String blockId, SourceNode node) {
    cache.begin();
    cache.set(blockId, serializer.serialize(node), node.revisionMarker(), BLOCKS, 0);
    cache.commit();
  }

  @Nested
  @DisplayName("lookups")
  class Lookups {

    @Test
    @DisplayName("should miss when no entry exists")
    void shouldMiss_whenNoEntry() {
      cache.begin();

      CacheLookup result = cache.get("p1", paragraphNode("p1", "hello", 1));

      assertThat(result.entry()).isNull();
      assertThat(result.status()).isEqualTo(LookupStatus.MISS);
      assertThat(result.nodeJson()).isNotNull();
      assertThat(result.nodeRev()).isEqualTo(1);
    }

    @Test
    @DisplayName("should trust matching revision markers")
    void shouldHit_whenRevisionMatches() {
      SourceNode node = paragraphNode("p1", "hello", 1);
      populate("p1", node);

      cache.begin();
      CacheLookup result = cache.get("p1", node);

      assertThat(result.status()).isEqualTo(LookupStatus.HIT_TRUSTED);
      assertThat(result.entry().blocks()).isEqualTo(BLOCKS);
    }

    @Test
    @DisplayName("should miss when revision markers differ")
    void shouldMiss_whenRevisionDiffers() {
      populate("p1", paragraphNode("p1", "hello", 1));

      cache.begin();
      CacheLookup result = cache.get("p1", paragraphNode("p1", "hello world", 2));

      assertThat(result.entry()).isNull();
      assertThat(result.status()).isEqualTo(LookupStatus.MISS);
    }

    @Test
    @DisplayName("should trust the revision marker when no external changes are flagged")
    void shouldTrustRevision_whenNoExternalChanges() {
      populate("p1", paragraphNode("p1", "hello", 1));

      cache.begin();
      CacheLookup result = cache.get("p1", paragraphNode("p1", "changed remotely", 1));

      assertThat(result.status()).isEqualTo(LookupStatus.HIT_TRUSTED);
    }

    @Test
    @DisplayName("should miss on changed content under external changes despite same revision")
    void shouldMiss_whenExternalChangeAltersContent() {
      populate("p1", paragraphNode("p1", "hello", 1));

      cache.setHasExternalChanges(true);
      cache.begin();
      CacheLookup result = cache.get("p1", paragraphNode("p1", "changed remotely", 1));

      assertThat(result.entry()).isNull();
      assertThat(result.status()).isEqualTo(LookupStatus.MISS);
    }

    @Test
    @DisplayName("should verify unchanged content when external changes are flagged")
    void shouldVerify_whenExternalChangeKeepsContent() {
      SourceNode node = paragraphNode("p1", "hello", 1);
      populate("p1", node);

      cache.setHasExternalChanges(true);
      cache.begin();
      CacheLookup result = cache.get("p1", node);

      assertThat(result.status()).isEqualTo(LookupStatus.HIT_VERIFIED);
    }

    @Test
    @DisplayName("should compare serializations when the node has no revision marker")
    void shouldFallBackToSerialization_whenNoRevision() {
      populate("p1", paragraphNode("p1", "hello", null));

      cache.begin();
      CacheLookup unchanged = cache.get("p1", paragraphNode("p1", "hello", null));
      CacheLookup changed = cache.get("p1", paragraphNode("p1", "hello world", null));

      assertThat(unchanged.status()).isEqualTo(LookupStatus.HIT_VERIFIED);
      assertThat(changed.status()).isEqualTo(LookupStatus.MISS);
    }

    @Test
    @DisplayName("should keep the stored serialization across trusted hits")
    void shouldRetainSerialization_acrossTrustedHits() {
      SourceNode node = paragraphNode("p1", "hello", 5);
      populate("p1", node);

      cache.begin();
      CacheLookup trusted = cache.get("p1", node);
      assertThat(trusted.status()).isEqualTo(LookupStatus.HIT_TRUSTED);
      cache.set("p1", trusted.nodeJson(), trusted.nodeRev(), trusted.entry().blocks(), 0);
      cache.commit();

      cache.setHasExternalChanges(true);
      cache.begin();
      CacheLookup verified = cache.get("p1", node);

      assertThat(verified.status()).isEqualTo(LookupStatus.HIT_VERIFIED);
    }

    @Test
    @DisplayName("should count lookups by result")
    void shouldCountLookups() {
      SourceNode node = paragraphNode("p1", "hello", 1);
      populate("p1", node);

      cache.begin();
      cache.get("p1", node);
      cache.get("p2", paragraphNode("p2", "other", 1));

      assertThat(meterRegistry.counter("pagination.cache.lookups", "result", "trusted").count())
          .isEqualTo(1.0);
      assertThat(meterRegistry.counter("pagination.cache.lookups", "result", "miss").count())
          .isEqualTo(1.0);
    }
  }

  @Nested
  @DisplayName("generations")
  class Generations {

    @Test
    @DisplayName("should clear the external-changes flag on commit")
    void shouldClearExternalChanges_onCommit() {
      populate("p1", paragraphNode("p1", "hello", 1));

      cache.setHasExternalChanges(true);
      cache.begin();
      cache.get("p1", paragraphNode("p1", "hello", 1));
      cache.commit();

      assertThat(cache.hasExternalChanges()).isFalse();
      cache.begin();
      CacheLookup result = cache.get("p1", paragraphNode("p1", "changed", 1));
      assertThat(result.status()).isEqualTo(LookupStatus.HIT_TRUSTED);
    }

    @Test
    @DisplayName("should evict entries not touched during the generation")
    void shouldEvictUntouchedEntries() {
      cache.begin();
      cache.set("p1", "{}", 1, BLOCKS, 0);
      cache.set("p2", "{}", 1, BLOCKS, 1);
      cache.commit();

      cache.begin();
      cache.get("p1", paragraphNode("p1", "hello", 1));
      CommitSummary summary = cache.commit();

      assertThat(summary.retained()).isEqualTo(1);
      assertThat(summary.evicted()).isEqualTo(1);
      assertThat(cache.contains("p1")).isTrue();
      assertThat(cache.contains("p2")).isFalse();
      assertThat(meterRegistry.counter("pagination.cache.evictions").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("should keep an entry touched by a missed lookup")
    void shouldRetain_whenLookupMissed() {
      populate("p1", paragraphNode("p1", "hello", 1));

      cache.begin();
      cache.get("p1", paragraphNode("p1", "hello", 2));
      cache.commit();

      assertThat(cache.contains("p1")).isTrue();
    }

    @Test
    @DisplayName("should drop everything on clear")
    void shouldResetOnClear() {
      SourceNode node = paragraphNode("p1", "hello", 1);
      populate("p1", node);

      cache.clear();
      cache.begin();
      CacheLookup result = cache.get("p1", node);

      assertThat(result.entry()).isNull();
      assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("should reject lookups and stores outside a generation")
    void shouldReject_whenNotOpen() {
      SourceNode node = paragraphNode("p1", "hello", 1);

      assertThatThrownBy(() -> cache.get("p1", node))
          .isInstanceOf(CacheGenerationException.class);
      assertThatThrownBy(() -> cache.set("p1", "{}", 1, BLOCKS, 0))
          .isInstanceOf(CacheGenerationException.class);
      assertThatThrownBy(() -> cache.commit()).isInstanceOf(CacheGenerationException.class);
    }

    @Test
    @DisplayName("should reject a nested begin")
    void shouldReject_whenBeginNested() {
      cache.begin();

      assertThatThrownBy(() -> cache.begin())
          .isInstanceOf(CacheGenerationException.class)
          .hasMessageContaining("still open");
    }

    @Test
    @DisplayName("should reject a commit with a stale token")
    void shouldReject_whenTokenStale() {
      GenerationToken first = cache.begin();
      cache.commit(first);
      cache.begin();

      assertThatThrownBy(() -> cache.commit(first))
          .isInstanceOf(CacheGenerationException.class);
      assertThat(cache.isOpen()).isTrue();
    }

    @Test
    @DisplayName("should sweep ids whose last touch lags the generation")
    void shouldSweepStaleIds() {
      Map<String, Long> touched = Map.of("a", 3L, "b", 2L, "c", 3L);

      assertThat(FlowBlockCache.sweep(touched, 3L)).containsExactly("b");
      assertThat(FlowBlockCache.sweep(touched, 4L)).containsExactlyInAnyOrder("a", "b", "c");
    }
  }
}
