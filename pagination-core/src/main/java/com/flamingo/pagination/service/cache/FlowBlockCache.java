package com.flamingo.pagination.service.cache;

import com.flamingo.pagination.domain.enums.LookupStatus;
import com.flamingo.pagination.domain.measure.MeasuredBlock;
import com.flamingo.pagination.domain.source.SourceNode;
import com.flamingo.pagination.exception.CacheGenerationException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;

/**
 * Generation-scoped cache of measured blocks, keyed by block id.
 *
 * <p>Every layout pass is bracketed by {@link #begin()} and {@link #commit()}. Entries read or
 * written during the generation survive the commit; everything else is swept, which is how deleted
 * blocks leave the cache.
 *
 * <p>A lookup first trusts revision markers: when both the entry and the node carry one and they
 * match, the stored result is returned without looking at content. When the document may have
 * been changed by a channel that does not bump revisions (remote merges), the caller sets {@link
 * #setHasExternalChanges(boolean)} and lookups compare canonical serializations instead. Nodes
 * without a revision marker are always compared by serialization.
 *
 * <p>Not thread-safe. All calls must come from the thread that owns the layout pass.
 */
@Slf4j
public class FlowBlockCache {

  private final SourceNodeSerializer serializer;
  private final MeterRegistry meterRegistry;

  private final Map<String, CacheEntry> entries = new HashMap<>();
  private final Map<String, Long> lastTouched = new HashMap<>();

  private long generation;
  private GenerationToken openToken;
  private boolean hasExternalChanges;

  public FlowBlockCache(SourceNodeSerializer serializer, MeterRegistry meterRegistry) {
    this.serializer = serializer;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Opens a generation.
   *
   * @return the token identifying the new generation
   * @throws CacheGenerationException if a generation is already open
   */
  public GenerationToken begin() {
    if (openToken != null) {
      throw new CacheGenerationException(
          "Cannot begin generation "
              + (generation + 1)
              + ": generation "
              + openToken.generation()
              + " is still open");
    }
    generation++;
    openToken = new GenerationToken(generation);
    return openToken;
  }

  /**
   * Looks up the entry for {@code blockId} against the current state of its source node.
   *
   * @throws CacheGenerationException if no generation is open
   */
  public CacheLookup get(String blockId, SourceNode node) {
    requireOpen("get");
    Integer nodeRev = node == null ? null : node.revisionMarker();
    CacheEntry entry = entries.get(blockId);
    if (entry == null) {
      return record(new CacheLookup(null, serializer.serialize(node), nodeRev, LookupStatus.MISS));
    }
    lastTouched.put(blockId, generation);

    boolean revisionsKnown = entry.revisionMarker() != null && nodeRev != null;
    if (revisionsKnown && !hasExternalChanges) {
      if (entry.revisionMarker().equals(nodeRev)) {
        return record(
            new CacheLookup(entry, entry.serializedSource(), nodeRev, LookupStatus.HIT_TRUSTED));
      }
      return record(new CacheLookup(null, serializer.serialize(node), nodeRev, LookupStatus.MISS));
    }

    String nodeJson = serializer.serialize(node);
    if (nodeJson != null && nodeJson.equals(entry.serializedSource())) {
      return record(new CacheLookup(entry, nodeJson, nodeRev, LookupStatus.HIT_VERIFIED));
    }
    return record(new CacheLookup(null, nodeJson, nodeRev, LookupStatus.MISS));
  }

  /**
   * Stores (or replaces) the entry for {@code blockId} and marks it touched in this generation.
   *
   * @throws CacheGenerationException if no generation is open
   */
  public void set(
      String blockId,
      String serializedNode,
      Integer revisionMarker,
      List<MeasuredBlock> blocks,
      int orderIndex) {
    requireOpen("set");
    entries.put(
        blockId, new CacheEntry(blockId, serializedNode, revisionMarker, blocks, orderIndex));
    lastTouched.put(blockId, generation);
  }

  /** Switches lookups to serialization comparison until the next {@link #commit()}. */
  public void setHasExternalChanges(boolean hasExternalChanges) {
    this.hasExternalChanges = hasExternalChanges;
  }

  public boolean hasExternalChanges() {
    return hasExternalChanges;
  }

  /**
   * Closes the open generation, evicting untouched entries and clearing the external-changes flag.
   *
   * @throws CacheGenerationException if no generation is open
   */
  public CommitSummary commit() {
    requireOpen("commit");
    return close(openToken);
  }

  /**
   * Closes the generation identified by {@code token}.
   *
   * @throws CacheGenerationException if no generation is open or {@code token} is not the open one
   */
  public CommitSummary commit(GenerationToken token) {
    requireOpen("commit");
    if (token != openToken) {
      throw new CacheGenerationException(
          "Cannot commit " + token + ": the open generation is " + openToken.generation());
    }
    return close(token);
  }

  /** Drops every entry and resets the generation state. */
  public void clear() {
    entries.clear();
    lastTouched.clear();
    openToken = null;
    hasExternalChanges = false;
    log.debug("Flow block cache cleared");
  }

  public boolean isOpen() {
    return openToken != null;
  }

  public int size() {
    return entries.size();
  }

  public boolean contains(String blockId) {
    return entries.containsKey(blockId);
  }

  /**
   * Ids whose last-touched generation lags {@code currentGeneration}, i.e. the entries a commit of
   * {@code currentGeneration} evicts.
   */
  static List<String> sweep(Map<String, Long> lastTouched, long currentGeneration) {
    List<String> stale = new ArrayList<>();
    for (Map.Entry<String, Long> touched : lastTouched.entrySet()) {
      if (!Objects.equals(touched.getValue(), currentGeneration)) {
        stale.add(touched.getKey());
      }
    }
    return stale;
  }

  private CommitSummary close(GenerationToken token) {
    List<String> stale = sweep(lastTouched, token.generation());
    for (String blockId : stale) {
      entries.remove(blockId);
      lastTouched.remove(blockId);
    }
    openToken = null;
    hasExternalChanges = false;

    if (!stale.isEmpty()) {
      meterRegistry.counter("pagination.cache.evictions").increment(stale.size());
    }
    log.debug(
        "Committed cache generation {}: {} retained, {} evicted",
        token.generation(),
        entries.size(),
        stale.size());
    return new CommitSummary(token, entries.size(), stale.size());
  }

  private CacheLookup record(CacheLookup lookup) {
    String result =
        switch (lookup.status()) {
          case HIT_TRUSTED -> "trusted";
          case HIT_VERIFIED -> "verified";
          case MISS -> "miss";
        };
    meterRegistry.counter("pagination.cache.lookups", "result", result).increment();
    return lookup;
  }

  private void requireOpen(String operation) {
    if (openToken == null) {
      throw new CacheGenerationException(
          "Cannot " + operation + " outside an open cache generation; call begin() first");
    }
  }
}
