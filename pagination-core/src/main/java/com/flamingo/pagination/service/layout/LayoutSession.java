package com.flamingo.pagination.service.layout;

import com.flamingo.pagination.domain.layout.PageGeometry;
import com.flamingo.pagination.service.cache.FlowBlockCache;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

/**
 * Layout state of one open document: its block cache, the geometry the cached measures were taken
 * with and the last result.
 *
 * <p>Sessions are not thread-safe. Use one per document and run its passes sequentially.
 */
@Getter
public class LayoutSession {

  private final FlowBlockCache cache;

  @Setter(AccessLevel.PACKAGE)
  private PageGeometry measuredGeometry;

  @Setter(AccessLevel.PACKAGE)
  private LayoutResult previousResult;

  LayoutSession(FlowBlockCache cache) {
    this.cache = cache;
  }

  void reset() {
    cache.clear();
    measuredGeometry = null;
    previousResult = null;
  }
}
