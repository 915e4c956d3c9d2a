package com.flamingo.pagination.service.layout;

/** Entry point for laying out a document repeatedly as it is edited. */
public interface IncrementalLayoutService {

  /**
   * Creates a session with an empty cache.
   *
   * @return a new session
   */
  LayoutSession createSession();

  /**
   * Lays out the document, reusing cached measures for unchanged source nodes.
   *
   * @param session the document's session
   * @param request the current document
   * @return the layout and cache statistics
   * @throws com.flamingo.pagination.exception.MeasurementException if a block cannot be measured
   * @throws com.flamingo.pagination.exception.PageGeometryTooSmallException if content cannot fit
   *     on a page
   */
  LayoutResult layout(LayoutSession session, LayoutRequest request);

  /**
   * Drops everything the session cached, for when the document is replaced by an unrelated one.
   *
   * @param session the session to reset
   */
  void resetSession(LayoutSession session);
}
