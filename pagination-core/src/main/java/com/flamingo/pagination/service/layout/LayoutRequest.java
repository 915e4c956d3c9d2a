package com.flamingo.pagination.service.layout;

import com.flamingo.pagination.domain.layout.PageGeometry;
import com.flamingo.pagination.service.footnote.FootnoteLinkage;
import java.util.List;

/**
 * Input of one incremental layout pass.
 *
 * @param sources top-level source nodes in document order
 * @param geometry geometry of the first page
 * @param footnotes footnote references and bodies
 * @param externalChanges true when the document may have changed without revision markers being
 *     bumped (remote merges); cache hits are then verified by content
 */
public record LayoutRequest(
    List<SourceBlock> sources,
    PageGeometry geometry,
    FootnoteLinkage footnotes,
    boolean externalChanges) {

  public LayoutRequest {
    sources = sources == null ? List.of() : List.copyOf(sources);
    footnotes = footnotes == null ? FootnoteLinkage.NONE : footnotes;
  }

  public static LayoutRequest of(List<SourceBlock> sources, PageGeometry geometry) {
    return new LayoutRequest(sources, geometry, FootnoteLinkage.NONE, false);
  }
}
