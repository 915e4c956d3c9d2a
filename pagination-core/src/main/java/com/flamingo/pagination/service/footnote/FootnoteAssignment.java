package com.flamingo.pagination.service.footnote;

import java.util.List;
import java.util.Map;

/**
 * Which footnotes a layout puts on which page.
 *
 * @param footnoteIdsByPage page index to footnote ids, in reference order
 * @param unresolvedIds footnotes whose reference position is on no page
 */
public record FootnoteAssignment(
    Map<Integer, List<String>> footnoteIdsByPage, List<String> unresolvedIds) {}
