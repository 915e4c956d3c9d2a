package com.flamingo.pagination.service.footnote;

/**
 * A footnote reference mark in the body text.
 *
 * @param id footnote id, the key into {@link FootnoteLinkage#blocksById()}
 * @param pos source position of the mark, in the same space as block {@code pmStart/pmEnd}
 */
public record FootnoteRef(String id, int pos) {}
