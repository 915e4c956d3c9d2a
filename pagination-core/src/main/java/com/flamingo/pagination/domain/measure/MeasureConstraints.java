package com.flamingo.pagination.domain.measure;

/**
 * Space available to a block while it is measured.
 *
 * @param maxWidth content width of the page
 * @param maxHeight content height of the page, used by measurers to cap atomic boxes
 */
public record MeasureConstraints(double maxWidth, double maxHeight) {}
