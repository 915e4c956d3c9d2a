package com.flamingo.pagination.domain.measure;

/**
 * One laid-out line of a paragraph.
 *
 * <p>{@code fromRun/fromChar} and {@code toRun/toChar} locate the line's first and past-the-end
 * characters within the paragraph's runs.
 */
public record LineMeasure(
    int fromRun,
    int fromChar,
    int toRun,
    int toChar,
    double width,
    double ascent,
    double descent,
    double lineHeight) {}
