package com.flamingo.pagination.domain.layout;

/** Page dimensions in the measurement port's unit. */
public record PageSize(double width, double height) {}
