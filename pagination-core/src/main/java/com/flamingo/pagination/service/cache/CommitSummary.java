package com.flamingo.pagination.service.cache;

/**
 * Outcome of closing a cache generation.
 *
 * @param token the generation that was closed
 * @param retained entries touched during the generation
 * @param evicted entries dropped because nothing touched them
 */
public record CommitSummary(GenerationToken token, int retained, int evicted) {}
