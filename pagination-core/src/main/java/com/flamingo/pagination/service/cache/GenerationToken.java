package com.flamingo.pagination.service.cache;

/**
 * Handle for one open {@link FlowBlockCache} generation. Commits compare tokens by identity.
 *
 * @param generation the generation number this token opened
 */
public record GenerationToken(long generation) {}
