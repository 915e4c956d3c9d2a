package com.flamingo.pagination.service.cache;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.flamingo.pagination.domain.source.SourceNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Canonical JSON form of a {@link SourceNode}: properties and map keys sorted, nulls omitted, so
 * equal content always serializes to equal strings.
 */
@Component
@Slf4j
public class SourceNodeSerializer {

  private static final ObjectMapper MAPPER =
      JsonMapper.builder()
          .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
          .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
          .serializationInclusion(JsonInclude.Include.NON_NULL)
          .build();

  /**
   * Serializes a node.
   *
   * @return canonical JSON, or {@code null} if the node cannot be serialized (such nodes never
   *     verify against a cache entry)
   */
  public String serialize(SourceNode node) {
    if (node == null) {
      return null;
    }
    try {
      return MAPPER.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize source node of type {}: {}", node.type(), e.getMessage());
      return null;
    }
  }
}
