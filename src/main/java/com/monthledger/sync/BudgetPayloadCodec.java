package com.monthledger.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.monthledger.ledger.BudgetDataNormalizer;
import com.monthledger.model.BudgetData;
import org.springframework.stereotype.Component;

/**
 * Serializes months into the payload strings kept in the sync queue and the offline snapshot.
 * Property order is fixed so two equal months always produce the same payload.
 */
@Component
public class BudgetPayloadCodec {
  private final ObjectMapper canonicalMapper;
  private final BudgetDataNormalizer normalizer;

  public BudgetPayloadCodec(BudgetDataNormalizer normalizer) {
    this.canonicalMapper = JsonMapper.builder()
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .build();
    this.normalizer = normalizer;
  }

  public String encode(BudgetData data) {
    try {
      return canonicalMapper.writeValueAsString(data);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize month payload", ex);
    }
  }

  /**
   * @throws IllegalArgumentException when the payload is not JSON
   */
  public BudgetData decode(String payload) {
    try {
      return normalizer.normalize(canonicalMapper.readTree(payload));
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Stored month payload is not valid JSON", ex);
    }
  }
}
