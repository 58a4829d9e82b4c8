package com.monthledger.config;

import com.monthledger.ledger.ConflictPolicy;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "monthledger.propagation")
public record PropagationProperties(
    ConflictPolicy conflictPolicy,
    int divergencePromptThreshold,
    List<String> placeholderLabels
) {
  public PropagationProperties {
    if (conflictPolicy == null) {
      conflictPolicy = ConflictPolicy.NEVER_OVERWRITE;
    }
    if (divergencePromptThreshold < 1) {
      divergencePromptThreshold = 1;
    }
    placeholderLabels = placeholderLabels == null ? List.of() : List.copyOf(placeholderLabels);
  }
}
