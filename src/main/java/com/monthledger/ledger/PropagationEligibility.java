package com.monthledger.ledger;

import com.monthledger.config.PropagationProperties;
import com.monthledger.model.LineItem;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * A line takes part in forward propagation when its owner has not opted it out and it is either
 * already templated or has been given a real name. Untouched placeholder rows stay local.
 */
@Component
public class PropagationEligibility {
  private final Set<String> placeholderLabels;

  public PropagationEligibility(PropagationProperties properties) {
    this.placeholderLabels = properties.placeholderLabels().stream()
        .map(TemplateMatcher::normalizeName)
        .filter(label -> !label.isEmpty())
        .collect(Collectors.toUnmodifiableSet());
  }

  public boolean isEligible(LineItem item) {
    if (item == null || !item.isPropagate()) {
      return false;
    }
    return item.hasTemplateId() || hasMeaningfulName(item.getName());
  }

  public boolean hasMeaningfulName(String name) {
    String normalized = TemplateMatcher.normalizeName(name);
    return !normalized.isEmpty() && !placeholderLabels.contains(normalized);
  }

  public boolean isPlaceholderName(String name) {
    return !hasMeaningfulName(name);
  }
}
