package com.monthledger.ledger;

import com.monthledger.model.LineItem;
import java.text.Normalizer;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Decides whether a line in another month is "the same" conceptual line. The template id tier is
 * authoritative; the normalized-name tier only covers records that predate template ids.
 */
@Component
public class TemplateMatcher {
  private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
  private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");

  public Optional<LineItem> findMatch(List<LineItem> candidates, String templateId, String name) {
    Optional<LineItem> byTemplate = findByTemplateId(candidates, templateId);
    if (byTemplate.isPresent()) {
      return byTemplate;
    }
    return findByName(candidates, templateId, name);
  }

  public Optional<LineItem> findByTemplateId(List<LineItem> candidates, String templateId) {
    if (candidates == null || templateId == null || templateId.isBlank()) {
      return Optional.empty();
    }
    return candidates.stream()
        .filter(candidate -> templateId.equals(candidate.getTemplateId()))
        .findFirst();
  }

  /**
   * Name fallback. A candidate carrying a different template id is a different line even when
   * the names agree.
   */
  public Optional<LineItem> findByName(List<LineItem> candidates, String templateId, String name) {
    String wanted = normalizeName(name);
    if (candidates == null || wanted.isEmpty()) {
      return Optional.empty();
    }
    boolean sourceHasTemplate = templateId != null && !templateId.isBlank();
    return candidates.stream()
        .filter(candidate -> !sourceHasTemplate || !candidate.hasTemplateId())
        .filter(candidate -> wanted.equals(normalizeName(candidate.getName())))
        .findFirst();
  }

  public static String normalizeName(String name) {
    if (name == null) {
      return "";
    }
    String decomposed = Normalizer.normalize(name, Normalizer.Form.NFD);
    String stripped = DIACRITICS.matcher(decomposed).replaceAll("");
    String lower = stripped.toLowerCase(Locale.ROOT);
    return NON_ALPHANUMERIC.matcher(lower).replaceAll(" ").trim();
  }
}
