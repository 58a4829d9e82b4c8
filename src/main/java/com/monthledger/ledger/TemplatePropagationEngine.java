package com.monthledger.ledger;

import com.monthledger.config.LedgerProperties;
import com.monthledger.config.PropagationProperties;
import com.monthledger.model.BudgetData;
import com.monthledger.model.LineItem;
import com.monthledger.model.LineKind;
import com.monthledger.model.PersonSlot;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Applies line edits to one month and carries them forward into every later materialized month.
 *
 * <p>All operations mutate the map they are given and never touch a month earlier than the edited
 * one. Callers that need all-or-nothing semantics pass a working copy.
 */
@Component
public class TemplatePropagationEngine {
  private static final Logger log = LoggerFactory.getLogger(TemplatePropagationEngine.class);

  private final TemplateMatcher matcher;
  private final PropagationEligibility eligibility;
  private final RecurringWindowEvaluator windowEvaluator;
  private final LedgerProperties ledgerProperties;
  private final PropagationProperties propagationProperties;

  public TemplatePropagationEngine(TemplateMatcher matcher,
                                   PropagationEligibility eligibility,
                                   RecurringWindowEvaluator windowEvaluator,
                                   LedgerProperties ledgerProperties,
                                   PropagationProperties propagationProperties) {
    this.matcher = matcher;
    this.eligibility = eligibility;
    this.windowEvaluator = windowEvaluator;
    this.ledgerProperties = ledgerProperties;
    this.propagationProperties = propagationProperties;
  }

  public PropagationResult create(NavigableMap<String, BudgetData> months,
                                  String monthKey,
                                  PersonSlot slot,
                                  LineKind kind,
                                  LineItem item) {
    List<LineItem> lines = requireMonth(months, monthKey).person(slot).lines(kind);
    if (item.getId() == null || item.getId().isBlank()) {
      item.setId(newId());
    }
    item.setAmount(Amounts.canonical(item.getAmount()));
    prepareForKind(item, kind, monthKey);
    lines.add(item);

    Tracker tracker = new Tracker(monthKey);
    if (!eligibility.isEligible(item)) {
      return tracker.result(item);
    }
    ensureTemplateId(item);
    for (Map.Entry<String, BudgetData> entry : later(months, monthKey)) {
      String key = entry.getKey();
      List<LineItem> target = entry.getValue().person(slot).lines(kind);
      Optional<LineItem> match = matcher.findMatch(target, item.getTemplateId(), item.getName());
      if (match.isPresent()) {
        if (retrofitTemplateId(match.get(), item.getTemplateId())) {
          tracker.touch(key);
        }
      } else if (windowEvaluator.isActiveIn(item, key)) {
        target.add(seedCopy(item));
        tracker.touch(key);
      }
    }
    return tracker.result(item);
  }

  public PropagationResult update(NavigableMap<String, BudgetData> months,
                                  String monthKey,
                                  PersonSlot slot,
                                  LineKind kind,
                                  String lineId,
                                  LinePatch patch,
                                  ConflictPolicy policy,
                                  DivergenceResolver resolver) {
    LineItem source = requireLine(months, monthKey, slot, kind, lineId);
    LineItem before = source.copy();
    patch.applyTo(source);
    prepareForKind(source, kind, monthKey);

    Tracker tracker = new Tracker(monthKey);
    Set<PropagatedField> changed = PropagatedField.changedBetween(before, source);
    if (changed.isEmpty() || !eligibility.isEligible(source)) {
      return tracker.result(source);
    }
    boolean minted = ensureTemplateId(source);
    String templateId = source.getTemplateId();
    String fallbackName = eligibility.hasMeaningfulName(before.getName()) ? before.getName() : null;

    List<Map.Entry<String, LineItem>> diverged = new ArrayList<>();
    for (Map.Entry<String, BudgetData> entry : later(months, monthKey)) {
      String key = entry.getKey();
      List<LineItem> target = entry.getValue().person(slot).lines(kind);
      Optional<LineItem> match = matcher.findMatch(target, templateId, fallbackName);
      boolean active = windowEvaluator.isActiveIn(source, key);
      if (match.isEmpty()) {
        boolean widened = changed.contains(PropagatedField.RECURRENCE) && !windowEvaluator.isActiveIn(before, key);
        if (active && (source.isRecurring() || minted || widened)) {
          target.add(seedCopy(source));
          tracker.touch(key);
        }
        continue;
      }
      LineItem copy = match.get();
      if (!copy.isPropagate()) {
        continue;
      }
      if (!active) {
        target.remove(copy);
        tracker.touch(key);
        continue;
      }
      if (retrofitTemplateId(copy, templateId)) {
        tracker.touch(key);
      }
      if (PropagatedField.anyDiffers(copy, before, changed)) {
        diverged.add(Map.entry(key, copy));
      } else {
        PropagatedField.copyAll(source, copy, changed);
        tracker.touch(key);
      }
    }

    if (!diverged.isEmpty()) {
      List<String> divergedMonths = diverged.stream().map(Map.Entry::getKey).toList();
      DivergenceReport report = new DivergenceReport(monthKey, templateId, divergedMonths, changed);
      if (shouldOverwrite(policy, resolver, report)) {
        for (Map.Entry<String, LineItem> entry : diverged) {
          PropagatedField.copyAll(source, entry.getValue(), changed);
          tracker.touch(entry.getKey());
        }
      } else {
        log.debug("Left {} diverged copies of template {} untouched", divergedMonths.size(), templateId);
        tracker.skip(divergedMonths);
      }
    }
    return tracker.result(source);
  }

  public PropagationResult delete(NavigableMap<String, BudgetData> months,
                                  String monthKey,
                                  PersonSlot slot,
                                  LineKind kind,
                                  String lineId) {
    List<LineItem> lines = requireMonth(months, monthKey).person(slot).lines(kind);
    LineItem source = requireLine(months, monthKey, slot, kind, lineId);
    lines.remove(source);

    Tracker tracker = new Tracker(monthKey);
    if (!eligibility.isEligible(source)) {
      return tracker.result(source);
    }
    String fallbackName = eligibility.hasMeaningfulName(source.getName()) ? source.getName() : null;
    for (Map.Entry<String, BudgetData> entry : later(months, monthKey)) {
      List<LineItem> target = entry.getValue().person(slot).lines(kind);
      Optional<LineItem> match = matcher.findMatch(target, source.getTemplateId(), fallbackName);
      if (match.isPresent() && match.get().isPropagate()) {
        target.remove(match.get());
        tracker.touch(entry.getKey());
      }
    }
    return tracker.result(source);
  }

  /**
   * Switching propagation off pins nothing but this copy. Switching it back on re-seeds the later
   * months that lack a copy and whose window admits one.
   */
  public PropagationResult setPropagate(NavigableMap<String, BudgetData> months,
                                        String monthKey,
                                        PersonSlot slot,
                                        LineKind kind,
                                        String lineId,
                                        boolean propagate) {
    LineItem source = requireLine(months, monthKey, slot, kind, lineId);
    Tracker tracker = new Tracker(monthKey);
    source.setPropagate(propagate);
    if (!propagate || !eligibility.isEligible(source)) {
      return tracker.result(source);
    }
    ensureTemplateId(source);
    String fallbackName = eligibility.hasMeaningfulName(source.getName()) ? source.getName() : null;
    for (Map.Entry<String, BudgetData> entry : later(months, monthKey)) {
      String key = entry.getKey();
      List<LineItem> target = entry.getValue().person(slot).lines(kind);
      Optional<LineItem> match = matcher.findMatch(target, source.getTemplateId(), fallbackName);
      if (match.isPresent()) {
        if (retrofitTemplateId(match.get(), source.getTemplateId())) {
          tracker.touch(key);
        }
      } else if (windowEvaluator.isActiveIn(source, key)) {
        target.add(seedCopy(source));
        tracker.touch(key);
      }
    }
    return tracker.result(source);
  }

  /**
   * Explicit instruction to push every propagated field of a line into the listed later months,
   * including copies that had diverged. Pinned copies stay pinned.
   */
  public PropagationResult overwriteDiverged(NavigableMap<String, BudgetData> months,
                                             String monthKey,
                                             PersonSlot slot,
                                             LineKind kind,
                                             String lineId,
                                             Collection<String> targetMonths) {
    LineItem source = requireLine(months, monthKey, slot, kind, lineId);
    Tracker tracker = new Tracker(monthKey);
    if (!eligibility.isEligible(source) || !source.hasTemplateId()) {
      return tracker.result(source);
    }
    Set<PropagatedField> all = EnumSet.allOf(PropagatedField.class);
    for (String key : new TreeSet<>(targetMonths)) {
      if (key.compareTo(monthKey) <= 0 || !months.containsKey(key)) {
        continue;
      }
      List<LineItem> target = months.get(key).person(slot).lines(kind);
      Optional<LineItem> match = matcher.findByTemplateId(target, source.getTemplateId());
      if (match.isPresent() && match.get().isPropagate()
          && PropagatedField.anyDiffers(match.get(), source, all)) {
        PropagatedField.copyAll(source, match.get(), all);
        tracker.touch(key);
      }
    }
    return tracker.result(source);
  }

  /**
   * Moves a line between the fixed expense and category lists of one person: removed from one list
   * and created in the other under the same template id, in this month and every later month that
   * holds an unpinned copy.
   */
  public PropagationResult move(NavigableMap<String, BudgetData> months,
                                String monthKey,
                                PersonSlot slot,
                                LineKind from,
                                LineKind to,
                                String lineId) {
    if (from == to || from == LineKind.INCOME || to == LineKind.INCOME) {
      throw new IllegalArgumentException("Lines only move between fixed expenses and categories");
    }
    LineItem source = requireLine(months, monthKey, slot, from, lineId);
    boolean eligible = eligibility.isEligible(source);
    if (eligible) {
      ensureTemplateId(source);
    }
    String templateId = source.getTemplateId();
    String fallbackName = eligibility.hasMeaningfulName(source.getName()) ? source.getName() : null;

    BudgetData month = months.get(monthKey);
    month.person(slot).lines(from).remove(source);
    month.person(slot).lines(to).add(prepareForKind(source, to, monthKey));

    Tracker tracker = new Tracker(monthKey);
    if (!eligible) {
      return tracker.result(source);
    }
    for (Map.Entry<String, BudgetData> entry : later(months, monthKey)) {
      String key = entry.getKey();
      List<LineItem> fromLines = entry.getValue().person(slot).lines(from);
      List<LineItem> toLines = entry.getValue().person(slot).lines(to);
      Optional<LineItem> match = matcher.findMatch(fromLines, templateId, fallbackName);
      if (match.isPresent()) {
        LineItem copy = match.get();
        if (!copy.isPropagate()) {
          continue;
        }
        fromLines.remove(copy);
        copy.setTemplateId(templateId);
        toLines.add(prepareForKind(copy, to, key));
        tracker.touch(key);
      } else if (matcher.findMatch(toLines, templateId, fallbackName).isEmpty()
          && windowEvaluator.isActiveIn(source, key)) {
        toLines.add(seedCopy(source));
        tracker.touch(key);
      }
    }
    return tracker.result(source);
  }

  public Optional<LineItem> findLine(NavigableMap<String, BudgetData> months,
                                     String monthKey,
                                     PersonSlot slot,
                                     LineKind kind,
                                     String lineId) {
    BudgetData month = months.get(monthKey);
    if (month == null || lineId == null) {
      return Optional.empty();
    }
    return month.person(slot).lines(kind).stream()
        .filter(line -> lineId.equals(line.getId()))
        .findFirst();
  }

  private boolean shouldOverwrite(ConflictPolicy policy, DivergenceResolver resolver, DivergenceReport report) {
    ConflictPolicy effective = policy != null ? policy : propagationProperties.conflictPolicy();
    return switch (effective) {
      case ALWAYS_OVERWRITE -> true;
      case NEVER_OVERWRITE -> false;
      case ASK_CALLER -> report.divergedMonths().size() < propagationProperties.divergencePromptThreshold()
          || (resolver != null && resolver.shouldOverwrite(report));
    };
  }

  private LineItem prepareForKind(LineItem line, LineKind kind, String monthKey) {
    if (kind != LineKind.CATEGORY) {
      line.clearRecurrence();
      if (kind == LineKind.INCOME) {
        line.setChecked(false);
      }
      return line;
    }
    if (line.isRecurring()) {
      if (line.getRecurringMonths() == null) {
        line.setRecurringMonths(ledgerProperties.defaultRecurringMonths());
      }
      if (line.getStartMonth() == null) {
        line.setStartMonth(monthKey);
      }
    }
    return line;
  }

  private boolean ensureTemplateId(LineItem line) {
    if (line.hasTemplateId()) {
      return false;
    }
    line.setTemplateId(newId());
    return true;
  }

  private boolean retrofitTemplateId(LineItem copy, String templateId) {
    if (!copy.isPropagate() || templateId.equals(copy.getTemplateId())) {
      return false;
    }
    copy.setTemplateId(templateId);
    return true;
  }

  private LineItem seedCopy(LineItem source) {
    LineItem copy = source.copy();
    copy.setId(newId());
    copy.setChecked(false);
    copy.setPropagate(true);
    return copy;
  }

  private BudgetData requireMonth(NavigableMap<String, BudgetData> months, String monthKey) {
    BudgetData month = months.get(monthKey);
    if (month == null) {
      throw new EntryNotFoundException("Month not found: " + monthKey);
    }
    return month;
  }

  private LineItem requireLine(NavigableMap<String, BudgetData> months,
                               String monthKey,
                               PersonSlot slot,
                               LineKind kind,
                               String lineId) {
    requireMonth(months, monthKey);
    return findLine(months, monthKey, slot, kind, lineId)
        .orElseThrow(() -> new EntryNotFoundException("Line not found: " + lineId));
  }

  private static Set<Map.Entry<String, BudgetData>> later(NavigableMap<String, BudgetData> months, String monthKey) {
    return months.tailMap(monthKey, false).entrySet();
  }

  private static String newId() {
    return UUID.randomUUID().toString();
  }

  private static final class Tracker {
    private final TreeSet<String> touched = new TreeSet<>();
    private final List<String> skipped = new ArrayList<>();

    Tracker(String editedMonth) {
      touched.add(editedMonth);
    }

    void touch(String monthKey) {
      touched.add(monthKey);
    }

    void skip(List<String> monthKeys) {
      skipped.addAll(monthKeys);
    }

    PropagationResult result(LineItem line) {
      return new PropagationResult(line.getId(), line.getTemplateId(), touched, List.copyOf(skipped));
    }
  }
}
