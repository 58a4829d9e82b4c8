package com.monthledger.service;

import com.monthledger.config.LedgerProperties;
import com.monthledger.dto.LineRequest;
import com.monthledger.dto.MonthListResponse;
import com.monthledger.dto.MonthResponse;
import com.monthledger.dto.PropagationResponse;
import com.monthledger.dto.TransactionRequest;
import com.monthledger.ledger.BudgetTotals;
import com.monthledger.ledger.ConflictPolicy;
import com.monthledger.ledger.DivergenceResolver;
import com.monthledger.ledger.EntryNotFoundException;
import com.monthledger.ledger.LinePatch;
import com.monthledger.ledger.MonthEditor;
import com.monthledger.ledger.MonthMaterializer;
import com.monthledger.ledger.MoveDirection;
import com.monthledger.ledger.PropagationResult;
import com.monthledger.ledger.TemplatePropagationEngine;
import com.monthledger.ledger.TransactionPatch;
import com.monthledger.model.BudgetData;
import com.monthledger.model.JointTransaction;
import com.monthledger.model.LineItem;
import com.monthledger.model.LineKind;
import com.monthledger.model.MonthKey;
import com.monthledger.model.PersonSlot;
import com.monthledger.sync.LocalStateStore;
import com.monthledger.sync.SyncWorker;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Function;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

/**
 * Edits against the open ledger. Each call is one atomic change of the month map; the months it
 * touched are handed to the sync worker afterwards.
 */
@Service
public class LedgerService {
  static final String LAST_VIEWED_PREFIX = "lastViewedMonth";
  private static final int MAX_MATERIALIZE_MONTHS = 120;

  private final LedgerStore store;
  private final TemplatePropagationEngine engine;
  private final MonthMaterializer materializer;
  private final MonthEditor editor;
  private final SyncWorker syncWorker;
  private final LocalStateStore stateStore;
  private final ClientSession session;
  private final LedgerProperties ledgerProperties;

  public LedgerService(LedgerStore store,
                       TemplatePropagationEngine engine,
                       MonthMaterializer materializer,
                       MonthEditor editor,
                       SyncWorker syncWorker,
                       LocalStateStore stateStore,
                       ClientSession session,
                       LedgerProperties ledgerProperties) {
    this.store = store;
    this.engine = engine;
    this.materializer = materializer;
    this.editor = editor;
    this.syncWorker = syncWorker;
    this.stateStore = stateStore;
    this.session = session;
    this.ledgerProperties = ledgerProperties;
  }

  public MonthListResponse listMonths() {
    requireOpen();
    return new MonthListResponse(new ArrayList<>(store.monthKeys()), lastViewedMonth());
  }

  public MonthResponse getMonth(String monthKey) {
    requireValidKey(monthKey);
    requireOpen();
    BudgetData data = store.month(monthKey)
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Month not found"));
    return new MonthResponse(monthKey, data, BudgetTotals.of(data), syncWorker.stateOf(monthKey));
  }

  /**
   * Creates the month after {@code monthKey} from it, unless that month already exists.
   */
  public MonthResponse addNextMonth(String monthKey) {
    String next = MonthKey.plusMonths(requireValidKey(monthKey), 1);
    apply(monthKey, months -> {
      BudgetData previous = requireMonth(months, monthKey);
      months.putIfAbsent(next, materializer.deriveFrom(previous, next));
      return null;
    });
    return getMonth(next);
  }

  public List<String> materialize(String seedKey, Integer count) {
    int months = count == null ? ledgerProperties.materializeMonths() : count;
    if (months < 1 || months > MAX_MATERIALIZE_MONTHS) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Month count out of range");
    }
    return apply(seedKey, map -> materializer.materialize(map, seedKey, months));
  }

  public void deleteMonth(String monthKey) {
    apply(monthKey, months -> {
      if (months.remove(monthKey) == null) {
        throw new EntryNotFoundException("Month not found: " + monthKey);
      }
      return null;
    });
  }

  public PropagationResponse createLine(String monthKey, PersonSlot slot, LineKind kind, LineRequest request) {
    LineItem item = toLineItem(request);
    return toResponse(apply(monthKey, months -> engine.create(months, monthKey, slot, kind, item)));
  }

  /**
   * Updates a line and its later copies. With {@link ConflictPolicy#ASK_CALLER} the diverged
   * months are returned instead of overwritten; the caller follows up with
   * {@link #overwriteDiverged}.
   */
  public PropagationResponse updateLine(String monthKey,
                                        PersonSlot slot,
                                        LineKind kind,
                                        String lineId,
                                        LineRequest request,
                                        ConflictPolicy policy) {
    LinePatch patch = toPatch(request);
    Boolean propagate = request.getPropagate();
    return toResponse(apply(monthKey, months -> {
      // the flag flips first so a pinned line edits locally and a re-enabled one ripples the edit
      boolean flips = propagate != null && engine.findLine(months, monthKey, slot, kind, lineId)
          .map(line -> line.isPropagate() != propagate)
          .orElse(false);
      PropagationResult toggled = flips
          ? engine.setPropagate(months, monthKey, slot, kind, lineId, propagate)
          : null;
      PropagationResult updated =
          engine.update(months, monthKey, slot, kind, lineId, patch, policy, DivergenceResolver.DECLINE);
      return toggled == null ? updated : combine(toggled, updated);
    }));
  }

  public PropagationResponse deleteLine(String monthKey, PersonSlot slot, LineKind kind, String lineId) {
    return toResponse(apply(monthKey, months -> engine.delete(months, monthKey, slot, kind, lineId)));
  }

  public PropagationResponse setPropagate(String monthKey, PersonSlot slot, LineKind kind, String lineId,
                                          boolean propagate) {
    return toResponse(apply(monthKey, months ->
        engine.setPropagate(months, monthKey, slot, kind, lineId, propagate)));
  }

  public PropagationResponse moveLine(String monthKey, PersonSlot slot, LineKind from, LineKind to, String lineId) {
    return toResponse(apply(monthKey, months -> engine.move(months, monthKey, slot, from, to, lineId)));
  }

  public PropagationResponse overwriteDiverged(String monthKey, PersonSlot slot, LineKind kind, String lineId,
                                               List<String> targetMonths) {
    for (String target : targetMonths) {
      requireValidKey(target);
    }
    return toResponse(apply(monthKey, months ->
        engine.overwriteDiverged(months, monthKey, slot, kind, lineId, targetMonths)));
  }

  public MonthResponse reorderLine(String monthKey, PersonSlot slot, LineKind kind, String lineId,
                                   MoveDirection direction) {
    apply(monthKey, months -> editor.reorderLine(requireMonth(months, monthKey), slot, kind, lineId, direction));
    return getMonth(monthKey);
  }

  public MonthResponse renamePerson(String monthKey, PersonSlot slot, String name) {
    apply(monthKey, months -> {
      editor.renamePerson(requireMonth(months, monthKey), slot, name);
      return null;
    });
    return getMonth(monthKey);
  }

  public MonthResponse linkUser(String monthKey, PersonSlot slot, String userId) {
    apply(monthKey, months -> {
      editor.linkUser(requireMonth(months, monthKey), slot, userId);
      return null;
    });
    return getMonth(monthKey);
  }

  public MonthResponse setInitialBalance(String monthKey, BigDecimal amount) {
    apply(monthKey, months -> {
      editor.setInitialBalance(requireMonth(months, monthKey), amount);
      return null;
    });
    return getMonth(monthKey);
  }

  public JointTransaction addTransaction(String monthKey, TransactionRequest request) {
    TransactionPatch values = toPatch(request);
    return apply(monthKey, months -> editor.addTransaction(requireMonth(months, monthKey), request.getType(), values));
  }

  public JointTransaction updateTransaction(String monthKey, String transactionId, TransactionRequest request) {
    TransactionPatch patch = toPatch(request);
    return apply(monthKey, months -> editor.updateTransaction(requireMonth(months, monthKey), transactionId, patch));
  }

  public void deleteTransaction(String monthKey, String transactionId) {
    apply(monthKey, months -> {
      editor.deleteTransaction(requireMonth(months, monthKey), transactionId);
      return null;
    });
  }

  public MonthResponse reorderTransaction(String monthKey, String transactionId, MoveDirection direction) {
    apply(monthKey, months -> editor.reorderTransaction(requireMonth(months, monthKey), transactionId, direction));
    return getMonth(monthKey);
  }

  public String lastViewedMonth() {
    return stateStore.preference(lastViewedKey()).filter(MonthKey::isValid).orElse(null);
  }

  public void setLastViewedMonth(String monthKey) {
    stateStore.savePreference(lastViewedKey(), requireValidKey(monthKey));
  }

  private <T> T apply(String monthKey, Function<NavigableMap<String, BudgetData>, T> action) {
    requireValidKey(monthKey);
    requireOpen();
    LedgerMutation<T> mutation;
    try {
      mutation = store.mutate(action);
    } catch (EntryNotFoundException ex) {
      throw new ResponseStatusException(HttpStatus.NOT_FOUND, ex.getMessage());
    } catch (IllegalArgumentException ex) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage());
    } catch (IllegalStateException ex) {
      throw new ResponseStatusException(HttpStatus.CONFLICT, ex.getMessage());
    }
    for (String removed : mutation.removedMonths()) {
      syncWorker.deleteMonth(removed);
    }
    syncWorker.scheduleWrite(mutation.changedMonths());
    return mutation.result();
  }

  private void requireOpen() {
    if (!store.isOpen()) {
      throw new ResponseStatusException(HttpStatus.CONFLICT, "Ledger is not open");
    }
  }

  private String lastViewedKey() {
    String userId = session.getUserId();
    return userId == null ? LAST_VIEWED_PREFIX : LAST_VIEWED_PREFIX + ":" + userId;
  }

  private static String requireValidKey(String monthKey) {
    if (!MonthKey.isValid(monthKey)) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid month key");
    }
    return monthKey;
  }

  private static BudgetData requireMonth(NavigableMap<String, BudgetData> months, String monthKey) {
    BudgetData month = months.get(monthKey);
    if (month == null) {
      throw new EntryNotFoundException("Month not found: " + monthKey);
    }
    return month;
  }

  private static LineItem toLineItem(LineRequest request) {
    LineItem item = new LineItem(null, request.getName() == null ? "" : request.getName(),
        request.getAmount() == null ? BigDecimal.ZERO : request.getAmount());
    item.setCategoryOverrideId(blankToNull(request.getCategoryOverrideId()));
    item.setIcon(blankToNull(request.getIcon()));
    item.setDate(blankToNull(request.getDate()));
    item.setAccount(blankToNull(request.getAccount()));
    item.setChecked(Boolean.TRUE.equals(request.getChecked()));
    item.setRecurring(Boolean.TRUE.equals(request.getRecurring()));
    item.setRecurringMonths(request.getRecurringMonths());
    item.setStartMonth(blankToNull(request.getStartMonth()));
    item.setPropagate(request.getPropagate() == null || request.getPropagate());
    return item;
  }

  private static LinePatch toPatch(LineRequest request) {
    LinePatch patch = new LinePatch();
    patch.setName(request.getName());
    patch.setAmount(request.getAmount());
    patch.setCategoryOverrideId(request.getCategoryOverrideId());
    patch.setIcon(request.getIcon());
    patch.setDate(request.getDate());
    patch.setAccount(request.getAccount());
    patch.setChecked(request.getChecked());
    patch.setRecurring(request.getRecurring());
    patch.setRecurringMonths(request.getRecurringMonths());
    patch.setStartMonth(request.getStartMonth());
    return patch;
  }

  private static TransactionPatch toPatch(TransactionRequest request) {
    TransactionPatch patch = new TransactionPatch();
    patch.setDate(request.getDate());
    patch.setDescription(request.getDescription());
    patch.setAmount(request.getAmount());
    patch.setType(request.getType());
    patch.setPerson(request.getPerson());
    return patch;
  }

  private static PropagationResult combine(PropagationResult first, PropagationResult second) {
    SortedSet<String> touched = new TreeSet<>(first.touchedMonths());
    touched.addAll(second.touchedMonths());
    return new PropagationResult(second.lineId(), second.templateId(), touched, second.skippedDivergentMonths());
  }

  private static PropagationResponse toResponse(PropagationResult result) {
    return new PropagationResponse(result.lineId(), result.templateId(),
        new ArrayList<>(result.touchedMonths()), result.skippedDivergentMonths());
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
