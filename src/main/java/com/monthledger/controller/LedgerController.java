package com.monthledger.controller;

import com.monthledger.dto.InitialBalanceRequest;
import com.monthledger.dto.LastViewedRequest;
import com.monthledger.dto.LineRequest;
import com.monthledger.dto.LinkUserRequest;
import com.monthledger.dto.MonthListResponse;
import com.monthledger.dto.MonthResponse;
import com.monthledger.dto.MoveLineRequest;
import com.monthledger.dto.OverwriteRequest;
import com.monthledger.dto.PersonNameRequest;
import com.monthledger.dto.PropagateRequest;
import com.monthledger.dto.PropagationResponse;
import com.monthledger.dto.ReorderRequest;
import com.monthledger.dto.TransactionRequest;
import com.monthledger.ledger.ConflictPolicy;
import com.monthledger.model.JointTransaction;
import com.monthledger.model.LineKind;
import com.monthledger.model.PersonSlot;
import com.monthledger.service.LedgerService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Locale;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/ledger")
public class LedgerController {
  private final LedgerService ledgerService;

  public LedgerController(LedgerService ledgerService) {
    this.ledgerService = ledgerService;
  }

  @GetMapping("/months")
  public MonthListResponse months() {
    return ledgerService.listMonths();
  }

  @GetMapping("/months/{monthKey}")
  public MonthResponse month(@PathVariable String monthKey) {
    return ledgerService.getMonth(monthKey);
  }

  @PostMapping("/months/{monthKey}/next")
  @ResponseStatus(HttpStatus.CREATED)
  public MonthResponse addNext(@PathVariable String monthKey) {
    return ledgerService.addNextMonth(monthKey);
  }

  @PostMapping("/months/{monthKey}/materialize")
  public List<String> materialize(@PathVariable String monthKey,
                                  @RequestParam(value = "count", required = false) Integer count) {
    return ledgerService.materialize(monthKey, count);
  }

  @DeleteMapping("/months/{monthKey}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void deleteMonth(@PathVariable String monthKey) {
    ledgerService.deleteMonth(monthKey);
  }

  @PostMapping("/months/{monthKey}/people/{person}/lines/{kind}")
  @ResponseStatus(HttpStatus.CREATED)
  public PropagationResponse createLine(@PathVariable String monthKey,
                                        @PathVariable String person,
                                        @PathVariable String kind,
                                        @Valid @RequestBody LineRequest request) {
    return ledgerService.createLine(monthKey, slot(person), kind(kind), request);
  }

  @PatchMapping("/months/{monthKey}/people/{person}/lines/{kind}/{lineId}")
  public PropagationResponse updateLine(@PathVariable String monthKey,
                                        @PathVariable String person,
                                        @PathVariable String kind,
                                        @PathVariable String lineId,
                                        @RequestParam(value = "policy", required = false) String policy,
                                        @Valid @RequestBody LineRequest request) {
    return ledgerService.updateLine(monthKey, slot(person), kind(kind), lineId, request, policy(policy));
  }

  @DeleteMapping("/months/{monthKey}/people/{person}/lines/{kind}/{lineId}")
  public PropagationResponse deleteLine(@PathVariable String monthKey,
                                        @PathVariable String person,
                                        @PathVariable String kind,
                                        @PathVariable String lineId) {
    return ledgerService.deleteLine(monthKey, slot(person), kind(kind), lineId);
  }

  @PutMapping("/months/{monthKey}/people/{person}/lines/{kind}/{lineId}/propagate")
  public PropagationResponse setPropagate(@PathVariable String monthKey,
                                          @PathVariable String person,
                                          @PathVariable String kind,
                                          @PathVariable String lineId,
                                          @Valid @RequestBody PropagateRequest request) {
    return ledgerService.setPropagate(monthKey, slot(person), kind(kind), lineId, request.getPropagate());
  }

  @PostMapping("/months/{monthKey}/people/{person}/lines/{kind}/{lineId}/move")
  public PropagationResponse move(@PathVariable String monthKey,
                                  @PathVariable String person,
                                  @PathVariable String kind,
                                  @PathVariable String lineId,
                                  @Valid @RequestBody MoveLineRequest request) {
    return ledgerService.moveLine(monthKey, slot(person), kind(kind), kind(request.getTo()), lineId);
  }

  @PostMapping("/months/{monthKey}/people/{person}/lines/{kind}/{lineId}/reorder")
  public MonthResponse reorderLine(@PathVariable String monthKey,
                                   @PathVariable String person,
                                   @PathVariable String kind,
                                   @PathVariable String lineId,
                                   @Valid @RequestBody ReorderRequest request) {
    return ledgerService.reorderLine(monthKey, slot(person), kind(kind), lineId, request.getDirection());
  }

  @PostMapping("/months/{monthKey}/people/{person}/lines/{kind}/{lineId}/overwrite")
  public PropagationResponse overwrite(@PathVariable String monthKey,
                                       @PathVariable String person,
                                       @PathVariable String kind,
                                       @PathVariable String lineId,
                                       @Valid @RequestBody OverwriteRequest request) {
    return ledgerService.overwriteDiverged(monthKey, slot(person), kind(kind), lineId, request.getMonths());
  }

  @PutMapping("/months/{monthKey}/people/{person}/name")
  public MonthResponse renamePerson(@PathVariable String monthKey,
                                    @PathVariable String person,
                                    @Valid @RequestBody PersonNameRequest request) {
    return ledgerService.renamePerson(monthKey, slot(person), request.getName());
  }

  @PutMapping("/months/{monthKey}/people/{person}/user")
  public MonthResponse linkUser(@PathVariable String monthKey,
                                @PathVariable String person,
                                @RequestBody LinkUserRequest request) {
    return ledgerService.linkUser(monthKey, slot(person), request.getUserId());
  }

  @PutMapping("/months/{monthKey}/joint/initial-balance")
  public MonthResponse initialBalance(@PathVariable String monthKey,
                                      @Valid @RequestBody InitialBalanceRequest request) {
    return ledgerService.setInitialBalance(monthKey, request.getAmount());
  }

  @PostMapping("/months/{monthKey}/joint/transactions")
  @ResponseStatus(HttpStatus.CREATED)
  public JointTransaction addTransaction(@PathVariable String monthKey, @RequestBody TransactionRequest request) {
    return ledgerService.addTransaction(monthKey, request);
  }

  @PatchMapping("/months/{monthKey}/joint/transactions/{transactionId}")
  public JointTransaction updateTransaction(@PathVariable String monthKey,
                                            @PathVariable String transactionId,
                                            @RequestBody TransactionRequest request) {
    return ledgerService.updateTransaction(monthKey, transactionId, request);
  }

  @DeleteMapping("/months/{monthKey}/joint/transactions/{transactionId}")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void deleteTransaction(@PathVariable String monthKey, @PathVariable String transactionId) {
    ledgerService.deleteTransaction(monthKey, transactionId);
  }

  @PostMapping("/months/{monthKey}/joint/transactions/{transactionId}/reorder")
  public MonthResponse reorderTransaction(@PathVariable String monthKey,
                                          @PathVariable String transactionId,
                                          @Valid @RequestBody ReorderRequest request) {
    return ledgerService.reorderTransaction(monthKey, transactionId, request.getDirection());
  }

  @PutMapping("/last-viewed")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void lastViewed(@Valid @RequestBody LastViewedRequest request) {
    ledgerService.setLastViewedMonth(request.getMonthKey());
  }

  private static PersonSlot slot(String value) {
    try {
      return PersonSlot.fromKey(value);
    } catch (IllegalArgumentException ex) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage());
    }
  }

  private static LineKind kind(String value) {
    try {
      return LineKind.fromKey(value);
    } catch (IllegalArgumentException ex) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage());
    }
  }

  private static ConflictPolicy policy(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return ConflictPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    } catch (IllegalArgumentException ex) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown conflict policy: " + value);
    }
  }
}
