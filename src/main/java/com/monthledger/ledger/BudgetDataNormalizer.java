package com.monthledger.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.monthledger.config.LedgerProperties;
import com.monthledger.model.BudgetData;
import com.monthledger.model.JointAccount;
import com.monthledger.model.JointTransaction;
import com.monthledger.model.LineItem;
import com.monthledger.model.LineKind;
import com.monthledger.model.MonthKey;
import com.monthledger.model.PersonBudget;
import com.monthledger.model.PersonSlot;
import com.monthledger.model.TransactionType;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Canonicalizes budget payloads coming from the remote store, the sync queue or the local
 * snapshot into the typed model. Malformed values are coerced, never rejected.
 */
@Component
public class BudgetDataNormalizer {
  private static final Pattern LEADING_ZEROS = Pattern.compile("^0+(?=\\d)");

  private final ObjectMapper objectMapper;
  private final LedgerProperties ledgerProperties;

  public BudgetDataNormalizer(ObjectMapper objectMapper, LedgerProperties ledgerProperties) {
    this.objectMapper = objectMapper;
    this.ledgerProperties = ledgerProperties;
  }

  public BudgetData normalize(JsonNode raw) {
    JsonNode root = raw == null || !raw.isObject() ? objectMapper.createObjectNode() : raw;
    BudgetData data = new BudgetData();
    data.setPerson1(normalizePerson(root.get("person1"), PersonSlot.PERSON1, ledgerProperties.person1Name()));
    data.setPerson2(normalizePerson(root.get("person2"), PersonSlot.PERSON2, ledgerProperties.person2Name()));
    data.setJointAccount(normalizeJointAccount(root.get("jointAccount")));
    data.setPerson1UserId(text(root.get("person1UserId")));
    data.setPerson2UserId(text(root.get("person2UserId")));
    return data;
  }

  public BudgetData normalize(BudgetData data) {
    return normalize(objectMapper.valueToTree(data));
  }

  private PersonBudget normalizePerson(JsonNode node, PersonSlot slot, String defaultName) {
    PersonBudget person = new PersonBudget();
    String name = node == null ? null : text(node.get("name"));
    person.setName(name != null ? name : defaultName);
    if (node == null || !node.isObject()) {
      return person;
    }
    readLines(node.get("incomeSources"), slot, LineKind.INCOME, person.getIncomeSources());
    readLines(node.get("fixedExpenses"), slot, LineKind.FIXED_EXPENSE, person.getFixedExpenses());
    readLines(node.get("categories"), slot, LineKind.CATEGORY, person.getCategories());
    return person;
  }

  private void readLines(JsonNode array, PersonSlot slot, LineKind kind, List<LineItem> target) {
    if (array == null || !array.isArray()) {
      return;
    }
    int index = 0;
    for (JsonNode node : array) {
      if (node != null && node.isObject()) {
        target.add(normalizeLine(node, slot, kind, index));
      }
      index++;
    }
  }

  private LineItem normalizeLine(JsonNode node, PersonSlot slot, LineKind kind, int index) {
    LineItem line = new LineItem();
    String id = text(node.get("id"));
    line.setId(id != null ? id : fallbackId(slot.getKey() + "-" + kind.getKey(), index));
    line.setTemplateId(text(node.get("templateId")));
    String name = text(node.get("name"));
    line.setName(name != null ? name : "");
    line.setAmount(coerceNumber(node.get("amount")));
    line.setCategoryOverrideId(text(node.get("categoryOverrideId")));
    line.setIcon(text(node.get("icon")));
    line.setDate(text(node.get("date")));
    line.setAccount(text(node.get("account")));
    line.setChecked(coerceFlag(node.get("isChecked"), false));
    line.setPropagate(coerceFlag(node.get("propagate"), true));
    if (kind == LineKind.CATEGORY) {
      line.setRecurring(coerceFlag(node.get("isRecurring"), false));
      line.setRecurringMonths(coercePositiveInt(node.get("recurringMonths")));
      String startMonth = text(node.get("startMonth"));
      line.setStartMonth(MonthKey.isValid(startMonth) ? startMonth : null);
    }
    return line;
  }

  private JointAccount normalizeJointAccount(JsonNode node) {
    JointAccount account = new JointAccount();
    if (node == null || !node.isObject()) {
      return account;
    }
    account.setInitialBalance(coerceNumber(node.get("initialBalance")));
    JsonNode transactions = node.get("transactions");
    if (transactions != null && transactions.isArray()) {
      int index = 0;
      for (JsonNode tx : transactions) {
        if (tx != null && tx.isObject()) {
          account.getTransactions().add(normalizeTransaction(tx, index));
        }
        index++;
      }
    }
    return account;
  }

  private JointTransaction normalizeTransaction(JsonNode node, int index) {
    String id = text(node.get("id"));
    String date = text(node.get("date"));
    String description = text(node.get("description"));
    String person = text(node.get("person"));
    return new JointTransaction(
        id != null ? id : fallbackId("joint", index),
        date != null ? date : "",
        description != null ? description : "",
        coerceNumber(node.get("amount")),
        TransactionType.fromValue(text(node.get("type"))),
        person != null ? person : ""
    );
  }

  /**
   * Finite number or zero. Strings are trimmed and stripped of leading zeros before parsing.
   */
  public static BigDecimal coerceNumber(JsonNode node) {
    if (node == null || node.isNull()) {
      return BigDecimal.ZERO;
    }
    if (node.isNumber()) {
      if (node.isFloatingPointNumber() && !Double.isFinite(node.doubleValue())) {
        return BigDecimal.ZERO;
      }
      try {
        return Amounts.canonical(node.decimalValue());
      } catch (NumberFormatException ex) {
        return BigDecimal.ZERO;
      }
    }
    if (node.isTextual()) {
      return parseNumber(node.asText());
    }
    return BigDecimal.ZERO;
  }

  public static BigDecimal parseNumber(String raw) {
    if (raw == null) {
      return BigDecimal.ZERO;
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      return BigDecimal.ZERO;
    }
    String normalized = LEADING_ZEROS.matcher(trimmed).replaceFirst("");
    try {
      if (!Double.isFinite(Double.parseDouble(normalized))) {
        return BigDecimal.ZERO;
      }
      return Amounts.canonical(new BigDecimal(normalized));
    } catch (NumberFormatException ex) {
      return BigDecimal.ZERO;
    }
  }

  static boolean coerceFlag(JsonNode node, boolean defaultValue) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return defaultValue;
    }
    if (node.isBoolean()) {
      return node.booleanValue();
    }
    if (node.isNumber()) {
      return node.doubleValue() != 0d;
    }
    if (node.isTextual()) {
      String value = node.asText().trim().toLowerCase(Locale.ROOT);
      if (value.equals("true") || value.equals("1")) {
        return true;
      }
      if (value.equals("false") || value.equals("0")) {
        return false;
      }
    }
    return defaultValue;
  }

  private static Integer coercePositiveInt(JsonNode node) {
    BigDecimal value = coerceNumber(node);
    if (value.signum() <= 0) {
      return null;
    }
    try {
      return value.intValueExact();
    } catch (ArithmeticException ex) {
      return null;
    }
  }

  private static String text(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode() || node.isContainerNode()) {
      return null;
    }
    return node.asText();
  }

  private static String fallbackId(String prefix, int index) {
    return prefix + "-" + (index + 1);
  }
}
