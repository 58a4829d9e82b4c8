package com.monthledger.ledger;

import com.monthledger.model.LineItem;
import java.math.BigDecimal;
import lombok.Getter;
import lombok.Setter;

/**
 * Partial edit of a line. {@code null} leaves a field untouched; an empty string clears the
 * optional text fields.
 */
@Getter
@Setter
public class LinePatch {
  private String name;
  private BigDecimal amount;
  private String categoryOverrideId;
  private String icon;
  private String date;
  private String account;
  private Boolean checked;
  private Boolean recurring;
  private Integer recurringMonths;
  private String startMonth;

  public static LinePatch amount(BigDecimal amount) {
    LinePatch patch = new LinePatch();
    patch.setAmount(amount);
    return patch;
  }

  public static LinePatch name(String name) {
    LinePatch patch = new LinePatch();
    patch.setName(name);
    return patch;
  }

  void applyTo(LineItem line) {
    if (name != null) {
      line.setName(name);
    }
    if (amount != null) {
      line.setAmount(Amounts.canonical(amount));
    }
    if (categoryOverrideId != null) {
      line.setCategoryOverrideId(blankToNull(categoryOverrideId));
    }
    if (icon != null) {
      line.setIcon(blankToNull(icon));
    }
    if (date != null) {
      line.setDate(blankToNull(date));
    }
    if (account != null) {
      line.setAccount(blankToNull(account));
    }
    if (checked != null) {
      line.setChecked(checked);
    }
    if (recurring != null) {
      line.setRecurring(recurring);
    }
    if (recurringMonths != null) {
      line.setRecurringMonths(recurringMonths > 0 ? recurringMonths : null);
    }
    if (startMonth != null) {
      line.setStartMonth(blankToNull(startMonth));
    }
  }

  private static String blankToNull(String value) {
    return value.isBlank() ? null : value;
  }
}
