package com.monthledger.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Income source, fixed expense or flexible category of one person in one month.
 * The recurrence fields only carry meaning for categories.
 */
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LineItem {
  private String id;
  private String templateId;
  private String name;
  private BigDecimal amount = BigDecimal.ZERO;
  private String categoryOverrideId;
  private String icon;
  private String date;
  private String account;

  @JsonProperty("isChecked")
  private boolean checked;

  private boolean propagate = true;

  @JsonProperty("isRecurring")
  private boolean recurring;

  private Integer recurringMonths;
  private String startMonth;

  public LineItem(String id, String name, BigDecimal amount) {
    this.id = id;
    this.name = name;
    this.amount = amount;
  }

  public boolean hasTemplateId() {
    return templateId != null && !templateId.isBlank();
  }

  public LineItem copy() {
    LineItem copy = new LineItem();
    copy.id = id;
    copy.templateId = templateId;
    copy.name = name;
    copy.amount = amount;
    copy.categoryOverrideId = categoryOverrideId;
    copy.icon = icon;
    copy.date = date;
    copy.account = account;
    copy.checked = checked;
    copy.propagate = propagate;
    copy.recurring = recurring;
    copy.recurringMonths = recurringMonths;
    copy.startMonth = startMonth;
    return copy;
  }

  public void clearRecurrence() {
    recurring = false;
    recurringMonths = null;
    startMonth = null;
  }
}
