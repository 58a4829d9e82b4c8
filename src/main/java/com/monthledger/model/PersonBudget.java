package com.monthledger.model;

import java.util.ArrayList;
import java.util.List;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode
@ToString
public class PersonBudget {
  private String name;
  private List<LineItem> incomeSources = new ArrayList<>();
  private List<LineItem> fixedExpenses = new ArrayList<>();
  private List<LineItem> categories = new ArrayList<>();

  public PersonBudget(String name) {
    this.name = name;
  }

  public List<LineItem> lines(LineKind kind) {
    return switch (kind) {
      case INCOME -> incomeSources;
      case FIXED_EXPENSE -> fixedExpenses;
      case CATEGORY -> categories;
    };
  }

  public PersonBudget copy() {
    PersonBudget copy = new PersonBudget(name);
    incomeSources.forEach(line -> copy.incomeSources.add(line.copy()));
    fixedExpenses.forEach(line -> copy.fixedExpenses.add(line.copy()));
    categories.forEach(line -> copy.categories.add(line.copy()));
    return copy;
  }
}
