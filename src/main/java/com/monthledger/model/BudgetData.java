package com.monthledger.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Everything the household records for one calendar month.
 */
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode
@ToString
public class BudgetData {
  private PersonBudget person1 = new PersonBudget();
  private PersonBudget person2 = new PersonBudget();
  private JointAccount jointAccount = new JointAccount();
  private String person1UserId;
  private String person2UserId;

  public PersonBudget person(PersonSlot slot) {
    return slot == PersonSlot.PERSON1 ? person1 : person2;
  }

  public String userId(PersonSlot slot) {
    return slot == PersonSlot.PERSON1 ? person1UserId : person2UserId;
  }

  public void linkUser(PersonSlot slot, String userId) {
    if (slot == PersonSlot.PERSON1) {
      person1UserId = userId;
    } else {
      person2UserId = userId;
    }
  }

  public BudgetData copy() {
    BudgetData copy = new BudgetData();
    copy.person1 = person1.copy();
    copy.person2 = person2.copy();
    copy.jointAccount = jointAccount.copy();
    copy.person1UserId = person1UserId;
    copy.person2UserId = person2UserId;
    return copy;
  }
}
