package com.monthledger.ledger;

import com.monthledger.model.LineItem;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Fields that forward propagation keeps in step across months. Paid state and the propagate
 * flag are per-copy and deliberately absent.
 */
public enum PropagatedField {
  NAME(LineItem::getName, (from, to) -> to.setName(from.getName())),
  AMOUNT(line -> Amounts.canonical(line.getAmount()), (from, to) -> to.setAmount(from.getAmount())),
  CATEGORY_OVERRIDE(LineItem::getCategoryOverrideId, (from, to) -> to.setCategoryOverrideId(from.getCategoryOverrideId())),
  ICON(LineItem::getIcon, (from, to) -> to.setIcon(from.getIcon())),
  DATE(LineItem::getDate, (from, to) -> to.setDate(from.getDate())),
  ACCOUNT(LineItem::getAccount, (from, to) -> to.setAccount(from.getAccount())),
  RECURRENCE(
      line -> List.of(line.isRecurring(),
          Objects.toString(line.getRecurringMonths(), ""),
          Objects.toString(line.getStartMonth(), "")),
      (from, to) -> {
        to.setRecurring(from.isRecurring());
        to.setRecurringMonths(from.getRecurringMonths());
        to.setStartMonth(from.getStartMonth());
      });

  private final Function<LineItem, Object> reader;
  private final BiConsumer<LineItem, LineItem> writer;

  PropagatedField(Function<LineItem, Object> reader, BiConsumer<LineItem, LineItem> writer) {
    this.reader = reader;
    this.writer = writer;
  }

  public boolean differs(LineItem left, LineItem right) {
    return !Objects.equals(reader.apply(left), reader.apply(right));
  }

  public void copy(LineItem from, LineItem to) {
    writer.accept(from, to);
  }

  public static Set<PropagatedField> changedBetween(LineItem before, LineItem after) {
    Set<PropagatedField> changed = EnumSet.noneOf(PropagatedField.class);
    for (PropagatedField field : values()) {
      if (field.differs(before, after)) {
        changed.add(field);
      }
    }
    return changed;
  }

  public static boolean anyDiffers(LineItem left, LineItem right, Set<PropagatedField> fields) {
    return fields.stream().anyMatch(field -> field.differs(left, right));
  }

  public static void copyAll(LineItem from, LineItem to, Set<PropagatedField> fields) {
    fields.forEach(field -> field.copy(from, to));
  }
}
