package com.monthledger.ledger;

@FunctionalInterface
public interface DivergenceResolver {
  DivergenceResolver DECLINE = report -> false;

  /**
   * @return {@code true} to overwrite every diverged copy listed in the report
   */
  boolean shouldOverwrite(DivergenceReport report);
}
