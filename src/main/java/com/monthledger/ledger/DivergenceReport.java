package com.monthledger.ledger;

import java.util.List;
import java.util.Set;

public record DivergenceReport(
    String sourceMonth,
    String templateId,
    List<String> divergedMonths,
    Set<PropagatedField> fields
) {}
