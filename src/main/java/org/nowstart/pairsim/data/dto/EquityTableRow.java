package org.nowstart.pairsim.data.dto;

import java.time.LocalDate;
import java.util.Map;

public record EquityTableRow(
        LocalDate date,
        Map<String, Double> equityByVariant,
        Map<String, Integer> openPositionsByVariant
) {}
