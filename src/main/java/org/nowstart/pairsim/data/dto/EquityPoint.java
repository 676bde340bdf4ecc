package org.nowstart.pairsim.data.dto;

import java.time.LocalDate;

public record EquityPoint(
        LocalDate date,
        double equity,
        int openPositions
) {}
