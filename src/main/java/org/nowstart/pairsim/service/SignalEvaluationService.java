package org.nowstart.pairsim.service;

import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.pairsim.data.dto.SignalEvaluation;
import org.nowstart.pairsim.data.dto.SignalRow;
import org.nowstart.pairsim.strategy.StrategyVariant;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class SignalEvaluationService {

    private static final double BINARY_CONFIDENCE = 0.5;

    public List<SignalEvaluation> evaluate(List<SignalRow> rows, List<StrategyVariant> variants, double zThreshold) {
        List<SignalRow> longOpportunities = new ArrayList<>();
        List<SignalRow> shortOpportunities = new ArrayList<>();
        int unlabelled = 0;
        for (SignalRow row : rows) {
            if (!row.hasZScore()) {
                continue;
            }
            if (!row.hasTargetDirection()) {
                unlabelled++;
                continue;
            }
            if (row.zScore() < -zThreshold) {
                longOpportunities.add(row);
            } else if (row.zScore() > zThreshold) {
                shortOpportunities.add(row);
            }
        }
        int actionable = longOpportunities.size() + shortOpportunities.size();
        log.info("event=signal_evaluation threshold={} actionable={} unlabelled={} rows={}",
                zThreshold, actionable, unlabelled, rows.size());

        List<SignalEvaluation> out = new ArrayList<>(variants.size());
        for (StrategyVariant variant : variants) {
            out.add(evaluateVariant(variant, longOpportunities, shortOpportunities, actionable));
        }
        return List.copyOf(out);
    }

    private SignalEvaluation evaluateVariant(
            StrategyVariant variant,
            List<SignalRow> longOpportunities,
            List<SignalRow> shortOpportunities,
            int actionable
    ) {
        int longTrades = 0;
        int longWins = 0;
        for (SignalRow row : longOpportunities) {
            if (variant.predictsUp(row, BINARY_CONFIDENCE)) {
                longTrades++;
                if (row.targetDirection() == 1) {
                    longWins++;
                }
            }
        }

        int shortTrades = 0;
        int shortWins = 0;
        for (SignalRow row : shortOpportunities) {
            if (variant.predictsDown(row, BINARY_CONFIDENCE)) {
                shortTrades++;
                if (row.targetDirection() == 0) {
                    shortWins++;
                }
            }
        }

        int totalTrades = longTrades + shortTrades;
        return new SignalEvaluation(
                variant.name(),
                actionable,
                totalTrades,
                percent(longWins + shortWins, totalTrades),
                longTrades,
                percent(longWins, longTrades),
                shortTrades,
                percent(shortWins, shortTrades)
        );
    }

    private double percent(int numerator, int denominator) {
        return denominator > 0 ? numerator * 100.0 / denominator : 0.0;
    }
}
