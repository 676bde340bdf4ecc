package org.nowstart.pairsim.service;

import java.util.List;
import org.nowstart.pairsim.data.dto.EquityPoint;
import org.nowstart.pairsim.data.dto.PerformanceStats;
import org.nowstart.pairsim.data.dto.SimulationResult;
import org.nowstart.pairsim.data.dto.TradeRecord;
import org.springframework.stereotype.Service;

@Service
public class PerformanceAnalysisService {

    public PerformanceStats analyze(SimulationResult result) {
        List<EquityPoint> curve = result.equityCurve();
        double initial = result.initialCapital();
        double finalEquity = result.finalEquity();

        double maxEquity = Math.max(initial, finalEquity);
        double minEquity = Math.min(initial, finalEquity);
        for (EquityPoint point : curve) {
            maxEquity = Math.max(maxEquity, point.equity());
            minEquity = Math.min(minEquity, point.equity());
        }

        int wins = 0;
        int losses = 0;
        int exits = 0;
        double winSum = 0.0;
        double lossSum = 0.0;
        double totalPnl = 0.0;
        for (TradeRecord trade : result.trades()) {
            if (!trade.isExit()) {
                continue;
            }
            exits++;
            double pnl = trade.realizedPnl();
            totalPnl += pnl;
            if (pnl > 0.0) {
                wins++;
                winSum += pnl;
            } else if (pnl < 0.0) {
                losses++;
                lossSum += pnl;
            }
        }

        return new PerformanceStats(
                result.variant(),
                finalEquity,
                (finalEquity - initial) / initial * 100.0,
                maxEquity,
                minEquity,
                maxDrawdownPct(initial, curve, finalEquity),
                exits,
                wins,
                losses,
                exits > 0 ? wins * 100.0 / exits : 0.0,
                wins > 0 ? winSum / wins : 0.0,
                losses > 0 ? lossSum / losses : 0.0,
                totalPnl
        );
    }

    // final equity is post-drain and is not on the curve
    private double maxDrawdownPct(double initial, List<EquityPoint> curve, double finalEquity) {
        double peak = initial;
        double mdd = 0.0;
        for (EquityPoint point : curve) {
            peak = Math.max(peak, point.equity());
            mdd = Math.min(mdd, drawdown(peak, point.equity()));
        }
        peak = Math.max(peak, finalEquity);
        mdd = Math.min(mdd, drawdown(peak, finalEquity));
        return mdd * 100.0;
    }

    private double drawdown(double peak, double equity) {
        return peak > 0.0 ? equity / peak - 1.0 : 0.0;
    }
}
