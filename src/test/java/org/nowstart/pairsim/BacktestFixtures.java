package org.nowstart.pairsim;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.nowstart.pairsim.data.dto.SignalRow;
import org.nowstart.pairsim.data.property.BacktestProperties;
import org.nowstart.pairsim.data.type.SimulationMode;

public final class BacktestFixtures {

    private BacktestFixtures() {
    }

    public static PropertiesBuilder properties() {
        return new PropertiesBuilder();
    }

    public static SignalRow priceRow(LocalDate date, String pairId, double zScore, double spread, double prediction) {
        return new SignalRow(date, pairId, zScore, spread, Map.of("Ridge_Pred", prediction), Double.NaN, SignalRow.UNKNOWN_DIRECTION);
    }

    public static SignalRow outcomeRow(LocalDate date, String pairId, double zScore, double prediction, double targetReturn, int targetDirection) {
        return new SignalRow(date, pairId, zScore, Double.NaN, Map.of("Ridge_Pred", prediction), targetReturn, targetDirection);
    }

    public static SignalRow row(
            LocalDate date,
            String pairId,
            double zScore,
            double spread,
            Map<String, Double> predictions,
            double targetReturn,
            int targetDirection
    ) {
        return new SignalRow(date, pairId, zScore, spread, new LinkedHashMap<>(predictions), targetReturn, targetDirection);
    }

    public static final class PropertiesBuilder {

        private SimulationMode mode = SimulationMode.SPREAD_PRICE;
        private Double initialCapital = 10_000.0;
        private Double positionRiskPct = 0.02;
        private Double capitalPerTrade;
        private Integer maxPositions = 3;
        private Double transactionCostPct = 0.0;
        private Double commission = 0.0;
        private Double slippagePct = 0.0;
        private Double spreadPct = 0.0;
        private Double annualBorrowRate = 0.0;
        private Double confidence = 0.55;
        private Integer holdPeriod = 10;
        private List<String> variants = List.of("Ridge:Ridge_Pred");
        private Integer variantParallelism = 1;
        private String signalsCsv;
        private String outputDir;

        public PropertiesBuilder mode(SimulationMode value) {
            this.mode = value;
            return this;
        }

        public PropertiesBuilder initialCapital(double value) {
            this.initialCapital = value;
            return this;
        }

        public PropertiesBuilder positionRiskPct(double value) {
            this.positionRiskPct = value;
            return this;
        }

        public PropertiesBuilder capitalPerTrade(Double value) {
            this.capitalPerTrade = value;
            return this;
        }

        public PropertiesBuilder maxPositions(int value) {
            this.maxPositions = value;
            return this;
        }

        public PropertiesBuilder transactionCostPct(double value) {
            this.transactionCostPct = value;
            return this;
        }

        public PropertiesBuilder commission(double value) {
            this.commission = value;
            return this;
        }

        public PropertiesBuilder slippagePct(double value) {
            this.slippagePct = value;
            return this;
        }

        public PropertiesBuilder spreadPct(double value) {
            this.spreadPct = value;
            return this;
        }

        public PropertiesBuilder annualBorrowRate(double value) {
            this.annualBorrowRate = value;
            return this;
        }

        public PropertiesBuilder confidence(double value) {
            this.confidence = value;
            return this;
        }

        public PropertiesBuilder holdPeriod(int value) {
            this.holdPeriod = value;
            return this;
        }

        public PropertiesBuilder variants(String... values) {
            this.variants = List.of(values);
            return this;
        }

        public PropertiesBuilder variantParallelism(int value) {
            this.variantParallelism = value;
            return this;
        }

        public PropertiesBuilder signalsCsv(String value) {
            this.signalsCsv = value;
            return this;
        }

        public PropertiesBuilder outputDir(String value) {
            this.outputDir = value;
            return this;
        }

        public BacktestProperties build() {
            return new BacktestProperties(
                    true,
                    signalsCsv,
                    outputDir,
                    mode,
                    initialCapital,
                    positionRiskPct,
                    capitalPerTrade,
                    maxPositions,
                    1.1,
                    transactionCostPct,
                    commission,
                    slippagePct,
                    spreadPct,
                    annualBorrowRate,
                    1.5,
                    0.5,
                    confidence,
                    holdPeriod,
                    variants,
                    variantParallelism
            );
        }
    }
}
