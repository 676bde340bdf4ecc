package org.nowstart.pairsim.data.property;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.nowstart.pairsim.data.type.SimulationMode;
import org.nowstart.pairsim.strategy.StrategyVariant;
import org.springframework.boot.context.properties.ConfigurationProperties;

@SuppressWarnings("ConfigurationProperties")
@ConfigurationProperties(prefix = "pairsim.backtest")
public record BacktestProperties(
        Boolean enabled,
        String signalsCsv,
        String outputDir,
        SimulationMode mode,
        Double initialCapital,
        Double positionRiskPct,
        Double capitalPerTrade,
        Integer maxPositions,
        Double capitalBufferFactor,
        Double transactionCostPct,
        Double commission,
        Double slippagePct,
        Double spreadPct,
        Double annualBorrowRate,
        Double entryZThreshold,
        Double exitZThreshold,
        Double modelConfidenceThreshold,
        Integer holdPeriod,
        List<String> variants,
        Integer variantParallelism
) {
    private static final String DEFAULT_SIGNALS_CSV = "data/model_predictions.csv";
    private static final String DEFAULT_OUTPUT_DIR = "outputs/backtest";
    private static final double DEFAULT_OUTCOME_CAPITAL_PER_TRADE = 1000.0;
    private static final double BINARY_LABEL_CONFIDENCE = 0.5;
    private static final List<String> DEFAULT_VARIANTS = List.of(
            "Ridge:Ridge_Pred",
            "LSTM:LSTM_Pred",
            "Hybrid:Ridge_Pred+LSTM_Pred"
    );
    private static final int DEFAULT_VARIANT_PARALLELISM = Math.max(1, Runtime.getRuntime().availableProcessors());

    public BacktestProperties {
        enabled = enabled != null ? enabled : true;
        signalsCsv = normalizePath(signalsCsv, DEFAULT_SIGNALS_CSV);
        outputDir = normalizePath(outputDir, DEFAULT_OUTPUT_DIR);
        mode = mode != null ? mode : SimulationMode.SPREAD_PRICE;
        initialCapital = initialCapital != null ? initialCapital : 10_000.0;
        positionRiskPct = positionRiskPct != null ? positionRiskPct : 0.02;
        if (capitalPerTrade == null && mode == SimulationMode.TARGET_OUTCOME) {
            capitalPerTrade = DEFAULT_OUTCOME_CAPITAL_PER_TRADE;
        }
        maxPositions = maxPositions != null ? maxPositions : 3;
        capitalBufferFactor = capitalBufferFactor != null ? capitalBufferFactor : 1.1;
        transactionCostPct = transactionCostPct != null ? transactionCostPct : 0.004;
        commission = commission != null ? commission : 1.0;
        slippagePct = slippagePct != null ? slippagePct : 0.0005;
        spreadPct = spreadPct != null ? spreadPct : 0.0005;
        annualBorrowRate = annualBorrowRate != null ? annualBorrowRate : 0.03;
        entryZThreshold = entryZThreshold != null ? entryZThreshold : 1.5;
        exitZThreshold = exitZThreshold != null ? exitZThreshold : 0.5;
        modelConfidenceThreshold = modelConfidenceThreshold != null ? modelConfidenceThreshold : 0.55;
        holdPeriod = holdPeriod != null ? holdPeriod : 10;
        variants = variants != null && !variants.isEmpty() ? List.copyOf(variants) : DEFAULT_VARIANTS;
        variantParallelism = variantParallelism != null ? variantParallelism : DEFAULT_VARIANT_PARALLELISM;

        if (!(initialCapital > 0.0)) {
            throw new IllegalArgumentException("initial-capital must be > 0");
        }
        if (!(positionRiskPct > 0.0 && positionRiskPct <= 1.0)) {
            throw new IllegalArgumentException("position-risk-pct must be in (0, 1]");
        }
        if (capitalPerTrade != null && !(capitalPerTrade > 0.0)) {
            throw new IllegalArgumentException("capital-per-trade must be > 0");
        }
        if (maxPositions <= 0) {
            throw new IllegalArgumentException("max-positions must be > 0");
        }
        if (!(capitalBufferFactor >= 1.0)) {
            throw new IllegalArgumentException("capital-buffer-factor must be >= 1");
        }
        if (!(transactionCostPct >= 0.0 && transactionCostPct < 1.0)) {
            throw new IllegalArgumentException("transaction-cost-pct must be in [0, 1)");
        }
        if (!(commission >= 0.0) || !(slippagePct >= 0.0) || !(spreadPct >= 0.0) || !(annualBorrowRate >= 0.0)) {
            throw new IllegalArgumentException("commission, slippage-pct, spread-pct and annual-borrow-rate must be >= 0");
        }
        if (!(entryZThreshold > 0.0)) {
            throw new IllegalArgumentException("entry-z-threshold must be > 0");
        }
        if (!(exitZThreshold >= 0.0 && exitZThreshold < entryZThreshold)) {
            throw new IllegalArgumentException("exit-z-threshold must be >= 0 and < entry-z-threshold");
        }
        if (!(modelConfidenceThreshold >= 0.5 && modelConfidenceThreshold < 1.0)) {
            throw new IllegalArgumentException("model-confidence-threshold must be in [0.5, 1)");
        }
        if (holdPeriod <= 0) {
            throw new IllegalArgumentException("hold-period must be > 0");
        }
        if (variantParallelism <= 0) {
            throw new IllegalArgumentException("variant-parallelism must be > 0");
        }
    }

    /**
     * Returns the sizing used for a new entry given the ledger's current realized equity.
     */
    public double resolveCapitalPerTrade(double realizedEquity) {
        if (capitalPerTrade != null) {
            return capitalPerTrade;
        }
        return realizedEquity * positionRiskPct;
    }

    /**
     * Confidence applied to prediction values. Outcome mode reads binary labels, so only the price
     * mode uses the configured threshold.
     */
    public double effectiveConfidence() {
        return mode == SimulationMode.SPREAD_PRICE ? modelConfidenceThreshold : BINARY_LABEL_CONFIDENCE;
    }

    public List<StrategyVariant> resolveVariants() {
        List<StrategyVariant> out = new ArrayList<>(variants.size());
        Set<String> names = new LinkedHashSet<>();
        for (String raw : variants) {
            StrategyVariant variant = parseVariant(raw);
            if (!names.add(variant.name().toLowerCase(Locale.ROOT))) {
                throw new IllegalArgumentException("duplicate variant name: " + variant.name());
            }
            out.add(variant);
        }
        return List.copyOf(out);
    }

    public Set<String> resolvePredictionColumns() {
        Set<String> columns = new LinkedHashSet<>();
        for (StrategyVariant variant : resolveVariants()) {
            columns.addAll(variant.modelColumns());
        }
        return Collections.unmodifiableSet(columns);
    }

    private static StrategyVariant parseVariant(String raw) {
        String entry = raw == null ? "" : raw.trim();
        int separator = entry.indexOf(':');
        if (separator <= 0 || separator == entry.length() - 1) {
            throw new IllegalArgumentException("variants entry must be name:Column[+Column...] but was: " + raw);
        }
        String name = entry.substring(0, separator).trim();
        List<String> columns = new ArrayList<>();
        for (String column : entry.substring(separator + 1).split("\\+", -1)) {
            String trimmed = column.trim();
            if (trimmed.isEmpty()) {
                throw new IllegalArgumentException("variants entry has an empty model column: " + raw);
            }
            columns.add(trimmed);
        }
        return new StrategyVariant(name, columns);
    }

    private static String normalizePath(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return raw.trim();
    }
}
