package org.nowstart.pairsim.data.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One date x pair observation produced by the feature and prediction pipeline.
 *
 * @param date            trading date, timezone-naive
 * @param pairId          stable pair identifier
 * @param zScore          spread Z-score, NaN when the rolling window is not yet filled
 * @param spreadPrice     spread level, NaN when unknown
 * @param predictions     model column to prediction value in [0, 1], in input column order
 * @param targetReturn    realized forward return over the label horizon
 * @param targetDirection 1 when the forward return is positive, 0 otherwise, {@link #UNKNOWN_DIRECTION} when unlabelled
 */
public record SignalRow(
        @NotNull LocalDate date,
        @NotBlank String pairId,
        double zScore,
        double spreadPrice,
        @NotNull Map<String, Double> predictions,
        double targetReturn,
        @Min(-1) @Max(1) int targetDirection
) {
    public static final int UNKNOWN_DIRECTION = -1;

    public SignalRow {
        predictions = predictions == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(predictions));
    }

    public double prediction(String column) {
        Double value = predictions == null ? null : predictions.get(column);
        return value == null ? Double.NaN : value;
    }

    public boolean hasZScore() {
        return Double.isFinite(zScore);
    }

    public boolean hasSpreadPrice() {
        return Double.isFinite(spreadPrice) && spreadPrice != 0.0;
    }

    public boolean hasTargetDirection() {
        return targetDirection == 0 || targetDirection == 1;
    }

    public boolean hasTargetOutcome() {
        return Double.isFinite(targetReturn) && hasTargetDirection();
    }
}
