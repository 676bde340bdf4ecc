package org.nowstart.pairsim.strategy;

import java.util.List;
import java.util.Optional;
import org.nowstart.pairsim.data.dto.SignalRow;
import org.nowstart.pairsim.data.type.Direction;

/**
 * A named entry rule over one or more prediction columns. With more than one column every model
 * has to agree on the direction (consensus).
 */
public record StrategyVariant(
        String name,
        List<String> modelColumns
) {

    public StrategyVariant {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("variant name is required");
        }
        if (modelColumns == null || modelColumns.isEmpty()) {
            throw new IllegalArgumentException("variant " + name + " needs at least one model column");
        }
        name = name.trim();
        modelColumns = List.copyOf(modelColumns);
    }

    public boolean consensus() {
        return modelColumns.size() > 1;
    }

    public boolean predictsUp(SignalRow row, double confidence) {
        for (String column : modelColumns) {
            double value = row.prediction(column);
            if (!(value > confidence)) {
                return false;
            }
        }
        return true;
    }

    public boolean predictsDown(SignalRow row, double confidence) {
        double ceiling = 1.0 - confidence;
        for (String column : modelColumns) {
            double value = row.prediction(column);
            if (!(value < ceiling)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Long when the spread is stretched low and the models call a rise, short when it is stretched
     * high and the models call a fall. NaN Z-scores never produce an entry.
     */
    public Optional<Direction> entryDirection(SignalRow row, double entryZThreshold, double confidence) {
        if (!row.hasZScore()) {
            return Optional.empty();
        }
        if (row.zScore() < -entryZThreshold && predictsUp(row, confidence)) {
            return Optional.of(Direction.LONG);
        }
        if (row.zScore() > entryZThreshold && predictsDown(row, confidence)) {
            return Optional.of(Direction.SHORT);
        }
        return Optional.empty();
    }
}
