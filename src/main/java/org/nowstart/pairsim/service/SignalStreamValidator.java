package org.nowstart.pairsim.service;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.pairsim.data.dto.SignalRow;
import org.nowstart.pairsim.data.exception.SignalValidationException;
import org.nowstart.pairsim.data.property.BacktestProperties;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class SignalStreamValidator {

    private final Validator validator;

    public void validate(List<SignalRow> rows, BacktestProperties properties) {
        Set<String> predictionColumns = properties.resolvePredictionColumns();
        Set<RowKey> seen = new HashSet<>();
        Set<String> pairs = new HashSet<>();
        LocalDate previous = null;

        for (SignalRow row : rows) {
            if (row == null) {
                throw new SignalValidationException("invalid_row", null, null, "row", "Signal stream contains a null row");
            }
            Set<ConstraintViolation<SignalRow>> violations = validator.validate(row);
            if (!violations.isEmpty()) {
                ConstraintViolation<SignalRow> violation = violations.iterator().next();
                throw new SignalValidationException(
                        "invalid_row",
                        row.date(),
                        row.pairId(),
                        violation.getPropertyPath().toString(),
                        violation.getMessage()
                );
            }

            for (String column : predictionColumns) {
                double value = row.prediction(column);
                if (!(value >= 0.0 && value <= 1.0)) {
                    throw new SignalValidationException("invalid_prediction", row.date(), row.pairId(), column,
                            "Prediction must be within [0, 1] but was " + value);
                }
            }

            if (!seen.add(new RowKey(row.date(), row.pairId()))) {
                throw new SignalValidationException("duplicate_row", row.date(), row.pairId(), "pairId",
                        "Pair appears more than once on the same date");
            }
            if (previous != null && row.date().isBefore(previous)) {
                throw new SignalValidationException("unordered_stream", row.date(), row.pairId(), "date",
                        "Rows must be sorted by date");
            }
            previous = row.date();
            pairs.add(row.pairId());
        }

        log.info("event=signals_validated rows={} pairs={} predictionColumns={}", rows.size(), pairs.size(), predictionColumns);
    }

    private record RowKey(LocalDate date, String pairId) {
    }
}
