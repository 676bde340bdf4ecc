package org.nowstart.pairsim.data.exception;

import java.time.LocalDate;
import lombok.Getter;

@Getter
public class SignalValidationException extends RuntimeException {

    private final String code;
    private final LocalDate date;
    private final String pairId;
    private final String field;

    public SignalValidationException(String code, LocalDate date, String pairId, String field, String message) {
        super(message + " (date=" + date + ", pairId=" + pairId + ", field=" + field + ")");
        this.code = code;
        this.date = date;
        this.pairId = pairId;
        this.field = field;
    }

    public SignalValidationException(String code, String field, String message, Throwable cause) {
        super(message + " (field=" + field + ")", cause);
        this.code = code;
        this.date = null;
        this.pairId = null;
        this.field = field;
    }

}
