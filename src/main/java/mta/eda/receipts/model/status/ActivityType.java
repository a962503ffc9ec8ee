package mta.eda.receipts.model.status;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ActivityType {
    INFO,
    SUCCESS,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
