package mta.eda.receipts.model.status;

public enum StatusEventType {
    PROGRESS,
    ACTIVITY
}
