package mta.eda.receipts.model;

import mta.eda.receipts.exception.InvalidModelException;

/**
 * Construction-time checks shared by the model records.
 */
public final class ModelValidation {

    private ModelValidation() {}

    public static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidModelException(field + " is required and must not be blank");
        }
        return value;
    }

    public static <T> T requirePresent(T value, String field) {
        if (value == null) {
            throw new InvalidModelException(field + " is required");
        }
        return value;
    }

    public static double requireNonNegative(double value, String field) {
        if (Double.isNaN(value) || value < 0) {
            throw new InvalidModelException(field + " must be zero or positive, got " + value);
        }
        return value;
    }

    public static int requireNonNegative(int value, String field) {
        if (value < 0) {
            throw new InvalidModelException(field + " must be zero or positive, got " + value);
        }
        return value;
    }

    public static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
