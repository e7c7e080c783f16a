package com.flagship.lease_ledger.exception;

/**
 * Malformed or out-of-range input: a negative amount, an inverted date range, a blank reason.
 * Raised before any state is touched.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}
