package com.flagship.lease_ledger.exception;

public class NotPostedException extends IllegalStateException {

    public NotPostedException(String message) {
        super(message);
    }
}
