package com.flagship.lease_ledger.exception;

/**
 * A status or lifecycle change that is not permitted from the current state.
 */
public class IllegalTransitionException extends IllegalStateException {

    public IllegalTransitionException(String message) {
        super(message);
    }
}
