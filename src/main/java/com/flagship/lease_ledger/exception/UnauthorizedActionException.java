package com.flagship.lease_ledger.exception;

import lombok.Getter;

@Getter
public class UnauthorizedActionException extends RuntimeException {

    private final String actor;
    private final String action;

    public UnauthorizedActionException(String actor, String action) {
        super(String.format("Actor '%s' is not authorized to %s", actor, action));
        this.actor = actor;
        this.action = action;
    }
}
