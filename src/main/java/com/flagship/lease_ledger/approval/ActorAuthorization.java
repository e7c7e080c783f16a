package com.flagship.lease_ledger.approval;

/**
 * Decides whether an actor holds the capability for an approval action.
 */
public interface ActorAuthorization {

    boolean isAuthorized(String actor, ApprovalAction action);
}
