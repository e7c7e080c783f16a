package com.flagship.lease_ledger.approval;

import com.flagship.lease_ledger.config.LeaseLedgerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Capabilities from {@code lease.approval.approvers.*}. An actor listed under an action may
 * perform it; "*" grants the action to everyone.
 */
@Component
@RequiredArgsConstructor
public class ConfiguredActorAuthorization implements ActorAuthorization {

    private static final String ANY_ACTOR = "*";

    private final LeaseLedgerProperties properties;

    @Override
    public boolean isAuthorized(String actor, ApprovalAction action) {
        if (actor == null || actor.isBlank()) {
            return false;
        }
        LeaseLedgerProperties.Approvers approvers = properties.getApproval().getApprovers();
        List<String> allowed;
        switch (action) {
            case APPROVE:
                allowed = approvers.getApprove();
                break;
            case REJECT:
                allowed = approvers.getReject();
                break;
            case RESET:
                allowed = approvers.getReset();
                break;
            default:
                throw new IllegalStateException("Unhandled approval action " + action);
        }
        return allowed.contains(ANY_ACTOR) || allowed.contains(actor);
    }
}
