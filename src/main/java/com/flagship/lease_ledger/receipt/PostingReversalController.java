package com.flagship.lease_ledger.receipt;

import com.flagship.lease_ledger.ledger.dto.ReversalResponse;
import com.flagship.lease_ledger.observability.CorrelationContext;
import com.flagship.lease_ledger.receipt.dto.ReversalRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Reverses a posted voucher by any of its posting lines.
 */
@RestController
@RequiredArgsConstructor
public class PostingReversalController {

    private final ReceiptService receiptService;

    @PostMapping("/api/postings/{postingId}/reversal")
    public ResponseEntity<ReversalResponse> reverse(@PathVariable("postingId") UUID postingId,
                                                    @Valid @RequestBody ReversalRequest request,
                                                    @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ReversalResponse.from(
            receiptService.reversePosting(postingId, request.getReason(), request.getReversalDate(), actor)));
    }
}
