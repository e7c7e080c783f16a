package com.flagship.lease_ledger.receipt;

import com.flagship.lease_ledger.document.dto.ApprovalDecisionRequest;
import com.flagship.lease_ledger.document.dto.BulkApprovalRequest;
import com.flagship.lease_ledger.document.dto.BulkResultResponse;
import com.flagship.lease_ledger.ledger.dto.PostingResponse;
import com.flagship.lease_ledger.ledger.dto.PostingResultResponse;
import com.flagship.lease_ledger.observability.CorrelationContext;
import com.flagship.lease_ledger.receipt.dto.AllocationProposalResponse;
import com.flagship.lease_ledger.receipt.dto.AllocationRequest;
import com.flagship.lease_ledger.receipt.dto.BulkPostRequest;
import com.flagship.lease_ledger.receipt.dto.PaymentStatusRequest;
import com.flagship.lease_ledger.receipt.dto.PostReceiptRequest;
import com.flagship.lease_ledger.receipt.dto.ReceiptRequest;
import com.flagship.lease_ledger.receipt.dto.ReceiptResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST endpoints for receipts.
 *
 * Creation requires an Idempotency-Key header; a repeated key answers 200 with the receipt
 * created the first time. Every mutating call names its actor in the X-Actor header.
 */
@RestController
@RequestMapping("/api/receipts")
@RequiredArgsConstructor
@Slf4j
public class ReceiptController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final ReceiptService receiptService;

    @PostMapping
    public ResponseEntity<ReceiptResponse> createReceipt(
            @Valid @RequestBody ReceiptRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
            @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {
        log.info("Received receipt creation request: idempotencyKey={}, receiptNo={}, amount={}",
                idempotencyKey, request.getReceiptNo(), request.getReceivedAmount());

        ReceiptCreation creation = receiptService.create(request.toDetails(), idempotencyKey, actor);
        HttpStatus status = creation.isCreated() ? HttpStatus.CREATED : HttpStatus.OK;
        return ResponseEntity.status(status).body(ReceiptResponse.from(creation.getReceipt()));
    }

    @GetMapping("/{id}")
    public ReceiptResponse getReceipt(@PathVariable("id") UUID id) {
        return ReceiptResponse.from(receiptService.get(id));
    }

    @PutMapping("/{id}")
    public ReceiptResponse updateReceipt(@PathVariable("id") UUID id,
                                         @Valid @RequestBody ReceiptRequest request,
                                         @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {
        return ReceiptResponse.from(receiptService.update(id, request.toDetails(), actor));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteReceipt(@PathVariable("id") UUID id,
                                              @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {
        receiptService.delete(id, actor);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/payment-status")
    public ReceiptResponse changePaymentStatus(@PathVariable("id") UUID id,
                                               @Valid @RequestBody PaymentStatusRequest request,
                                               @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {
        return ReceiptResponse.from(receiptService.changePaymentStatus(id, request.toChange(), actor));
    }

    @PostMapping("/{id}/allocations/proposal")
    public AllocationProposalResponse proposeAllocation(@PathVariable("id") UUID id,
                                                        @Valid @RequestBody AllocationRequest request) {
        return AllocationProposalResponse.from(
            receiptService.proposeAllocation(id, request.getMode(), request.toDomain()));
    }

    @PutMapping("/{id}/allocations")
    public ReceiptResponse commitAllocation(@PathVariable("id") UUID id,
                                            @Valid @RequestBody AllocationRequest request,
                                            @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {
        return ReceiptResponse.from(
            receiptService.commitAllocation(id, request.getMode(), request.toDomain(), actor));
    }

    @PostMapping("/{id}/approval/submit")
    public ReceiptResponse submit(@PathVariable("id") UUID id,
                                  @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {
        return ReceiptResponse.from(receiptService.submit(id, actor));
    }

    @PostMapping("/{id}/approval/approve")
    public ReceiptResponse approve(@PathVariable("id") UUID id,
                                   @RequestBody(required = false) ApprovalDecisionRequest request,
                                   @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {
        String comment = request != null ? request.getComment() : null;
        return ReceiptResponse.from(receiptService.approve(id, actor, comment));
    }

    @PostMapping("/{id}/approval/reject")
    public ReceiptResponse reject(@PathVariable("id") UUID id,
                                  @RequestBody(required = false) ApprovalDecisionRequest request,
                                  @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {
        String reason = request != null ? request.getReason() : null;
        return ReceiptResponse.from(receiptService.reject(id, actor, reason));
    }

    @PostMapping("/{id}/approval/reset")
    public ReceiptResponse reset(@PathVariable("id") UUID id,
                                 @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {
        return ReceiptResponse.from(receiptService.reset(id, actor));
    }

    @PostMapping("/approval/bulk")
    public BulkResultResponse bulkApproval(@Valid @RequestBody BulkApprovalRequest request,
                                           @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {
        return BulkResultResponse.from(
            receiptService.bulkApproval(request.getIds(), request.getAction(), request.getText(), actor));
    }

    @PostMapping("/{id}/postings")
    public ResponseEntity<PostingResultResponse> post(@PathVariable("id") UUID id,
                                                      @Valid @RequestBody PostReceiptRequest request,
                                                      @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(PostingResultResponse.from(receiptService.post(id, request.toInstruction(), actor)));
    }

    @GetMapping("/{id}/postings")
    public List<PostingResponse> postings(@PathVariable("id") UUID id) {
        return receiptService.postings(id).stream().map(PostingResponse::from).toList();
    }

    @PostMapping("/postings/bulk")
    public BulkResultResponse bulkPost(@Valid @RequestBody BulkPostRequest request,
                                       @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {
        return BulkResultResponse.from(receiptService.bulkPost(request.getIds(), request.toInstruction(), actor));
    }
}
