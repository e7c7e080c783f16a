package com.flagship.lease_ledger.contract;

import com.flagship.lease_ledger.contract.dto.ContractRequest;
import com.flagship.lease_ledger.contract.dto.ContractResponse;
import com.flagship.lease_ledger.contract.dto.FieldChangeRequest;
import com.flagship.lease_ledger.contract.dto.InstallmentResponse;
import com.flagship.lease_ledger.contract.dto.LineItemRequest;
import com.flagship.lease_ledger.document.dto.ApprovalDecisionRequest;
import com.flagship.lease_ledger.document.dto.BulkApprovalRequest;
import com.flagship.lease_ledger.document.dto.BulkResultResponse;
import com.flagship.lease_ledger.observability.CorrelationContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
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
 * REST endpoints for contracts and their line items.
 */
@RestController
@RequestMapping("/api/contracts")
@RequiredArgsConstructor
@Slf4j
public class ContractController {

    private final ContractService contractService;

    @PostMapping
    public ResponseEntity<ContractResponse> createContract(@Valid @RequestBody ContractRequest request,
                                                           @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {
        log.info("Received contract creation request: contractNo={}, lines={}",
                request.getContractNo(), request.getLineItems() == null ? 0 : request.getLineItems().size());
        Contract created = contractService.create(request.toDetails(), request.toLineItems(), actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(ContractResponse.from(created));
    }

    @GetMapping("/{id}")
    public ContractResponse getContract(@PathVariable("id") UUID id) {
        return ContractResponse.from(contractService.get(id));
    }

    @PutMapping("/{id}")
    public ContractResponse updateContract(@PathVariable("id") UUID id,
                                           @Valid @RequestBody ContractRequest request,
                                           @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {
        return ContractResponse.from(contractService.updateDetails(id, request.toDetails(), actor));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteContract(@PathVariable("id") UUID id,
                                               @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {
        contractService.delete(id, actor);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/line-items")
    public ResponseEntity<ContractResponse> addLineItem(@PathVariable("id") UUID id,
                                                        @Valid @RequestBody LineItemRequest request,
                                                        @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ContractResponse.from(contractService.addLineItem(id, request.toDomain(), actor)));
    }

    @PatchMapping("/{id}/line-items/{lineItemId}")
    public ContractResponse recalculateLineItem(@PathVariable("id") UUID id,
                                                @PathVariable("lineItemId") UUID lineItemId,
                                                @Valid @RequestBody FieldChangeRequest request,
                                                @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {
        return ContractResponse.from(
            contractService.recalculateLineItem(id, lineItemId, request.getField(), request.getValue(), actor));
    }

    @DeleteMapping("/{id}/line-items/{lineItemId}")
    public ContractResponse removeLineItem(@PathVariable("id") UUID id,
                                           @PathVariable("lineItemId") UUID lineItemId,
                                           @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {
        return ContractResponse.from(contractService.removeLineItem(id, lineItemId, actor));
    }

    @GetMapping("/{id}/line-items/{lineItemId}/installments")
    public List<InstallmentResponse> installments(@PathVariable("id") UUID id,
                                                  @PathVariable("lineItemId") UUID lineItemId) {
        return contractService.installments(id, lineItemId).stream().map(InstallmentResponse::from).toList();
    }

    @PostMapping("/{id}/approval/submit")
    public ContractResponse submit(@PathVariable("id") UUID id,
                                   @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {
        return ContractResponse.from(contractService.submit(id, actor));
    }

    @PostMapping("/{id}/approval/approve")
    public ContractResponse approve(@PathVariable("id") UUID id,
                                    @RequestBody(required = false) ApprovalDecisionRequest request,
                                    @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {
        String comment = request != null ? request.getComment() : null;
        return ContractResponse.from(contractService.approve(id, actor, comment));
    }

    @PostMapping("/{id}/approval/reject")
    public ContractResponse reject(@PathVariable("id") UUID id,
                                   @RequestBody(required = false) ApprovalDecisionRequest request,
                                   @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {
        String reason = request != null ? request.getReason() : null;
        return ContractResponse.from(contractService.reject(id, actor, reason));
    }

    @PostMapping("/{id}/approval/reset")
    public ContractResponse reset(@PathVariable("id") UUID id,
                                  @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {
        return ContractResponse.from(contractService.reset(id, actor));
    }

    @PostMapping("/approval/bulk")
    public BulkResultResponse bulkApproval(@Valid @RequestBody BulkApprovalRequest request,
                                           @RequestHeader(CorrelationContext.ACTOR_HEADER) String actor) {
        return BulkResultResponse.from(
            contractService.bulkApproval(request.getIds(), request.getAction(), request.getText(), actor));
    }
}
