package com.flagship.lease_ledger.receipt;

import com.flagship.lease_ledger.document.DocumentRef;
import com.flagship.lease_ledger.exception.DocumentNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges {@link Receipt} and {@link ReceiptEntity}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReceiptPersistenceService {

    private final ReceiptRepository receiptRepository;

    @Transactional
    public Receipt save(Receipt receipt, String idempotencyKey) {
        ReceiptEntity saved = receiptRepository.saveAndFlush(ReceiptEntity.fromDomain(receipt, idempotencyKey));
        log.debug("Saved receipt {} with idempotency key {}", saved.getId(), idempotencyKey);
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Receipt> findById(UUID receiptId) {
        return receiptRepository.findById(receiptId).map(ReceiptEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Receipt> findByIdempotencyKey(String idempotencyKey) {
        return receiptRepository.findByIdempotencyKey(idempotencyKey).map(ReceiptEntity::toDomain);
    }

    /**
     * Loads and row-locks a receipt for the rest of the caller's transaction.
     *
     * @throws DocumentNotFoundException if the receipt does not exist
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Receipt lock(UUID receiptId) {
        return receiptRepository.findByIdForUpdate(receiptId)
            .map(ReceiptEntity::toDomain)
            .orElseThrow(() -> new DocumentNotFoundException(DocumentRef.receipt(receiptId)));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Receipt> tryLock(UUID receiptId) {
        return receiptRepository.findByIdForUpdate(receiptId).map(ReceiptEntity::toDomain);
    }

    /**
     * Writes a changed receipt. The receipt must carry the version it was loaded with; a
     * mismatch means someone else wrote first.
     */
    @Transactional
    public Receipt update(Receipt receipt) {
        ReceiptEntity existing = receiptRepository.findById(receipt.getId())
            .orElseThrow(() -> new DocumentNotFoundException(receipt.ref()));
        if (!Objects.equals(existing.getVersion(), receipt.getVersion())) {
            throw new ObjectOptimisticLockingFailureException(ReceiptEntity.class, receipt.getId());
        }

        existing.updateFromDomain(receipt);
        ReceiptEntity updated = receiptRepository.saveAndFlush(existing);
        log.debug("Updated receipt {} to version {}", updated.getId(), updated.getVersion());
        return updated.toDomain();
    }

    @Transactional
    public void delete(Receipt receipt) {
        receiptRepository.deleteById(receipt.getId());
        log.debug("Deleted receipt {}", receipt.getId());
    }
}
