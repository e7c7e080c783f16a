package com.flagship.lease_ledger.receipt;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ReceiptRepository extends JpaRepository<ReceiptEntity, UUID> {

    Optional<ReceiptEntity> findByIdempotencyKey(String idempotencyKey);

    /**
     * Loads a receipt with a row lock held until the surrounding transaction ends.
     * Every mutating operation goes through here so concurrent edits of one receipt serialize.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM ReceiptEntity r WHERE r.id = :id")
    Optional<ReceiptEntity> findByIdForUpdate(@Param("id") UUID id);
}
