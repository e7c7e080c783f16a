package com.flagship.lease_ledger.contract;

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
 * Bridges {@link Contract} and {@link ContractEntity}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContractPersistenceService {

    private final ContractRepository contractRepository;

    @Transactional
    public Contract save(Contract contract) {
        ContractEntity saved = contractRepository.saveAndFlush(ContractEntity.fromDomain(contract));
        log.debug("Saved contract {} with {} line items", saved.getId(), saved.getLineItems().size());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Contract> findById(UUID contractId) {
        return contractRepository.findById(contractId).map(ContractEntity::toDomain);
    }

    /**
     * @throws DocumentNotFoundException if the contract does not exist
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Contract lock(UUID contractId) {
        return contractRepository.findByIdForUpdate(contractId)
            .map(ContractEntity::toDomain)
            .orElseThrow(() -> new DocumentNotFoundException(DocumentRef.contract(contractId)));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Contract> tryLock(UUID contractId) {
        return contractRepository.findByIdForUpdate(contractId).map(ContractEntity::toDomain);
    }

    @Transactional
    public Contract update(Contract contract) {
        ContractEntity existing = contractRepository.findById(contract.getId())
            .orElseThrow(() -> new DocumentNotFoundException(contract.ref()));
        if (!Objects.equals(existing.getVersion(), contract.getVersion())) {
            throw new ObjectOptimisticLockingFailureException(ContractEntity.class, contract.getId());
        }

        existing.updateFromDomain(contract);
        ContractEntity updated = contractRepository.saveAndFlush(existing);
        log.debug("Updated contract {} to version {}", updated.getId(), updated.getVersion());
        return updated.toDomain();
    }

    @Transactional
    public void delete(Contract contract) {
        contractRepository.deleteById(contract.getId());
        log.debug("Deleted contract {}", contract.getId());
    }
}
