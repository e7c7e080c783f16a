package com.flagship.lease_ledger.contract;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Contract header fields as entered.
 */
@Value
@Builder
public class ContractDetails {
    String contractNo;
    String customerRef;
    LocalDate transactionDate;
    String remarks;
}
