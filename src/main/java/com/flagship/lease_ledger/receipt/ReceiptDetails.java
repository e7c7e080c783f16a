package com.flagship.lease_ledger.receipt;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * User-editable receipt fields, used for creation and for edits.
 */
@Value
@Builder(toBuilder = true)
public class ReceiptDetails {
    String receiptNo;
    String customerRef;
    LocalDate receiptDate;
    PaymentType paymentType;
    String chequeNo;
    String notes;
    BigDecimal receivedAmount;
    BigDecimal securityDeposit;
    BigDecimal penalty;
    BigDecimal discount;

    /**
     * Only read on creation: PENDING or RECEIVED, RECEIVED when absent.
     */
    PaymentStatus initialStatus;
}
