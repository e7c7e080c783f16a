package com.flagship.lease_ledger.receipt.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.lease_ledger.receipt.PaymentStatus;
import com.flagship.lease_ledger.receipt.PaymentType;
import com.flagship.lease_ledger.receipt.ReceiptDetails;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Body of receipt create and update calls. payment_status is only read on create.
 */
@Value
public class ReceiptRequest {

    @NotBlank(message = "Receipt number is required")
    @JsonProperty("receipt_no")
    String receiptNo;

    @JsonProperty("customer_ref")
    String customerRef;

    @NotNull(message = "Receipt date is required")
    @JsonProperty("receipt_date")
    LocalDate receiptDate;

    @NotNull(message = "Payment type is required")
    @JsonProperty("payment_type")
    PaymentType paymentType;

    @JsonProperty("cheque_no")
    String chequeNo;

    @JsonProperty("notes")
    String notes;

    @NotNull(message = "Received amount is required")
    @DecimalMin(value = "0.00", message = "Received amount must not be negative")
    @JsonProperty("received_amount")
    BigDecimal receivedAmount;

    @DecimalMin(value = "0.00", message = "Security deposit must not be negative")
    @JsonProperty("security_deposit")
    BigDecimal securityDeposit;

    @DecimalMin(value = "0.00", message = "Penalty must not be negative")
    @JsonProperty("penalty")
    BigDecimal penalty;

    @DecimalMin(value = "0.00", message = "Discount must not be negative")
    @JsonProperty("discount")
    BigDecimal discount;

    @JsonProperty("payment_status")
    PaymentStatus paymentStatus;

    public ReceiptDetails toDetails() {
        return ReceiptDetails.builder()
            .receiptNo(receiptNo)
            .customerRef(customerRef)
            .receiptDate(receiptDate)
            .paymentType(paymentType)
            .chequeNo(chequeNo)
            .notes(notes)
            .receivedAmount(receivedAmount)
            .securityDeposit(securityDeposit)
            .penalty(penalty)
            .discount(discount)
            .initialStatus(paymentStatus)
            .build();
    }
}
