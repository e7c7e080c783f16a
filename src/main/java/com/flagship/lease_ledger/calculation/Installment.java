package com.flagship.lease_ledger.calculation;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
public class Installment {
    int number;
    BigDecimal amount;
    LocalDate dueDate;
}
