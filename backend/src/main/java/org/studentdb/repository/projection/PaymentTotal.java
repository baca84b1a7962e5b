package org.studentdb.repository.projection;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Row of the per-student payment aggregate. {@code total} is null for a
 * student without payments.
 */
@Value
public class PaymentTotal {
    Long studentId;
    String firstName;
    String lastName;
    BigDecimal total;
}
