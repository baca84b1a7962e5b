package org.studentdb.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PaymentRequest {

    @NotNull(message = "Student ID is required")
    private Long studentId;

    // Sign is enforced by the Payments.Amount check constraint
    @NotNull(message = "Amount is required")
    private BigDecimal amount;

    @Size(max = 50, message = "Mode must be at most 50 characters")
    private String mode;

    @Size(max = 100, message = "Reference must be at most 100 characters")
    private String referenceNo;
}
