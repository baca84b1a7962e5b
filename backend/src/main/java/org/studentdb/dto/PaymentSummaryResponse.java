package org.studentdb.dto;

import lombok.*;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PaymentSummaryResponse {
    private Long studentId;
    private String fullName;
    private BigDecimal totalPaid;
}
