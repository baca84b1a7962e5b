package org.studentdb.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "Payments", indexes = {
    @Index(name = "ix_payments_student_date", columnList = "StudentID, PaymentDate")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Payment {
    public static final String DEFAULT_MODE = "Bank Transfer";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "PaymentID")
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "StudentID", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Student student;

    @Column(name = "Amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Column(name = "PaymentDate")
    private LocalDateTime paymentDate;

    @Column(name = "Mode", length = 50)
    @Builder.Default
    private String mode = DEFAULT_MODE;

    @Column(name = "ReferenceNo", length = 100)
    private String referenceNo;
}
