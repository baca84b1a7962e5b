package org.studentdb.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

/**
 * One row of the student change log. Rows are written once and never
 * updated. StudentID is not a foreign key, so the history of a
 * deleted student stays readable.
 */
@Entity
@Immutable
@Table(name = "StudentAudit", indexes = {
    @Index(name = "ix_student_audit_student", columnList = "StudentID")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StudentAudit {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "AuditID")
    private Long id;

    @Column(name = "StudentID", nullable = false)
    private Long studentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "ChangeType", nullable = false, length = 20)
    private ChangeType changeType;

    @Column(name = "ChangedField", length = 100)
    private String changedField;

    @Column(name = "OldValue", length = 500)
    private String oldValue;

    @Column(name = "NewValue", length = 500)
    private String newValue;

    @Column(name = "ChangedBy", length = 100)
    private String changedBy;

    @Column(name = "ChangedDate")
    private LocalDateTime changedDate;

    public enum ChangeType {
        INSERT, UPDATE, DELETE
    }
}
