package org.studentdb.dto;

import lombok.*;
import org.studentdb.entity.StudentAudit;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AuditRecordResponse {
    private Long id;
    private Long studentId;
    private String changeType;
    private String changedField;
    private String oldValue;
    private String newValue;
    private String changedBy;
    private LocalDateTime changedDate;

    public static AuditRecordResponse from(StudentAudit audit) {
        return AuditRecordResponse.builder()
            .id(audit.getId())
            .studentId(audit.getStudentId())
            .changeType(audit.getChangeType().name())
            .changedField(audit.getChangedField())
            .oldValue(audit.getOldValue())
            .newValue(audit.getNewValue())
            .changedBy(audit.getChangedBy())
            .changedDate(audit.getChangedDate())
            .build();
    }
}
