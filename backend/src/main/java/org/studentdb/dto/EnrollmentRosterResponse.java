package org.studentdb.dto;

import lombok.*;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EnrollmentRosterResponse {
    private Long studentId;
    private String fullName;
    private String courseName;
    private LocalDateTime enrollDate;
}
