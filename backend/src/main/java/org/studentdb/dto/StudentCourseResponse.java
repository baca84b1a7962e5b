package org.studentdb.dto;

import lombok.*;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StudentCourseResponse {
    private Long enrollmentId;
    private Long courseId;
    private String courseCode;
    private String courseName;
    private LocalDateTime enrollDate;
    private String status;
}
