package org.studentdb.dto;

import lombok.*;
import org.studentdb.entity.Student;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StudentResponse {
    private Long id;
    private String firstName;
    private String lastName;
    private String fullName;
    private LocalDate dateOfBirth;
    private String email;
    private String phone;
    private String gender;
    private LocalDateTime admissionDate;
    private Boolean active;

    public static StudentResponse from(Student student) {
        return StudentResponse.builder()
            .id(student.getId())
            .firstName(student.getFirstName())
            .lastName(student.getLastName())
            .fullName(student.getFullName())
            .dateOfBirth(student.getDateOfBirth())
            .email(student.getEmail())
            .phone(student.getPhone())
            .gender(student.getGender() != null ? student.getGender().name() : null)
            .admissionDate(student.getAdmissionDate())
            .active(student.getActive())
            .build();
    }
}
