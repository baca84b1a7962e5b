package org.studentdb.service.audit;

import lombok.Builder;
import lombok.Value;
import org.studentdb.entity.Student;

import java.time.LocalDate;

/**
 * Detached copy of a Students row taken before or after a mutation.
 * Managed entities change in place, so the "before" side of a change has to
 * be captured as a value.
 */
@Value
@Builder
public class StudentSnapshot {
    Long id;
    String firstName;
    String lastName;
    LocalDate dateOfBirth;
    String email;
    String phone;
    String gender;
    Boolean active;

    public static StudentSnapshot of(Student student) {
        return StudentSnapshot.builder()
            .id(student.getId())
            .firstName(student.getFirstName())
            .lastName(student.getLastName())
            .dateOfBirth(student.getDateOfBirth())
            .email(student.getEmail())
            .phone(student.getPhone())
            .gender(student.getGender() != null ? student.getGender().name() : null)
            .active(student.getActive())
            .build();
    }
}
