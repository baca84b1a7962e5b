package org.studentdb.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "Students")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Student {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "StudentID")
    private Long id;

    @Column(name = "FirstName", nullable = false, length = 50)
    private String firstName;

    @Column(name = "LastName", nullable = false, length = 50)
    private String lastName;

    @Column(name = "DOB")
    private LocalDate dateOfBirth;

    @Column(name = "Email", unique = true, length = 100)
    private String email;

    @Column(name = "Phone", columnDefinition = "CHAR(10)")
    private String phone;

    @Enumerated(EnumType.STRING)
    @Column(name = "Gender", columnDefinition = "CHAR(1)")
    private Gender gender;

    @Column(name = "AdmissionDate")
    private LocalDateTime admissionDate;

    @Column(name = "IsActive")
    @Builder.Default
    private Boolean active = Boolean.TRUE;

    public String getFullName() {
        return firstName + " " + lastName;
    }
}
