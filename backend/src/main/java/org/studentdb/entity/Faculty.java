package org.studentdb.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDate;

@Entity
@Table(name = "Faculty")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Faculty {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "FacultyID")
    private Long id;

    @Column(name = "FullName", nullable = false, length = 150)
    private String fullName;

    @Column(name = "Department", length = 100)
    private String department;

    @Column(name = "Email", unique = true, length = 100)
    private String email;

    @Column(name = "Salary", precision = 12, scale = 2)
    private BigDecimal salary;

    @Column(name = "HireDate")
    private LocalDate hireDate;
}
