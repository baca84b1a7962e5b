package org.studentdb.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "Courses")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Course {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "CourseID")
    private Long id;

    @Column(name = "CourseName", nullable = false, length = 150)
    private String name;

    @Column(name = "Code", unique = true, length = 20)
    private String code;

    @Column(name = "Credits", nullable = false)
    private Integer credits;

    @Column(name = "Description", length = 500)
    private String description;
}
