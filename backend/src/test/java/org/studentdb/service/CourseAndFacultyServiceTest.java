package org.studentdb.service;

import org.junit.jupiter.api.Test;
import org.studentdb.IntegrationTestSupport;
import org.studentdb.dto.CourseRequest;
import org.studentdb.dto.FacultyRequest;
import org.studentdb.entity.Course;
import org.studentdb.entity.Faculty;
import org.studentdb.exception.ConflictException;
import org.studentdb.exception.ConstraintViolationException;
import org.studentdb.exception.ResourceNotFoundException;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CourseAndFacultyServiceTest extends IntegrationTestSupport {

    @Autowired
    private CourseService courseService;

    @Autowired
    private FacultyService facultyService;

    @Test
    void createCourse_andFindByCode() {
        Long id = courseService.createCourse(CourseRequest.builder()
            .name("Web Development").code("WD103").credits(3).description("HTML, CSS and JavaScript").build());

        Course course = courseService.findByCode("WD103");
        assertThat(course.getId()).isEqualTo(id);
        assertThat(course.getCredits()).isEqualTo(3);
        assertThat(courseService.listCourses()).extracting(Course::getCode).containsExactly("WD103");
    }

    @Test
    void createCourse_duplicateCode_failsWithConflict() {
        courseService.createCourse(CourseRequest.builder().name("Database Systems").code("DB101").credits(4).build());

        assertThatThrownBy(() -> courseService.createCourse(CourseRequest.builder()
                .name("Databases Again").code("DB101").credits(2).build()))
            .isInstanceOf(ConflictException.class)
            .hasMessage("Course creation failed: course code already exists");
    }

    @Test
    void createCourse_creditsOutOfRange_failsWithConstraintViolation() {
        assertThatThrownBy(() -> courseService.createCourse(CourseRequest.builder()
                .name("Thesis").code("TH999").credits(12).build()))
            .isInstanceOf(ConstraintViolationException.class)
            .hasMessageContaining("credits must be between 1 and 10");

        assertThat(countRows("Courses")).isZero();
    }

    @Test
    void findByCode_unknownCode_failsWithNotFound() {
        assertThatThrownBy(() -> courseService.findByCode("XX000"))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessage("Course with code XX000 not found");
    }

    @Test
    void deleteCourse_unknownId_failsWithNotFound() {
        assertThatThrownBy(() -> courseService.deleteCourse(424242L))
            .isInstanceOf(ResourceNotFoundException.class)
            .hasMessage("Course with ID 424242 not found");
    }

    @Test
    void createFaculty_andListByDepartment() {
        facultyService.createFaculty(FacultyRequest.builder()
            .fullName("Dr. Sunita Rao").department("Computer Science").email("sunita.rao@example.com")
            .salary(new BigDecimal("85000.00")).hireDate(LocalDate.of(2015, 7, 1)).build());
        facultyService.createFaculty(FacultyRequest.builder()
            .fullName("Dr. Arjun Mehta").department("Computer Science").build());
        facultyService.createFaculty(FacultyRequest.builder()
            .fullName("Prof. Lakshmi Nair").department("Mathematics").build());

        assertThat(facultyService.listFaculty("Computer Science"))
            .extracting(Faculty::getFullName).containsExactly("Dr. Arjun Mehta", "Dr. Sunita Rao");
        assertThat(facultyService.listFaculty(null)).hasSize(3);
    }

    @Test
    void createFaculty_negativeSalary_failsWithConstraintViolation() {
        assertThatThrownBy(() -> facultyService.createFaculty(FacultyRequest.builder()
                .fullName("Dr. Negative").salary(new BigDecimal("-1")).build()))
            .isInstanceOf(ConstraintViolationException.class)
            .hasMessage("Faculty creation failed: salary must not be negative");
    }

    @Test
    void createFaculty_duplicateEmail_failsWithConflict() {
        facultyService.createFaculty(FacultyRequest.builder().fullName("A").email("same@example.com").build());

        assertThatThrownBy(() -> facultyService.createFaculty(FacultyRequest.builder()
                .fullName("B").email("same@example.com").build()))
            .isInstanceOf(ConflictException.class);
    }
}
