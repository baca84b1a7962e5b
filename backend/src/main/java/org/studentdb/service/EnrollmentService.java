package org.studentdb.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.studentdb.dto.EnrollmentRosterResponse;
import org.studentdb.dto.StudentCourseResponse;
import org.studentdb.entity.Course;
import org.studentdb.entity.Enrollment;
import org.studentdb.entity.Student;
import org.studentdb.exception.PersistenceErrorTranslator;
import org.studentdb.exception.ResourceNotFoundException;
import org.studentdb.repository.CourseRepository;
import org.studentdb.repository.EnrollmentRepository;
import org.studentdb.repository.StudentRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class EnrollmentService {

    private final EnrollmentRepository enrollmentRepository;
    private final StudentRepository studentRepository;
    private final CourseRepository courseRepository;
    private final PersistenceErrorTranslator errorTranslator;
    private final Clock clock;

    /**
     * Enrolls an existing student in an existing course.
     *
     * <p>Only the references are checked up front. A second enrollment for the
     * same pair is rejected by the {@code uq_student_course} constraint when the
     * row is written, so concurrent duplicates resolve to exactly one success.
     *
     * @return the new enrollment id
     */
    @Transactional
    public Long enroll(Long studentId, Long courseId) {
        if (studentId == null || !studentRepository.existsById(studentId)) {
            log.warn("Enrollment rejected, student {} does not exist", studentId);
            throw ResourceNotFoundException.studentNotFound(studentId);
        }
        if (courseId == null || !courseRepository.existsById(courseId)) {
            log.warn("Enrollment rejected, course {} does not exist", courseId);
            throw ResourceNotFoundException.courseNotFound(courseId);
        }

        Student student = studentRepository.getReferenceById(studentId);
        Course course = courseRepository.getReferenceById(courseId);
        Enrollment enrollment = Enrollment.builder()
            .student(student)
            .course(course)
            .enrollDate(LocalDateTime.now(clock))
            .status(Enrollment.DEFAULT_STATUS)
            .build();

        Enrollment saved;
        try {
            saved = enrollmentRepository.saveAndFlush(enrollment);
        } catch (DataAccessException e) {
            throw errorTranslator.translate("Enrollment", e);
        }

        log.info("Student {} enrolled in course {}: enrollmentId={}", studentId, courseId, saved.getId());
        return saved.getId();
    }

    @Transactional(readOnly = true)
    public List<StudentCourseResponse> getStudentCourses(Long studentId) {
        if (!studentRepository.existsById(studentId)) {
            throw ResourceNotFoundException.studentNotFound(studentId);
        }
        return enrollmentRepository.findByStudentIdWithCourse(studentId).stream()
            .map(e -> StudentCourseResponse.builder()
                .enrollmentId(e.getId())
                .courseId(e.getCourse().getId())
                .courseCode(e.getCourse().getCode())
                .courseName(e.getCourse().getName())
                .enrollDate(e.getEnrollDate())
                .status(e.getStatus())
                .build())
            .toList();
    }

    /**
     * Every enrollment with the student's full name, ordered by student id.
     */
    @Transactional(readOnly = true)
    public List<EnrollmentRosterResponse> getEnrollmentRoster() {
        return enrollmentRepository.findAllWithStudentAndCourse().stream()
            .map(e -> EnrollmentRosterResponse.builder()
                .studentId(e.getStudent().getId())
                .fullName(e.getStudent().getFullName())
                .courseName(e.getCourse().getName())
                .enrollDate(e.getEnrollDate())
                .build())
            .toList();
    }
}
