package org.studentdb.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.studentdb.dto.CourseRequest;
import org.studentdb.entity.Course;
import org.studentdb.exception.ConstraintViolationException;
import org.studentdb.exception.PersistenceErrorTranslator;
import org.studentdb.exception.ResourceNotFoundException;
import org.studentdb.repository.CourseRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class CourseService {

    private final CourseRepository courseRepository;
    private final PersistenceErrorTranslator errorTranslator;

    @Transactional
    public Long createCourse(CourseRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw ConstraintViolationException.required("Course name");
        }
        if (request.getCredits() == null) {
            throw ConstraintViolationException.required("Credits");
        }

        Course course = Course.builder()
            .name(request.getName().trim())
            .code(request.getCode() == null || request.getCode().isBlank() ? null : request.getCode().trim())
            .credits(request.getCredits())
            .description(request.getDescription())
            .build();

        Course saved;
        try {
            saved = courseRepository.saveAndFlush(course);
        } catch (DataAccessException e) {
            throw errorTranslator.translate("Course creation", e);
        }

        log.info("Course created: id={}, code={}", saved.getId(), saved.getCode());
        return saved.getId();
    }

    @Transactional(readOnly = true)
    public Course findByCode(String code) {
        return courseRepository.findByCode(code)
            .orElseThrow(() -> ResourceNotFoundException.courseCodeNotFound(code));
    }

    @Transactional(readOnly = true)
    public List<Course> listCourses() {
        return courseRepository.findAllByOrderByIdAsc();
    }

    /**
     * Deletes a course; its enrollments are removed by the cascading foreign key.
     */
    @Transactional
    public void deleteCourse(Long courseId) {
        Course course = courseRepository.findById(courseId)
            .orElseThrow(() -> ResourceNotFoundException.courseNotFound(courseId));
        try {
            courseRepository.delete(course);
            courseRepository.flush();
        } catch (DataAccessException e) {
            throw errorTranslator.translate("Course deletion", e);
        }
        log.info("Course deleted: id={}", courseId);
    }
}
