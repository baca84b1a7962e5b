package org.studentdb.exception;

import org.springframework.http.HttpStatus;

/**
 * A referenced row does not exist (HTTP 404).
 */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String code, String message) {
        super(code, message, HttpStatus.NOT_FOUND);
    }

    public ResourceNotFoundException(String code, String message, Throwable cause) {
        super(code, message, HttpStatus.NOT_FOUND, cause);
    }

    public static ResourceNotFoundException studentNotFound(Long studentId) {
        return new ResourceNotFoundException(
            "STUDENT_NOT_FOUND",
            String.format("Student with ID %d not found", studentId)
        );
    }

    public static ResourceNotFoundException courseNotFound(Long courseId) {
        return new ResourceNotFoundException(
            "COURSE_NOT_FOUND",
            String.format("Course with ID %d not found", courseId)
        );
    }

    public static ResourceNotFoundException courseCodeNotFound(String code) {
        return new ResourceNotFoundException(
            "COURSE_NOT_FOUND",
            String.format("Course with code %s not found", code)
        );
    }
}
