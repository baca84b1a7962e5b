package org.studentdb.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.studentdb.dto.EnrollmentRequest;
import org.studentdb.service.EnrollmentService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/enrollments")
@RequiredArgsConstructor
@Tag(name = "Enrollments", description = "Course enrollment")
public class EnrollmentController {

    private final EnrollmentService enrollmentService;

    @PostMapping
    @Operation(summary = "Enroll a student in a course",
            description = "404 when the student or course is missing, 409 when the student is already enrolled")
    public ResponseEntity<Map<String, Object>> enroll(@Valid @RequestBody EnrollmentRequest request) {
        Long id = enrollmentService.enroll(request.getStudentId(), request.getCourseId());
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("id", id));
    }
}
