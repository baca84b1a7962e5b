package org.studentdb.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.studentdb.dto.StudentCourseResponse;
import org.studentdb.dto.StudentRegistrationRequest;
import org.studentdb.dto.StudentResponse;
import org.studentdb.dto.StudentUpdateRequest;
import org.studentdb.entity.Payment;
import org.studentdb.service.EnrollmentService;
import org.studentdb.service.PaymentService;
import org.studentdb.service.StudentService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/students")
@RequiredArgsConstructor
@Tag(name = "Students", description = "Student registration and maintenance")
public class StudentController {

    private final StudentService studentService;
    private final EnrollmentService enrollmentService;
    private final PaymentService paymentService;

    @PostMapping
    @Operation(summary = "Register a student", description = "Creates a student and returns the new id")
    public ResponseEntity<Map<String, Object>> register(@Valid @RequestBody StudentRegistrationRequest request) {
        Long id = studentService.registerStudent(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("id", id));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a student")
    public ResponseEntity<StudentResponse> get(@PathVariable Long id) {
        return ResponseEntity.ok(StudentResponse.from(studentService.getStudent(id)));
    }

    @GetMapping("/{id}/full-name")
    @Operation(summary = "Full name of a student", description = "Empty string when the student does not exist")
    public ResponseEntity<Map<String, String>> fullName(@PathVariable Long id) {
        return ResponseEntity.ok(Map.of("fullName", studentService.getFullName(id)));
    }

    @PatchMapping("/{id}")
    @Operation(summary = "Update a student", description = "Null fields are left unchanged")
    public ResponseEntity<StudentResponse> update(@PathVariable Long id,
                                                  @Valid @RequestBody StudentUpdateRequest request) {
        return ResponseEntity.ok(StudentResponse.from(studentService.updateStudent(id, request)));
    }

    @PatchMapping
    @Operation(summary = "Update several students", description = "Body maps student id to its update; all or nothing")
    public ResponseEntity<List<StudentResponse>> updateBatch(@RequestBody Map<Long, StudentUpdateRequest> updates) {
        List<StudentResponse> updated = studentService.updateStudents(new LinkedHashMap<>(updates)).stream()
            .map(StudentResponse::from)
            .toList();
        log.info("Batch update applied to {} students", updated.size());
        return ResponseEntity.ok(updated);
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a student", description = "Enrollments and payments are deleted with the student")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        studentService.deleteStudent(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/courses")
    @Operation(summary = "Courses a student is enrolled in")
    public ResponseEntity<List<StudentCourseResponse>> courses(@PathVariable Long id) {
        return ResponseEntity.ok(enrollmentService.getStudentCourses(id));
    }

    @GetMapping("/{id}/payments")
    @Operation(summary = "Payments made by a student")
    public ResponseEntity<List<Map<String, Object>>> payments(@PathVariable Long id) {
        List<Map<String, Object>> payments = paymentService.getPayments(id).stream()
            .map(StudentController::toMap)
            .toList();
        return ResponseEntity.ok(payments);
    }

    @GetMapping("/{id}/payments/total")
    @Operation(summary = "Total paid by a student")
    public ResponseEntity<Map<String, Object>> totalPaid(@PathVariable Long id) {
        BigDecimal total = paymentService.getTotalPaid(id);
        return ResponseEntity.ok(Map.of("studentId", id, "totalPaid", total));
    }

    private static Map<String, Object> toMap(Payment payment) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", payment.getId());
        map.put("amount", payment.getAmount());
        map.put("paymentDate", payment.getPaymentDate());
        map.put("mode", payment.getMode());
        map.put("referenceNo", payment.getReferenceNo());
        return map;
    }
}
