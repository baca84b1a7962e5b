package org.studentdb.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.studentdb.dto.EnrollmentRosterResponse;
import org.studentdb.dto.PaymentSummaryResponse;
import org.studentdb.service.EnrollmentService;
import org.studentdb.service.PaymentService;
import org.studentdb.service.ReportService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.List;

@RestController
@RequestMapping("/api/reports")
@RequiredArgsConstructor
@Tag(name = "Reports", description = "Enrollment and payment reports")
public class ReportController {

    private final EnrollmentService enrollmentService;
    private final PaymentService paymentService;
    private final ReportService reportService;

    @GetMapping("/enrollments")
    @Operation(summary = "Students with their courses")
    public ResponseEntity<List<EnrollmentRosterResponse>> enrollments() {
        return ResponseEntity.ok(enrollmentService.getEnrollmentRoster());
    }

    @GetMapping("/payments")
    @Operation(summary = "Total paid per student")
    public ResponseEntity<List<PaymentSummaryResponse>> payments() {
        return ResponseEntity.ok(paymentService.getPaymentSummary());
    }

    @GetMapping("/enrollments/export")
    @Operation(summary = "Download the enrollment roster as Excel")
    public void exportEnrollments(HttpServletResponse response) throws IOException {
        response.setContentType(ReportService.XLSX_CONTENT_TYPE);
        response.setHeader("Content-Disposition", "attachment; filename=enrollments.xlsx");
        reportService.exportEnrollmentRoster(response.getOutputStream());
    }

    @GetMapping("/payments/export")
    @Operation(summary = "Download the payment summary as Excel")
    public void exportPayments(HttpServletResponse response) throws IOException {
        response.setContentType(ReportService.XLSX_CONTENT_TYPE);
        response.setHeader("Content-Disposition", "attachment; filename=payments.xlsx");
        reportService.exportPaymentSummary(response.getOutputStream());
    }
}
