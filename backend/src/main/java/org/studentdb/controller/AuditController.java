package org.studentdb.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.studentdb.dto.AuditRecordResponse;
import org.studentdb.service.audit.StudentAuditService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/audit")
@RequiredArgsConstructor
@Tag(name = "Audit", description = "Student change history")
public class AuditController {

    private final StudentAuditService auditService;

    @GetMapping("/students/{id}")
    @Operation(summary = "Change history of a student", description = "Also available after the student is deleted")
    public ResponseEntity<List<AuditRecordResponse>> studentHistory(@PathVariable Long id) {
        return ResponseEntity.ok(auditService.getAuditTrail(id).stream()
            .map(AuditRecordResponse::from)
            .toList());
    }
}
