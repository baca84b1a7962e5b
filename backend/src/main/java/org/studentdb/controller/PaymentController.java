package org.studentdb.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.studentdb.dto.PaymentRequest;
import org.studentdb.service.PaymentService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Tag(name = "Payments", description = "Fee payments")
public class PaymentController {

    private final PaymentService paymentService;

    @PostMapping
    @Operation(summary = "Record a payment", description = "Mode defaults to Bank Transfer")
    public ResponseEntity<Map<String, Object>> record(@Valid @RequestBody PaymentRequest request) {
        Long id = paymentService.recordPayment(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("id", id));
    }
}
