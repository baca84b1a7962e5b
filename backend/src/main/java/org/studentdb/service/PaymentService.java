package org.studentdb.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.studentdb.dto.PaymentRequest;
import org.studentdb.dto.PaymentSummaryResponse;
import org.studentdb.entity.Payment;
import org.studentdb.exception.ConstraintViolationException;
import org.studentdb.exception.PersistenceErrorTranslator;
import org.studentdb.exception.ResourceNotFoundException;
import org.studentdb.repository.PaymentRepository;
import org.studentdb.repository.StudentRepository;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentService {

    private final PaymentRepository paymentRepository;
    private final StudentRepository studentRepository;
    private final PersistenceErrorTranslator errorTranslator;
    private final Clock clock;

    /**
     * Records a payment for an existing student. A negative amount reaches the
     * database and is rejected by {@code ck_payments_amount}.
     *
     * @return the new payment id
     */
    @Transactional
    public Long recordPayment(PaymentRequest request) {
        Long studentId = request.getStudentId();
        if (studentId == null || !studentRepository.existsById(studentId)) {
            log.warn("Payment rejected, student {} does not exist", studentId);
            throw ResourceNotFoundException.studentNotFound(studentId);
        }
        if (request.getAmount() == null) {
            throw ConstraintViolationException.required("Amount");
        }

        String mode = request.getMode() == null || request.getMode().isBlank()
            ? Payment.DEFAULT_MODE
            : request.getMode().trim();

        Payment payment = Payment.builder()
            .student(studentRepository.getReferenceById(studentId))
            .amount(request.getAmount())
            .paymentDate(LocalDateTime.now(clock))
            .mode(mode)
            .referenceNo(request.getReferenceNo())
            .build();

        Payment saved;
        try {
            saved = paymentRepository.saveAndFlush(payment);
        } catch (DataAccessException e) {
            throw errorTranslator.translate("Payment", e);
        }

        log.info("Payment recorded: id={}, studentId={}, amount={}, mode={}",
            saved.getId(), studentId, saved.getAmount(), saved.getMode());
        return saved.getId();
    }

    @Transactional(readOnly = true)
    public BigDecimal getTotalPaid(Long studentId) {
        if (!studentRepository.existsById(studentId)) {
            throw ResourceNotFoundException.studentNotFound(studentId);
        }
        BigDecimal total = paymentRepository.sumAmountByStudentId(studentId);
        return total != null ? total : BigDecimal.ZERO;
    }

    @Transactional(readOnly = true)
    public List<Payment> getPayments(Long studentId) {
        if (!studentRepository.existsById(studentId)) {
            throw ResourceNotFoundException.studentNotFound(studentId);
        }
        return paymentRepository.findByStudentIdOrderByPaymentDateAsc(studentId);
    }

    /**
     * Total paid by every student, including students with no payments (total 0).
     */
    @Transactional(readOnly = true)
    public List<PaymentSummaryResponse> getPaymentSummary() {
        return paymentRepository.findPaymentTotals().stream()
            .map(row -> PaymentSummaryResponse.builder()
                .studentId(row.getStudentId())
                .fullName(row.getFirstName() + " " + row.getLastName())
                .totalPaid(row.getTotal() != null ? row.getTotal() : BigDecimal.ZERO)
                .build())
            .toList();
    }
}
