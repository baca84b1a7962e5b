package org.studentdb.repository;

import org.studentdb.entity.Payment;
import org.studentdb.repository.projection.PaymentTotal;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;

@Repository
public interface PaymentRepository extends JpaRepository<Payment, Long> {

    @Query("SELECT SUM(p.amount) FROM Payment p WHERE p.student.id = :studentId")
    BigDecimal sumAmountByStudentId(@Param("studentId") Long studentId);

    @Query("SELECT new org.studentdb.repository.projection.PaymentTotal(s.id, s.firstName, s.lastName, SUM(p.amount)) " +
           "FROM Student s LEFT JOIN Payment p ON p.student = s " +
           "GROUP BY s.id, s.firstName, s.lastName ORDER BY s.id")
    List<PaymentTotal> findPaymentTotals();

    List<Payment> findByStudentIdOrderByPaymentDateAsc(Long studentId);

    long countByStudentId(Long studentId);
}
