package org.studentdb.repository;

import org.studentdb.entity.StudentAudit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StudentAuditRepository extends JpaRepository<StudentAudit, Long> {
    List<StudentAudit> findByStudentIdOrderByIdAsc(Long studentId);
    List<StudentAudit> findByStudentIdAndChangeTypeOrderByIdAsc(Long studentId, StudentAudit.ChangeType changeType);
    long countByStudentId(Long studentId);
}
