package org.studentdb.service.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.studentdb.entity.StudentAudit;
import org.studentdb.exception.StorageFailureException;
import org.studentdb.repository.StudentAuditRepository;
import org.studentdb.util.CurrentUserUtil;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Appends StudentAudit rows for a Students mutation.
 *
 * <p>Every service method that inserts, updates or deletes students calls
 * {@link #recordChanges} with the rows as they were before and after the
 * statement. The call joins the caller's transaction, so the audit rows and
 * the mutation commit or roll back together; a failure here fails the
 * mutation.
 *
 * <p>Classification per student id:
 * <ul>
 *   <li>only in {@code after}: one {@code INSERT} row, no field detail</li>
 *   <li>only in {@code before}: one {@code DELETE} row, no field detail</li>
 *   <li>in both: one {@code UPDATE} row per {@link TrackedStudentFields tracked field}
 *       whose value differs, comparing {@code null} as the empty string</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StudentAuditService {

    private final StudentAuditRepository auditRepository;
    private final TrackedStudentFields trackedFields;
    private final CurrentUserUtil currentUserUtil;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public List<StudentAudit> recordChanges(Collection<StudentSnapshot> before, Collection<StudentSnapshot> after) {
        Map<Long, StudentSnapshot> beforeById = indexById(before);
        Map<Long, StudentSnapshot> afterById = indexById(after);

        String actor = currentUserUtil.getCurrentUsername();
        LocalDateTime now = LocalDateTime.now(clock);
        List<StudentAudit> rows = new ArrayList<>();

        for (StudentSnapshot inserted : afterById.values()) {
            if (!beforeById.containsKey(inserted.getId())) {
                rows.add(row(inserted.getId(), StudentAudit.ChangeType.INSERT, null, null, null, actor, now));
            }
        }

        for (StudentSnapshot deleted : beforeById.values()) {
            if (!afterById.containsKey(deleted.getId())) {
                rows.add(row(deleted.getId(), StudentAudit.ChangeType.DELETE, null, null, null, actor, now));
            }
        }

        for (StudentSnapshot old : beforeById.values()) {
            StudentSnapshot current = afterById.get(old.getId());
            if (current == null) {
                continue;
            }
            for (Map.Entry<String, Function<StudentSnapshot, String>> field : trackedFields.asMap().entrySet()) {
                String oldValue = field.getValue().apply(old);
                String newValue = field.getValue().apply(current);
                if (!normalize(oldValue).equals(normalize(newValue))) {
                    rows.add(row(old.getId(), StudentAudit.ChangeType.UPDATE, field.getKey(), oldValue, newValue, actor, now));
                }
            }
        }

        if (rows.isEmpty()) {
            return rows;
        }
        List<StudentAudit> saved;
        try {
            saved = auditRepository.saveAllAndFlush(rows);
        } catch (DataAccessException e) {
            throw new StorageFailureException("Student audit", e);
        }
        log.debug("Appended {} student audit rows (actor={})", saved.size(), actor);
        return saved;
    }

    /**
     * Audit rows of a student in the order they were written. Rows of deleted
     * students are still returned.
     */
    @Transactional(readOnly = true)
    public List<StudentAudit> getAuditTrail(Long studentId) {
        return auditRepository.findByStudentIdOrderByIdAsc(studentId);
    }

    private Map<Long, StudentSnapshot> indexById(Collection<StudentSnapshot> snapshots) {
        Map<Long, StudentSnapshot> byId = new LinkedHashMap<>();
        for (StudentSnapshot snapshot : snapshots) {
            Objects.requireNonNull(snapshot.getId(), "audited student must have an id");
            byId.put(snapshot.getId(), snapshot);
        }
        return byId;
    }

    private static String normalize(String value) {
        return value == null ? "" : value;
    }

    private static StudentAudit row(Long studentId, StudentAudit.ChangeType type, String field,
                                    String oldValue, String newValue, String actor, LocalDateTime at) {
        return StudentAudit.builder()
            .studentId(studentId)
            .changeType(type)
            .changedField(field)
            .oldValue(oldValue)
            .newValue(newValue)
            .changedBy(actor)
            .changedDate(at)
            .build();
    }
}
