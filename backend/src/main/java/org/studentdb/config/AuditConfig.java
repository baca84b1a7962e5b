package org.studentdb.config;

import org.studentdb.service.audit.StudentSnapshot;
import org.studentdb.service.audit.TrackedStudentFields;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AuditConfig {

    /**
     * Student columns whose updates are written to the audit trail, in audit row order.
     */
    @Bean
    public TrackedStudentFields trackedStudentFields() {
        return TrackedStudentFields.builder()
            .field("Email", StudentSnapshot::getEmail)
            .field("Phone", StudentSnapshot::getPhone)
            .build();
    }
}
