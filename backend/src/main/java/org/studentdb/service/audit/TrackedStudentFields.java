package org.studentdb.service.audit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Ordered registry of student fields whose updates produce audit rows.
 * Fields not registered here may change without being audited.
 */
public final class TrackedStudentFields {

    private final Map<String, Function<StudentSnapshot, String>> extractors;

    private TrackedStudentFields(Map<String, Function<StudentSnapshot, String>> extractors) {
        this.extractors = Collections.unmodifiableMap(new LinkedHashMap<>(extractors));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Function<StudentSnapshot, String>> asMap() {
        return extractors;
    }

    public boolean isEmpty() {
        return extractors.isEmpty();
    }

    public static class Builder {
        private final Map<String, Function<StudentSnapshot, String>> extractors = new LinkedHashMap<>();

        public Builder field(String name, Function<StudentSnapshot, String> extractor) {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(extractor, "extractor");
            if (extractors.putIfAbsent(name, extractor) != null) {
                throw new IllegalArgumentException("Field already tracked: " + name);
            }
            return this;
        }

        public TrackedStudentFields build() {
            return new TrackedStudentFields(extractors);
        }
    }
}
