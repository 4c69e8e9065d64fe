package com.archivesafrica.mailprocessor.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered label → value view of the primary sheet of a submission.
 *
 * @invariant Labels are unique.
 */
public final class NormalizedRecord {

    private final Map<String, RecordField> fields;

    private NormalizedRecord(Map<String, RecordField> fields) {
        this.fields = fields;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<RecordField> getFields() {
        return Collections.unmodifiableList(new ArrayList<>(fields.values()));
    }

    public Optional<RecordField> getField(String label) {
        return Optional.ofNullable(fields.get(label));
    }

    public List<String> getLabels() {
        return new ArrayList<>(fields.keySet());
    }

    public int size() {
        return fields.size();
    }

    @Override
    public String toString() {
        return "NormalizedRecord" + fields.values();
    }

    public static final class Builder {
        private final Map<String, RecordField> fields = new LinkedHashMap<>();

        /**
         * @throws IllegalArgumentException if a field with the same label was already added
         */
        public Builder add(RecordField field) {
            if (fields.containsKey(field.getLabel())) {
                throw new IllegalArgumentException("Duplicate label: " + field.getLabel());
            }
            fields.put(field.getLabel(), field);
            return this;
        }

        public Builder add(String label, FieldValue value) {
            return add(RecordField.of(label, value));
        }

        public NormalizedRecord build() {
            return new NormalizedRecord(new LinkedHashMap<>(fields));
        }
    }
}
