package com.archivesafrica.mailprocessor.core;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Checks a record for required fields without a value. Stateless.
 */
public class RecordValidator {

    /**
     * @param record the record to check
     * @return exactly the required labels whose value is absent
     */
    public ValidationResult validate(NormalizedRecord record) {
        Set<String> missing = new LinkedHashSet<>();
        for (RecordField field : record.getFields()) {
            if (field.isRequired() && !field.isPresent()) {
                missing.add(field.getLabel());
            }
        }
        return new ValidationResult(missing);
    }
}
