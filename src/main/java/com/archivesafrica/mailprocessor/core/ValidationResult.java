package com.archivesafrica.mailprocessor.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Required labels found without a value, in record order. Empty means the record passed.
 */
public final class ValidationResult {

    private final Set<String> missingFields;

    public ValidationResult(Set<String> missingFields) {
        this.missingFields = Collections.unmodifiableSet(new LinkedHashSet<>(missingFields));
    }

    public boolean isValid() {
        return missingFields.isEmpty();
    }

    public Set<String> getMissingFields() {
        return missingFields;
    }

    public List<String> getMissingFieldList() {
        return new ArrayList<>(missingFields);
    }

    @Override
    public String toString() {
        return isValid() ? "valid" : "missing " + missingFields;
    }
}
