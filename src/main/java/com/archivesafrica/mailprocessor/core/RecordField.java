package com.archivesafrica.mailprocessor.core;

import java.util.Objects;
import java.util.Optional;

/**
 * One labelled field of a {@link NormalizedRecord}.
 * <p>
 * The label is what the submitter sees in the sheet (e.g. {@code Title*}); a {@code *}
 * anywhere in it marks the field as required. The name is what the output element is
 * called before sanitizing, and falls back to the label.
 */
public final class RecordField {

    public static final String REQUIRED_MARKER = "*";

    private final String label;
    private final String name;
    private final FieldValue value;

    public RecordField(String label, String name, FieldValue value) {
        this.label = Objects.requireNonNull(label, "label");
        this.name = name == null || name.isBlank() ? label : name;
        this.value = value;
    }

    public static RecordField of(String label, FieldValue value) {
        return new RecordField(label, null, value);
    }

    public String getLabel() {
        return label;
    }

    public String getName() {
        return name;
    }

    public Optional<FieldValue> getValue() {
        return Optional.ofNullable(value);
    }

    public boolean isRequired() {
        return label.contains(REQUIRED_MARKER);
    }

    public boolean isPresent() {
        return value != null;
    }

    @Override
    public String toString() {
        return label + "=" + (value == null ? "<absent>" : value);
    }
}
