package com.archivesafrica.mailprocessor.core;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RecordValidatorTest {

    private final RecordValidator validator = new RecordValidator();

    @Test
    void passesWhenEveryRequiredFieldHasAValue() {
        NormalizedRecord record = NormalizedRecord.builder()
                .add("Title*", FieldValue.text("Letters"))
                .add("Date*", FieldValue.date(LocalDate.of(1961, 3, 1)))
                .add("Notes", null)
                .build();

        ValidationResult result = validator.validate(record);

        assertTrue(result.isValid());
        assertTrue(result.getMissingFields().isEmpty());
    }

    @Test
    void reportsExactlyTheAbsentRequiredLabels() {
        NormalizedRecord record = NormalizedRecord.builder()
                .add("Title*", null)
                .add("Creator", null)
                .add("Date*", FieldValue.date(LocalDate.of(1961, 3, 1)))
                .add("* Extent", null)
                .build();

        ValidationResult result = validator.validate(record);

        assertFalse(result.isValid());
        assertEquals(Set.of("Title*", "* Extent"), result.getMissingFields());
        assertEquals(List.of("Title*", "* Extent"), result.getMissingFieldList());
    }

    @Test
    void optionalAbsentFieldsNeverFail() {
        NormalizedRecord record = NormalizedRecord.builder()
                .add("Creator", null)
                .add("Notes", null)
                .build();

        assertTrue(validator.validate(record).isValid());
    }

    @Test
    void builderRejectsDuplicateLabels() {
        NormalizedRecord.Builder builder = NormalizedRecord.builder().add("Title*", FieldValue.text("a"));

        assertThrows(IllegalArgumentException.class, () -> builder.add("Title*", FieldValue.text("b")));
    }
}
