package com.archivesafrica.mailprocessor.core;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Typed cell value of a record field. Absent values are not represented here; a field
 * without a value simply has none (see {@link RecordField#isPresent()}).
 */
public final class FieldValue {

    public enum Kind {
        TEXT, DATE, NUMBER, BOOLEAN
    }

    private final Kind kind;
    private final Object value;

    private FieldValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = Objects.requireNonNull(value, "value");
    }

    public static FieldValue text(String text) {
        return new FieldValue(Kind.TEXT, text);
    }

    public static FieldValue date(LocalDate date) {
        return new FieldValue(Kind.DATE, date);
    }

    public static FieldValue number(BigDecimal number) {
        return new FieldValue(Kind.NUMBER, number);
    }

    public static FieldValue bool(boolean flag) {
        return new FieldValue(Kind.BOOLEAN, flag);
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isText() {
        return kind == Kind.TEXT;
    }

    public String asText() {
        switch (kind) {
            case DATE:
                return ((LocalDate) value).toString(); // ISO-8601, yyyy-MM-dd
            case NUMBER:
                BigDecimal number = ((BigDecimal) value).stripTrailingZeros();
                return number.toPlainString();
            default:
                return value.toString();
        }
    }

    public LocalDate asDate() {
        if (kind != Kind.DATE) {
            throw new IllegalStateException("Not a date: " + kind);
        }
        return (LocalDate) value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldValue)) return false;
        FieldValue that = (FieldValue) o;
        return kind == that.kind && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind + ":" + asText();
    }
}
