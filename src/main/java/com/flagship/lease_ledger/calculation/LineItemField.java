package com.flagship.lease_ledger.calculation;

import com.flagship.lease_ledger.exception.ValidationException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.Set;

/**
 * The raw, user-editable fields of a {@link LineItem}.
 * Each field knows its value type and which kinds of line item it belongs to.
 */
public enum LineItemField {
    BASE_AMOUNT(BigDecimal.class, EnumSet.of(LineItemKind.UNIT_TERM)),
    PERIOD_MULTIPLIER(Integer.class, EnumSet.of(LineItemKind.UNIT_TERM)),
    DERIVED_ANNUAL_AMOUNT(BigDecimal.class, EnumSet.of(LineItemKind.UNIT_TERM)),
    TAX_RATE(String.class, EnumSet.allOf(LineItemKind.class)),
    FROM_DATE(LocalDate.class, EnumSet.of(LineItemKind.UNIT_TERM)),
    TO_DATE(LocalDate.class, EnumSet.of(LineItemKind.UNIT_TERM)),
    AMOUNT(BigDecimal.class, EnumSet.of(LineItemKind.CHARGE));

    private final Class<?> valueType;
    private final Set<LineItemKind> kinds;

    LineItemField(Class<?> valueType, Set<LineItemKind> kinds) {
        this.valueType = valueType;
        this.kinds = kinds;
    }

    public boolean appliesTo(LineItemKind kind) {
        return kinds.contains(kind);
    }

    public Class<?> getValueType() {
        return valueType;
    }

    /**
     * Converts a typed value or its text form into this field's value type.
     * Blank text becomes null, which only TAX_RATE (no tax) and PERIOD_MULTIPLIER (default) accept.
     */
    public Object coerce(Object value) {
        if (value instanceof String) {
            String text = (String) value;
            value = text.isBlank() ? null : parse(text.trim());
        } else if (value instanceof Number && valueType == BigDecimal.class && !(value instanceof BigDecimal)) {
            value = new BigDecimal(value.toString());
        } else if (value instanceof Number && valueType == Integer.class && !(value instanceof Integer)) {
            value = ((Number) value).intValue();
        }

        if (value == null) {
            if (this == TAX_RATE || this == PERIOD_MULTIPLIER) {
                return null;
            }
            throw new ValidationException(this + " requires a value");
        }
        if (!valueType.isInstance(value)) {
            throw new ValidationException(String.format("%s expects a %s value but got %s",
                    this, valueType.getSimpleName(), value.getClass().getSimpleName()));
        }
        return value;
    }

    private Object parse(String text) {
        try {
            if (valueType == BigDecimal.class) {
                return new BigDecimal(text);
            }
            if (valueType == Integer.class) {
                return Integer.valueOf(text);
            }
            if (valueType == LocalDate.class) {
                return LocalDate.parse(text);
            }
            return text;
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new ValidationException(String.format("Invalid value '%s' for %s", text, this));
        }
    }
}
