package com.postal.directory.core.model;

/**
 * Base class for the opaque eDNE record identifiers.
 *
 * <p>Every identifier wraps a non-zero unsigned 32-bit value. Equality, hashing
 * and ordering are by that value within one identifier class; a
 * {@link LocalityId} never equals a {@link NeighborhoodId} with the same
 * number.</p>
 *
 * @param <T> the concrete identifier type
 */
public abstract class NumericId<T extends NumericId<T>> implements Comparable<T> {

    private static final long MAX_UNSIGNED_INT = 0xFFFF_FFFFL;

    private final int value;

    protected NumericId(int value) {
        this.value = value;
    }

    /**
     * Validates a raw value and returns it as the packed unsigned int.
     */
    protected static int checkValue(long value, String label) {
        if (value == 0) {
            throw InvalidIdentifierException.zero(label);
        }
        if (value < 0 || value > MAX_UNSIGNED_INT) {
            throw InvalidIdentifierException.invalidFormat(label, Long.toString(value));
        }
        return (int) value;
    }

    /**
     * Parses stripped decimal text (ASCII digits, optional leading '+'), then
     * applies the zero check.
     */
    protected static int parseValue(String text, String label) {
        if (text == null) {
            throw InvalidIdentifierException.invalidFormat(label, "null");
        }
        String stripped = SourceText.strip(text);
        String digits = stripped.startsWith("+") ? stripped.substring(1) : stripped;
        if (!SourceText.isAsciiDigits(digits)) {
            throw InvalidIdentifierException.invalidFormat(label, text);
        }
        int parsed;
        try {
            parsed = Integer.parseUnsignedInt(stripped);
        } catch (NumberFormatException e) {
            throw InvalidIdentifierException.invalidFormat(label, text);
        }
        return checkValue(Integer.toUnsignedLong(parsed), label);
    }

    /**
     * Returns the unsigned value.
     */
    public long value() {
        return Integer.toUnsignedLong(value);
    }

    @Override
    public int compareTo(T other) {
        return Integer.compareUnsigned(value, ((NumericId<?>) other).value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value == ((NumericId<?>) o).value;
    }

    @Override
    public int hashCode() {
        return 31 * getClass().hashCode() + value;
    }

    @Override
    public String toString() {
        return Integer.toUnsignedString(value);
    }
}
