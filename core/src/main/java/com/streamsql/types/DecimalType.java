package com.streamsql.types;

import java.util.Objects;

/**
 * Fixed-precision decimal type used for cast hints and column metadata.
 *
 * <p>Precision is the total number of digits, scale is the number of digits after the
 * decimal point. Renders as {@code DECIMAL(precision, scale)}.
 */
public final class DecimalType {

    private final int precision;
    private final int scale;

    /**
     * Creates a decimal type with the given precision and scale.
     *
     * @param precision the total number of digits (1-38)
     * @param scale the number of digits after the decimal point (0 to precision)
     */
    public DecimalType(int precision, int scale) {
        if (precision < 1 || precision > 38) {
            throw new IllegalArgumentException("precision must be between 1 and 38, got: " + precision);
        }
        if (scale < 0 || scale > precision) {
            throw new IllegalArgumentException("scale must be between 0 and " + precision + ", got: " + scale);
        }
        this.precision = precision;
        this.scale = scale;
    }

    public int precision() {
        return precision;
    }

    public int scale() {
        return scale;
    }

    /**
     * Returns the dialect type name.
     *
     * @return e.g. {@code DECIMAL(18, 2)}
     */
    public String toSQL() {
        return String.format("DECIMAL(%d, %d)", precision, scale);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DecimalType)) return false;
        DecimalType that = (DecimalType) obj;
        return precision == that.precision && scale == that.scale;
    }

    @Override
    public int hashCode() {
        return Objects.hash(precision, scale);
    }

    @Override
    public String toString() {
        return toSQL();
    }
}
