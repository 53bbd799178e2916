package com.schemalens.core.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A sequence. Bounds and current value are exact; any of them may be null when the
 * engine does not report it.
 */
public record Sequence(
        Identifier id,
        DataType dataType,
        BigInteger start,
        BigInteger minValue,
        BigInteger maxValue,
        BigInteger increment,
        boolean cycle,
        BigInteger cacheSize,
        BigInteger currentValue
) {
    public Sequence {
        Objects.requireNonNull(id, "id");
        if (increment != null && increment.signum() == 0) {
            throw new ModelIntegrityException("sequence " + id, "increment must not be zero");
        }
        if (minValue != null && maxValue != null && minValue.compareTo(maxValue) > 0) {
            throw new ModelIntegrityException("sequence " + id, "minimum " + minValue + " exceeds maximum " + maxValue);
        }
    }
}
