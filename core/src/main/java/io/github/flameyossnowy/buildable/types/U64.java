package io.github.flameyossnowy.buildable.types;

import io.github.flameyossnowy.buildable.Build;
import io.github.flameyossnowy.buildable.annotations.Buildable;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

import java.math.BigInteger;

/**
 * A 64-bit unsigned integer. Values above {@link Long#MAX_VALUE} are stored in the sign bit,
 * use {@link #toBigInteger()} to read them as a number.
 *
 * @param bits the raw 64 bits
 * @author FlameyosFlow
 */
@Buildable
public record U64(long bits) implements Comparable<U64> {
    private static final BigInteger MAX_VALUE = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    /**
     * Builds {@code 63}.
     */
    public static final Build<U64> BUILD = () -> new U64(63L);

    @Contract("_ -> new")
    public static @NotNull U64 of(long value) {
        if (value < 0) {
            throw new IllegalArgumentException("Value " + value + " is negative, use parse or fromBits for values above Long.MAX_VALUE");
        }
        return new U64(value);
    }

    @Contract("_ -> new")
    public static @NotNull U64 of(@NotNull BigInteger value) {
        if (value.signum() < 0 || value.compareTo(MAX_VALUE) > 0) {
            throw new IllegalArgumentException("Value " + value + " is out of range for U64 [0, " + MAX_VALUE + "]");
        }
        return new U64(value.longValue());
    }

    @Contract("_ -> new")
    public static @NotNull U64 fromBits(long bits) {
        return new U64(bits);
    }

    /**
     * Parses an unsigned decimal string.
     *
     * @param text the text to parse
     * @return the parsed value
     * @throws NumberFormatException if the text is not an unsigned 64-bit decimal
     */
    @Contract("_ -> new")
    public static @NotNull U64 parse(@NotNull String text) {
        return new U64(Long.parseUnsignedLong(text));
    }

    public @NotNull BigInteger toBigInteger() {
        BigInteger value = BigInteger.valueOf(bits & Long.MAX_VALUE);
        return bits < 0 ? value.setBit(63) : value;
    }

    @Override
    public int compareTo(@NotNull U64 other) {
        return Long.compareUnsigned(bits, other.bits);
    }

    @Override
    public String toString() {
        return Long.toUnsignedString(bits);
    }
}
