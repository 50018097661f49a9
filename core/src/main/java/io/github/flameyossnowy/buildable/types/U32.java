package io.github.flameyossnowy.buildable.types;

import io.github.flameyossnowy.buildable.Build;
import io.github.flameyossnowy.buildable.annotations.Buildable;
import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * A 32-bit unsigned integer. The raw {@code bits} are interpreted as unsigned.
 *
 * @param bits the raw 32 bits
 * @author FlameyosFlow
 */
@Buildable
public record U32(int bits) implements Comparable<U32> {
    public static final long MAX_VALUE = 0xFFFF_FFFFL;

    /**
     * Builds {@code 31}.
     */
    public static final Build<U32> BUILD = () -> new U32(31);

    @Contract("_ -> new")
    public static @NotNull U32 of(long value) {
        if (value < 0 || value > MAX_VALUE) {
            throw new IllegalArgumentException("Value " + value + " is out of range for U32 [0, " + MAX_VALUE + "]");
        }
        return new U32((int) value);
    }

    /**
     * Parses an unsigned decimal string.
     *
     * @param text the text to parse
     * @return the parsed value
     * @throws NumberFormatException if the text is not an unsigned 32-bit decimal
     */
    @Contract("_ -> new")
    public static @NotNull U32 parse(@NotNull String text) {
        return new U32(Integer.parseUnsignedInt(text));
    }

    public long longValue() {
        return Integer.toUnsignedLong(bits);
    }

    @Override
    public int compareTo(@NotNull U32 other) {
        return Integer.compareUnsigned(bits, other.bits);
    }

    @Override
    public String toString() {
        return Integer.toUnsignedString(bits);
    }
}
