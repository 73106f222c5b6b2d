package com.enumerant.types;

import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * Fixed-width integer operations for one width and signedness.
 * <p>
 * Every value is carried as the Java box type of matching size ({@link Byte}, {@link Short},
 * {@link Integer}, {@link Long}). Unsigned widths reuse the same box and read its bits unsigned,
 * so {@code UINT8} holds {@code (byte) 0xFF} for 255. All arithmetic is done on the bit pattern
 * widened to a {@code long} and truncated back to the width.
 * <p>
 * The shared instances are stateless and safe to use from any thread.
 */
public abstract class IntegralType<T extends Number> {

    public static final IntegralType<Byte> INT8 = new IntegralType<>("int8", 1, true) {
        @Override
        protected Byte box(long bits) {
            return (byte) bits;
        }
    };

    public static final IntegralType<Byte> UINT8 = new IntegralType<>("uint8", 1, false) {
        @Override
        protected Byte box(long bits) {
            return (byte) bits;
        }
    };

    public static final IntegralType<Short> INT16 = new IntegralType<>("int16", 2, true) {
        @Override
        protected Short box(long bits) {
            return (short) bits;
        }
    };

    public static final IntegralType<Short> UINT16 = new IntegralType<>("uint16", 2, false) {
        @Override
        protected Short box(long bits) {
            return (short) bits;
        }
    };

    public static final IntegralType<Integer> INT32 = new IntegralType<>("int32", 4, true) {
        @Override
        protected Integer box(long bits) {
            return (int) bits;
        }
    };

    public static final IntegralType<Integer> UINT32 = new IntegralType<>("uint32", 4, false) {
        @Override
        protected Integer box(long bits) {
            return (int) bits;
        }
    };

    public static final IntegralType<Long> INT64 = new IntegralType<>("int64", 8, true) {
        @Override
        protected Long box(long bits) {
            return bits;
        }
    };

    public static final IntegralType<Long> UINT64 = new IntegralType<>("uint64", 8, false) {
        @Override
        protected Long box(long bits) {
            return bits;
        }
    };

    private static final long MAX_BEFORE_TIMES_TEN = Long.divideUnsigned(-1L, 10);

    private static final List<IntegralType<?>> ALL = List.of(INT8, UINT8, INT16, UINT16, INT32, UINT32, INT64, UINT64);

    @Getter
    private final String name;
    @Getter
    private final int byteSize;
    @Getter
    private final boolean signed;

    private final int bitWidth;
    private final long mask;
    private final long minSigned;
    private final long maxSigned;
    private final String hexFormat;
    private final T zero;
    private final T one;

    private IntegralType(String name, int byteSize, boolean signed) {
        this.name = name;
        this.byteSize = byteSize;
        this.signed = signed;
        this.bitWidth = byteSize * Byte.SIZE;
        this.mask = bitWidth == Long.SIZE ? -1L : (1L << bitWidth) - 1;
        this.minSigned = bitWidth == Long.SIZE ? Long.MIN_VALUE : -(1L << (bitWidth - 1));
        this.maxSigned = bitWidth == Long.SIZE ? Long.MAX_VALUE : (1L << (bitWidth - 1)) - 1;
        this.hexFormat = "%0" + (byteSize * 2) + "X";
        this.zero = box(0L);
        this.one = box(1L);
    }

    /**
     * Truncate the low bits of {@code bits} into this width's box type.
     */
    protected abstract T box(long bits);

    public static List<IntegralType<?>> values() {
        return ALL;
    }

    public static IntegralType<?> forName(String name) {
        Objects.requireNonNull(name, "Type name cannot be null");
        for (var type : ALL) {
            if (type.name.equals(name))
                return type;
        }
        throw new IllegalArgumentException("Unknown integral type: " + name);
    }

    public int getBitWidth() {
        return bitWidth;
    }

    public T zero() {
        return zero;
    }

    public T one() {
        return one;
    }

    // ========== CONVERSION ==========

    /**
     * Numeric value of {@code value}: sign-extended for signed widths, zero-extended for unsigned ones.
     * For {@code UINT64} the result is the raw bit pattern and must be read with unsigned long methods.
     */
    public long toLong(T value) {
        long raw = value.longValue();
        return signed ? raw : raw & mask;
    }

    public boolean isInRange(long value) {
        if (signed)
            return value >= minSigned && value <= maxSigned;
        return value >= 0 && (bitWidth == Long.SIZE || value <= mask);
    }

    public boolean isInRangeUnsigned(long unsignedValue) {
        if (signed)
            return Long.compareUnsigned(unsignedValue, maxSigned) <= 0;
        return bitWidth == Long.SIZE || Long.compareUnsigned(unsignedValue, mask) <= 0;
    }

    /**
     * Convert without a range check, keeping only the low bits. Callers check {@link #isInRange(long)} first.
     */
    public T fromLong(long value) {
        return box(value);
    }

    // ========== ARITHMETIC AND BITWISE ==========

    public T add(T left, T right) {
        return box(left.longValue() + right.longValue());
    }

    public T subtract(T left, T right) {
        return box(left.longValue() - right.longValue());
    }

    public T and(T left, T right) {
        return box(left.longValue() & right.longValue());
    }

    public T or(T left, T right) {
        return box(left.longValue() | right.longValue());
    }

    public T xor(T left, T right) {
        return box(left.longValue() ^ right.longValue());
    }

    public T not(T value) {
        return box(~value.longValue());
    }

    public T leftShift(T value, int amount) {
        return box(value.longValue() << amount);
    }

    public boolean isZero(T value) {
        return (value.longValue() & mask) == 0;
    }

    public boolean equal(T left, T right) {
        return ((left.longValue() ^ right.longValue()) & mask) == 0;
    }

    /**
     * True for zero and for every value with exactly one bit set (including a lone sign bit).
     */
    public boolean isPowerOfTwoOrZero(T value) {
        long bits = value.longValue() & mask;
        return (bits & (bits - 1)) == 0;
    }

    public int bitCount(T value) {
        return Long.bitCount(value.longValue() & mask);
    }

    public int compare(T left, T right) {
        long l = toLong(left);
        long r = toLong(right);
        return signed ? Long.compare(l, r) : Long.compareUnsigned(l, r);
    }

    public boolean lessThan(T left, T right) {
        return compare(left, right) < 0;
    }

    // ========== TEXT ==========

    public String toDecimalString(T value) {
        long numeric = toLong(value);
        return signed ? Long.toString(numeric) : Long.toUnsignedString(numeric);
    }

    /**
     * Upper-case hex of the raw bits, zero-padded to two digits per byte of the width.
     */
    public String toHexString(T value) {
        return String.format(hexFormat, value.longValue() & mask);
    }

    /**
     * Parse base-10 text with an optional leading sign.
     *
     * @return the parsed value, or null if the text is not a decimal integer or is outside this width's range
     */
    public T parseDecimal(String text) {
        int length = text.length();
        if (length == 0)
            return null;
        int start = 0;
        boolean negative = false;
        char first = text.charAt(0);
        if (first == '-' || first == '+') {
            negative = first == '-';
            start = 1;
            if (length == 1)
                return null;
        }

        long magnitude = 0;
        for (int i = start; i < length; i++) {
            int digit = text.charAt(i) - '0';
            if (digit < 0 || digit > 9)
                return null;
            if (Long.compareUnsigned(magnitude, MAX_BEFORE_TIMES_TEN) > 0)
                return null;
            long shifted = magnitude * 10;
            long next = shifted + digit;
            if (Long.compareUnsigned(next, shifted) < 0)
                return null;
            magnitude = next;
        }

        if (signed) {
            if (negative) {
                // magnitude may be exactly 2^(w-1)
                if (Long.compareUnsigned(magnitude, -minSigned) > 0)
                    return null;
                return box(-magnitude);
            }
            return Long.compareUnsigned(magnitude, maxSigned) <= 0 ? box(magnitude) : null;
        }
        if (negative)
            return magnitude == 0 ? zero : null;
        return isInRangeUnsigned(magnitude) ? box(magnitude) : null;
    }

    /**
     * Parse unsigned hex digits (no sign, no prefix) as this width's raw bits.
     *
     * @return the parsed value, or null if the text is not 1 to {@code 2 * byteSize} hex digits
     */
    public T parseHex(String text) {
        int length = text.length();
        if (length == 0)
            return null;
        long bits = 0;
        int significant = 0;
        for (int i = 0; i < length; i++) {
            int digit = Character.digit(text.charAt(i), 16);
            if (digit < 0)
                return null;
            if (significant > 0 || digit != 0)
                significant++;
            if (significant > byteSize * 2)
                return null;
            bits = (bits << 4) | digit;
        }
        return box(bits);
    }

    @Override
    public String toString() {
        return name;
    }
}
