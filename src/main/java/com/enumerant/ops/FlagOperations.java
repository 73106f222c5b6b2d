package com.enumerant.ops;

import com.enumerant.Constants;
import com.enumerant.core.Member;
import com.enumerant.core.MemberCache;
import com.enumerant.error.EnumerantException;
import com.enumerant.error.ErrorType;
import com.enumerant.format.FormatPipeline;
import com.enumerant.format.Selector;
import com.enumerant.types.IntegralType;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;

/**
 * Bitmask algebra over a flag domain. Every operand is checked against the domain's flag union
 * (the OR of its single-bit primaries) and rejected with INVALID_FLAG_COMBINATION if it sets any
 * other bit.
 */
public final class FlagOperations<T extends Number> {

    private final MemberCache<T> cache;
    private final FormatPipeline<T> pipeline;
    private final IntegralType<T> type;
    private final T flagUnion;

    public FlagOperations(MemberCache<T> cache, FormatPipeline<T> pipeline) {
        this.cache = Objects.requireNonNull(cache, "Member cache cannot be null");
        this.pipeline = Objects.requireNonNull(pipeline, "Format pipeline cannot be null");
        if (!cache.isFlagDomain())
            throw new IllegalArgumentException(cache.getName() + " is not a flag domain");
        this.type = cache.getType();
        this.flagUnion = cache.getFlagUnion();
    }

    public T getAllFlags() {
        return flagUnion;
    }

    public boolean isValidFlagCombination(T value) {
        Objects.requireNonNull(value, "Value cannot be null");
        return type.equal(type.and(value, flagUnion), value);
    }

    // ========== PREDICATES ==========

    public boolean hasAnyFlags(T value) throws EnumerantException {
        return !type.isZero(checked(value));
    }

    public boolean hasAnyFlags(T value, T mask) throws EnumerantException {
        return !type.isZero(type.and(checked(value), checked(mask)));
    }

    /**
     * True if {@code value} sets every bit of the flag union.
     */
    public boolean hasAllFlags(T value) throws EnumerantException {
        return type.equal(checked(value), flagUnion);
    }

    public boolean hasAllFlags(T value, T mask) throws EnumerantException {
        checked(mask);
        return type.equal(type.and(checked(value), mask), mask);
    }

    // ========== COMBINATORS ==========

    public T commonFlags(T value, T mask) throws EnumerantException {
        return type.and(checked(value), checked(mask));
    }

    public T combineFlags(T value, T other) throws EnumerantException {
        return type.or(checked(value), checked(other));
    }

    @SafeVarargs
    public final T combineFlags(T... flags) throws EnumerantException {
        Objects.requireNonNull(flags, "Flags cannot be null");
        var combined = type.zero();
        for (var flag : flags) {
            combined = type.or(combined, checked(flag));
        }
        return combined;
    }

    public T combineFlags(Iterable<T> flags) throws EnumerantException {
        Objects.requireNonNull(flags, "Flags cannot be null");
        var combined = type.zero();
        for (var flag : flags) {
            combined = type.or(combined, checked(flag));
        }
        return combined;
    }

    /**
     * Flip every bit of the flag union.
     */
    public T toggleFlags(T value) throws EnumerantException {
        return type.xor(checked(value), flagUnion);
    }

    public T toggleFlags(T value, T mask) throws EnumerantException {
        return type.xor(checked(value), checked(mask));
    }

    public T excludeFlags(T value, T mask) throws EnumerantException {
        return type.and(checked(value), type.not(checked(mask)));
    }

    // ========== DECOMPOSITION ==========

    /**
     * Single-bit flags set in {@code value}, lowest bit first. The sequence is recomputed on every iteration.
     */
    public Iterable<T> getFlags(T value) throws EnumerantException {
        var bits = type.and(checked(value), flagUnion).longValue();
        int width = type.getBitWidth();
        return () -> new Iterator<>() {
            private long remaining = width == Long.SIZE ? bits : bits & ((1L << width) - 1);
            private int bit;

            @Override
            public boolean hasNext() {
                return remaining != 0;
            }

            @Override
            public T next() {
                if (remaining == 0)
                    throw new NoSuchElementException();
                while ((remaining & (1L << bit)) == 0) {
                    bit++;
                }
                remaining &= ~(1L << bit);
                return type.fromLong(1L << bit);
            }
        };
    }

    public List<Member<T>> getFlagMembers(T value) throws EnumerantException {
        var members = new ArrayList<Member<T>>();
        for (var flag : getFlags(value)) {
            cache.getByValue(flag).ifPresent(members::add);
        }
        return members;
    }

    public int getFlagCount() {
        return type.bitCount(flagUnion);
    }

    public int getFlagCount(T value) throws EnumerantException {
        return type.bitCount(checked(value));
    }

    // ========== TEXT ==========

    public String formatFlags(T value) throws EnumerantException {
        return formatFlags(value, Constants.DEFAULT_FLAG_DELIMITER, FormatPipeline.DEFAULT_SELECTORS);
    }

    /**
     * Render {@code value} directly if it is a defined member, otherwise as its flags joined by
     * {@code delimiter}. A flag no selector can render falls back to its decimal text.
     */
    public String formatFlags(T value, String delimiter, List<Selector> selectors) throws EnumerantException {
        Objects.requireNonNull(value, "Value cannot be null");
        var member = cache.getByValue(value);
        if (member.isPresent()) {
            var text = pipeline.formatMember(member.get(), selectors);
            if (text != null)
                return text;
        }
        checked(value);
        if (type.isZero(value))
            return "0";
        var separator = delimiter == null || delimiter.isEmpty() ? Constants.DEFAULT_FLAG_DELIMITER : delimiter;
        var joined = new StringBuilder();
        for (var flag : getFlags(value)) {
            if (joined.length() > 0)
                joined.append(separator);
            var text = pipeline.format(flag, selectors);
            joined.append(text != null ? text : type.toDecimalString(flag));
        }
        return joined.toString();
    }

    public T parseFlags(String text, boolean ignoreCase) throws EnumerantException {
        return parseFlags(text, ignoreCase, Constants.DEFAULT_FLAG_DELIMITER, FormatPipeline.DEFAULT_SELECTORS);
    }

    /**
     * Split on {@code delimiter}, parse each whitespace-trimmed token and OR the results.
     * The delimiter is matched trimmed unless trimming would leave it empty. Blank text parses to zero.
     *
     * @throws EnumerantException with the kind of the first failing token, naming that token
     */
    public T parseFlags(String text, boolean ignoreCase, String delimiter, List<Selector> selectors) throws EnumerantException {
        Objects.requireNonNull(text, "Text cannot be null");
        var separator = effectiveDelimiter(delimiter);
        var result = type.zero();
        int start = 0;
        int length = text.length();
        while (start < length) {
            while (start < length && Character.isWhitespace(text.charAt(start))) {
                start++;
            }
            if (start == length)
                break;
            int end = text.indexOf(separator, start);
            if (end < 0)
                end = length;
            int next = end + separator.length();
            var token = text.substring(start, end).trim();
            result = type.or(result, parseFlag(token, ignoreCase, selectors));
            start = next;
        }
        return result;
    }

    public Optional<T> tryParseFlags(String text, boolean ignoreCase, String delimiter, List<Selector> selectors) {
        if (text == null)
            return Optional.empty();
        try {
            return Optional.of(parseFlags(text, ignoreCase, delimiter, selectors));
        } catch (EnumerantException e) {
            return Optional.empty();
        }
    }

    // ========== INTERNALS ==========

    private T parseFlag(String token, boolean ignoreCase, List<Selector> selectors) throws EnumerantException {
        T value;
        try {
            value = pipeline.parse(token, ignoreCase, selectors);
        } catch (EnumerantException e) {
            throw new EnumerantException(e.getErrorType(),
                    "Invalid flag token '" + token + "' for " + cache.getName() + ": " + e.getMessage(), e);
        }
        if (!isValidFlagCombination(value))
            throw new EnumerantException(ErrorType.INVALID_FLAG_COMBINATION,
                    "Flag token '" + token + "' sets bits outside " + cache.getName() + " flags");
        return value;
    }

    private T checked(T value) throws EnumerantException {
        if (!isValidFlagCombination(value))
            throw new EnumerantException(ErrorType.INVALID_FLAG_COMBINATION,
                    type.toDecimalString(value) + " is not a valid flag combination of " + cache.getName());
        return value;
    }

    private static String effectiveDelimiter(String delimiter) {
        if (delimiter == null || delimiter.isEmpty())
            delimiter = Constants.DEFAULT_FLAG_DELIMITER;
        var trimmed = delimiter.trim();
        return trimmed.isEmpty() ? delimiter : trimmed;
    }
}
