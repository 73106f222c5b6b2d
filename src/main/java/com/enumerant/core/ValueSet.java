package com.enumerant.core;

import com.enumerant.error.EnumerantException;
import com.enumerant.error.ErrorType;
import com.enumerant.format.FormatPipeline;
import com.enumerant.format.Selector;
import com.enumerant.ops.FlagOperations;
import com.enumerant.types.IntegralType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * A closed set of named integral constants: member lookups, validation, formatting, parsing and,
 * for flag domains, bitmask operations.
 * <p>
 * Instances are immutable apart from append-only custom selector registration and lazily built
 * lookup tables, and are safe to share between threads.
 */
public final class ValueSet<T extends Number> {
    private final MemberCache<T> cache;
    private final FormatPipeline<T> pipeline;
    // Null unless this is a flag domain
    private final FlagOperations<T> flagOperations;
    // Null unless the builder was given one
    private final ValueValidator<T> validator;

    ValueSet(MemberCache<T> cache, ValueValidator<T> validator) {
        this.cache = cache;
        this.validator = validator;
        this.pipeline = new FormatPipeline<>(cache);
        this.flagOperations = cache.isFlagDomain() ? new FlagOperations<>(cache, pipeline) : null;
    }

    public static <T extends Number> ValueSetBuilder<T> builder(String name, IntegralType<T> type) {
        return new ValueSetBuilder<>(name, type);
    }

    public String getName() {
        return cache.getName();
    }

    public IntegralType<T> getType() {
        return cache.getType();
    }

    public boolean isFlagDomain() {
        return cache.isFlagDomain();
    }

    public MemberCache<T> getCache() {
        return cache;
    }

    public Contiguity<T> getContiguity() {
        return cache.getContiguity();
    }

    /**
     * Flag operations for this set.
     *
     * @throws IllegalStateException if the set was not built as a flag domain
     */
    public FlagOperations<T> flags() {
        if (flagOperations == null)
            throw new IllegalStateException(getName() + " is not a flag domain");
        return flagOperations;
    }

    // ========== MEMBERS ==========

    public Optional<Member<T>> getMember(T value) {
        return cache.getByValue(Objects.requireNonNull(value, "Value cannot be null"));
    }

    public Optional<Member<T>> getMember(String name) {
        return cache.getByName(name, false);
    }

    public Optional<Member<T>> getMember(String name, boolean ignoreCase) {
        return cache.getByName(name, ignoreCase);
    }

    public Optional<String> getName(T value) {
        return getMember(value).map(Member::getName);
    }

    public Optional<String> getDescription(T value) {
        return getMember(value).map(Member::getDescription);
    }

    public Iterable<Member<T>> getMembers(boolean includeAliases) {
        return cache.members(includeAliases);
    }

    public List<String> getNames(boolean includeAliases) {
        var names = new ArrayList<String>(cache.count(includeAliases));
        for (var member : cache.members(includeAliases)) {
            names.add(member.getName());
        }
        return names;
    }

    /**
     * Values in ascending order; with aliases a duplicated value appears once per member.
     */
    public List<T> getValues(boolean includeAliases) {
        var values = new ArrayList<T>(cache.count(includeAliases));
        for (var member : cache.members(includeAliases)) {
            values.add(member.getValue());
        }
        return values;
    }

    public int count(boolean includeAliases) {
        return cache.count(includeAliases);
    }

    // ========== VALIDATION AND CONVERSION ==========

    public boolean isDefined(T value) {
        return cache.isDefined(Objects.requireNonNull(value, "Value cannot be null"));
    }

    /**
     * Same as {@link #isValid(Number, Validation)} with {@link Validation#DEFAULT}.
     */
    public boolean isValid(T value) {
        return isValid(value, Validation.DEFAULT);
    }

    /**
     * @throws IllegalStateException for {@link Validation#IS_VALID_FLAG_COMBINATION} on a set that is not a flag domain
     */
    public boolean isValid(T value, Validation validation) {
        Objects.requireNonNull(value, "Value cannot be null");
        Objects.requireNonNull(validation, "Validation cannot be null");
        switch (validation) {
            case NONE:
                return true;
            case IS_DEFINED:
                return cache.isDefined(value);
            case IS_VALID_FLAG_COMBINATION:
                return flags().isValidFlagCombination(value);
            default:
                if (validator != null)
                    return validator.isValid(value);
                if (flagOperations != null && flagOperations.isValidFlagCombination(value))
                    return true;
                return cache.isDefined(value);
        }
    }

    public T validate(T value) throws EnumerantException {
        return validate(value, Validation.DEFAULT);
    }

    /**
     * @return {@code value} unchanged
     * @throws EnumerantException INVALID_VALUE if {@code value} fails {@code validation}
     */
    public T validate(T value, Validation validation) throws EnumerantException {
        if (!isValid(value, validation))
            throw new EnumerantException(ErrorType.INVALID_VALUE,
                    "Invalid value " + asString(value) + " for " + getName() + " under " + validation + " validation");
        return value;
    }

    /**
     * Convert and validate in one step.
     *
     * @throws EnumerantException OUT_OF_RANGE if the number does not fit, INVALID_VALUE if it fails {@code validation}
     */
    public T toValue(long value, Validation validation) throws EnumerantException {
        return validate(toValue(value), validation);
    }

    public T toValue(long value) throws EnumerantException {
        if (!getType().isInRange(value))
            throw new EnumerantException(ErrorType.OUT_OF_RANGE, "Value " + value + " is outside the range of " + getType() + " for " + getName());
        return getType().fromLong(value);
    }

    public T toValueUnsigned(long value) throws EnumerantException {
        if (!getType().isInRangeUnsigned(value))
            throw new EnumerantException(ErrorType.OUT_OF_RANGE,
                    "Value " + Long.toUnsignedString(value) + " is outside the range of " + getType() + " for " + getName());
        return getType().fromLong(value);
    }

    public int compare(T left, T right) {
        return getType().compare(left, right);
    }

    // ========== FORMAT ==========

    /**
     * Default rendering: flags joined by ", " for flag domains, otherwise the name or the decimal value.
     */
    public String asString(T value) {
        Objects.requireNonNull(value, "Value cannot be null");
        if (flagOperations != null && (flagOperations.isValidFlagCombination(value) || cache.getByValue(value).isPresent())) {
            try {
                return flagOperations.formatFlags(value);
            } catch (EnumerantException e) {
                throw new IllegalStateException("Valid flag combination failed to format: " + e.getMessage(), e);
            }
        }
        return pipeline.format(value, FormatPipeline.DEFAULT_SELECTORS);
    }

    public String format(T value, Selector... selectors) {
        return pipeline.format(value, Arrays.asList(selectors));
    }

    public String format(T value, List<Selector> selectors) {
        return pipeline.format(value, selectors);
    }

    /**
     * Single-letter format strings, either case: G (same as {@link #asString}), F (flags),
     * D (decimal), X (hex).
     */
    public String format(T value, String format) {
        Objects.requireNonNull(format, "Format cannot be null");
        switch (format.toUpperCase(Locale.ROOT)) {
            case "G":
                return asString(value);
            case "F":
                if (flagOperations == null)
                    return asString(value);
                try {
                    return flagOperations.formatFlags(value);
                } catch (EnumerantException e) {
                    // Not a flag combination: render as a plain value
                    return pipeline.format(value, FormatPipeline.DEFAULT_SELECTORS);
                }
            case "D":
                return pipeline.format(value, Selector.DECIMAL);
            case "X":
                return pipeline.format(value, Selector.HEX);
            default:
                throw new IllegalArgumentException("Format must be one of G, F, D or X, got: " + format);
        }
    }

    public Selector registerSelector(Function<? super Member<T>, String> formatter) {
        return pipeline.registerSelector(formatter);
    }

    // ========== PARSE ==========

    public T parse(String text) throws EnumerantException {
        return pipeline.parse(text, false, FormatPipeline.DEFAULT_SELECTORS);
    }

    public T parse(String text, boolean ignoreCase) throws EnumerantException {
        return pipeline.parse(text, ignoreCase, FormatPipeline.DEFAULT_SELECTORS);
    }

    public T parse(String text, boolean ignoreCase, Selector... selectors) throws EnumerantException {
        return pipeline.parse(text, ignoreCase, Arrays.asList(selectors));
    }

    public T parse(String text, boolean ignoreCase, List<Selector> selectors) throws EnumerantException {
        return pipeline.parse(text, ignoreCase, selectors);
    }

    public Optional<T> tryParse(String text, boolean ignoreCase, Selector... selectors) {
        if (text == null)
            return Optional.empty();
        return pipeline.tryParse(text, ignoreCase, Arrays.asList(selectors));
    }

    public Member<T> parseMember(String text, boolean ignoreCase, Selector... selectors) throws EnumerantException {
        return pipeline.parseMember(text, ignoreCase, Arrays.asList(selectors));
    }

    @Override
    public String toString() {
        return "ValueSet{" + getName() + ", " + getType() + (isFlagDomain() ? ", flags" : "") + "}";
    }
}
