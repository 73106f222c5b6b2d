package com.enumerant.core;

import com.enumerant.types.IntegralType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A fluent builder for value sets. Members are kept in declaration order; the member cache
 * sorts them, resolves duplicate values and hoists description tags at build time.
 * <p>
 * Usage:
 * <pre>
 *   var access = ValueSet.builder("Access", IntegralType.INT32)
 *       .flags()
 *       .member("None", 0)
 *       .member("Read", 1, new Description("read access"))
 *       .member("Write", 2)
 *       .member("ReadWrite", 3)
 *       .build();
 * </pre>
 */
public final class ValueSetBuilder<T extends Number> {
    private final String name;
    private final IntegralType<T> type;
    private final List<RawMember<T>> members = new ArrayList<>();
    private boolean flagDomain;
    private TagInspector tagInspector = TagInspector.DEFAULT;
    private ValueValidator<T> validator;

    ValueSetBuilder(String name, IntegralType<T> type) {
        this.name = Objects.requireNonNull(name, "Value set name cannot be null");
        this.type = Objects.requireNonNull(type, "Integral type cannot be null");
    }

    /**
     * Mark the set as a bitmask domain, enabling flag operations.
     */
    public ValueSetBuilder<T> flags() {
        this.flagDomain = true;
        return this;
    }

    public ValueSetBuilder<T> tagInspector(TagInspector tagInspector) {
        this.tagInspector = Objects.requireNonNull(tagInspector, "Tag inspector cannot be null");
        return this;
    }

    /**
     * Replace the built-in check used by {@link Validation#DEFAULT}. The other validation modes ignore it.
     */
    public ValueSetBuilder<T> validator(ValueValidator<T> validator) {
        this.validator = Objects.requireNonNull(validator, "Validator cannot be null");
        return this;
    }

    /**
     * Add a member whose value is read as a signed 64-bit number.
     *
     * @throws IllegalArgumentException if the value does not fit this set's integral type
     */
    public ValueSetBuilder<T> member(String memberName, long value, Object... tags) {
        Objects.requireNonNull(memberName, "Member name cannot be null");
        if (!type.isInRange(value))
            throw new IllegalArgumentException("Value " + value + " of " + name + "." + memberName + " is out of range for " + type);
        return add(memberName, type.fromLong(value), tags);
    }

    /**
     * Add a member whose value is read as an unsigned 64-bit number, for the upper half of {@code uint64}.
     */
    public ValueSetBuilder<T> memberUnsigned(String memberName, long value, Object... tags) {
        Objects.requireNonNull(memberName, "Member name cannot be null");
        if (!type.isInRangeUnsigned(value))
            throw new IllegalArgumentException("Value " + Long.toUnsignedString(value) + " of " + name + "." + memberName + " is out of range for " + type);
        return add(memberName, type.fromLong(value), tags);
    }

    public ValueSetBuilder<T> member(RawMember<T> member) {
        Objects.requireNonNull(member, "Member cannot be null");
        members.add(member);
        return this;
    }

    public ValueSet<T> build() {
        var cache = MemberCache.build(name, type, flagDomain, tagInspector, members);
        return new ValueSet<>(cache, validator);
    }

    private ValueSetBuilder<T> add(String memberName, T value, Object[] tags) {
        List<Object> tagList = tags == null || tags.length == 0 ? List.of() : new ArrayList<>(Arrays.asList(tags));
        members.add(new RawMember<>(memberName, value, tagList));
        return this;
    }
}
