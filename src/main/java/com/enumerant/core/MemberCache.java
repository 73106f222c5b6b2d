package com.enumerant.core;

import com.enumerant.types.IntegralType;
import com.enumerant.util.IgnoreCaseStrategy;
import com.enumerant.util.OrderedBiIndex;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenCustomHashMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Immutable metadata for one value set: primaries by value and name, aliases, contiguity and flag union.
 * <p>
 * Construction walks the raw members once:
 * - an unseen value becomes a primary, inserted at its ascending position by scanning back from the tail
 * - a seen value becomes an alias, unless it carries the primary marker, in which case it takes over
 *   the primary slot and the previous primary becomes the alias
 * <p>
 * The backward scan is linear per insert, so input in roughly ascending order builds in near O(n)
 * while adversarially ordered input costs O(n^2). Caches are built once per domain, so this is kept.
 * <p>
 * After construction the only mutation is the lazily built case-insensitive name index, which is a
 * pure function of the immutable tables and is published by reference swap.
 */
public final class MemberCache<T extends Number> {
    private static final Logger log = LoggerFactory.getLogger(MemberCache.class);

    @Getter
    private final String name;
    @Getter
    private final IntegralType<T> type;
    @Getter
    private final boolean flagDomain;
    // OR of every single-bit (or zero) primary value; zero for non-flag domains
    @Getter
    private final T flagUnion;
    @Getter
    private final Contiguity<T> contiguity;

    private final OrderedBiIndex<T, String> primaryIndex;
    // Aligned with primaryIndex positions
    private final List<Member<T>> primaries;
    // Ascending by value, stable for equal values
    private final List<Member<T>> aliases;
    private final Object2ObjectOpenHashMap<String, Member<T>> aliasesByName;
    private final AtomicReference<Object2ObjectOpenCustomHashMap<String, Member<T>>> ignoreCaseNames = new AtomicReference<>();

    private MemberCache(String name, IntegralType<T> type, boolean flagDomain, T flagUnion,
                        OrderedBiIndex<T, String> primaryIndex, List<Member<T>> primaries, List<Member<T>> aliases) {
        this.name = name;
        this.type = type;
        this.flagDomain = flagDomain;
        this.flagUnion = flagUnion;
        this.primaryIndex = primaryIndex;
        this.primaries = primaries;
        this.aliases = aliases;
        this.aliasesByName = new Object2ObjectOpenHashMap<>(aliases.size());
        for (var alias : aliases) {
            aliasesByName.put(alias.getName(), alias);
        }
        this.contiguity = summarize(type, primaries);
    }

    /**
     * Build a cache from raw members in declaration order.
     *
     * @throws NullPointerException if a member, name or value is null
     * @throws IllegalArgumentException if two members share a name
     */
    public static <T extends Number> MemberCache<T> build(String name, IntegralType<T> type, boolean flagDomain,
                                                          TagInspector inspector, List<RawMember<T>> rawMembers) {
        Objects.requireNonNull(name, "Value set name cannot be null");
        Objects.requireNonNull(type, "Integral type cannot be null");
        Objects.requireNonNull(inspector, "Tag inspector cannot be null");
        Objects.requireNonNull(rawMembers, "Members cannot be null");

        var index = new OrderedBiIndex<T, String>(rawMembers.size());
        var primaryByName = new Object2ObjectOpenHashMap<String, Member<T>>(rawMembers.size());
        var aliases = new ArrayList<Member<T>>();
        var seenNames = new ObjectOpenHashSet<String>(rawMembers.size());
        var flagUnion = type.zero();

        for (var raw : rawMembers) {
            Objects.requireNonNull(raw, "Member cannot be null in " + name);
            var memberName = Objects.requireNonNull(raw.getName(), "Member name cannot be null in " + name);
            var value = Objects.requireNonNull(raw.getValue(), "Member value cannot be null for " + name + "." + memberName);
            if (!seenNames.add(memberName))
                throw new IllegalArgumentException("Duplicate member name " + name + "." + memberName);

            var member = hoist(value, memberName, raw.getTags(), inspector);
            boolean forcePrimary = false;
            for (var tag : member.getTags()) {
                if (inspector.isPrimaryMarker(tag)) {
                    forcePrimary = true;
                    break;
                }
            }

            int existing = index.indexOfFirst(value);
            if (existing < 0) {
                int position = index.size();
                while (position > 0 && type.compare(index.getFirstAt(position - 1), value) > 0) {
                    position--;
                }
                index.insert(position, value, memberName);
                primaryByName.put(memberName, member);
                if (flagDomain && type.isPowerOfTwoOrZero(value))
                    flagUnion = type.or(flagUnion, value);
            } else if (forcePrimary) {
                var displacedName = index.getSecondAt(existing);
                index.replaceSecondAt(existing, memberName);
                aliases.add(primaryByName.remove(displacedName));
                primaryByName.put(memberName, member);
            } else {
                aliases.add(member);
            }
        }
        index.trimToSize();

        var primaries = new ArrayList<Member<T>>(index.size());
        for (int i = 0; i < index.size(); i++) {
            primaries.add(primaryByName.get(index.getSecondAt(i)));
        }
        aliases.sort((a, b) -> type.compare(a.getValue(), b.getValue()));

        var cache = new MemberCache<>(name, type, flagDomain, flagUnion, index,
                Collections.unmodifiableList(primaries), Collections.unmodifiableList(aliases));
        if (log.isDebugEnabled()) {
            log.debug("Built member cache '{}' ({}): {} primaries, {} aliases, contiguous={}",
                    name, type, primaries.size(), aliases.size(), cache.contiguity.isContiguous());
        }
        return cache;
    }

    // ========== QUERIES ==========

    public Optional<Member<T>> getByValue(T value) {
        int index = primaryIndex.indexOfFirst(value);
        return index >= 0 ? Optional.of(primaries.get(index)) : Optional.empty();
    }

    /**
     * Look up by exact primary name, then exact alias name, then (if asked) ignoring case.
     */
    public Optional<Member<T>> getByName(String memberName, boolean ignoreCase) {
        Objects.requireNonNull(memberName, "Name cannot be null");
        int index = primaryIndex.indexOfSecond(memberName);
        if (index >= 0)
            return Optional.of(primaries.get(index));
        var alias = aliasesByName.get(memberName);
        if (alias != null)
            return Optional.of(alias);
        if (ignoreCase)
            return Optional.ofNullable(ignoreCaseIndex().get(memberName));
        return Optional.empty();
    }

    public boolean isDefined(T value) {
        if (contiguity.isContiguous())
            return type.compare(contiguity.getMin(), value) <= 0 && type.compare(value, contiguity.getMax()) <= 0;
        return primaryIndex.containsFirst(value);
    }

    public int count(boolean includeAliases) {
        return primaries.size() + (includeAliases ? aliases.size() : 0);
    }

    /**
     * Members in ascending value order. With aliases, each alias follows the primary of its value.
     * The returned iterable can be iterated any number of times.
     */
    public Iterable<Member<T>> members(boolean includeAliases) {
        if (!includeAliases || aliases.isEmpty())
            return primaries;
        return () -> new MergeIterator();
    }

    public List<Member<T>> getPrimaries() {
        return primaries;
    }

    public List<Member<T>> getAliases() {
        return aliases;
    }

    // ========== INTERNALS ==========

    private Object2ObjectOpenCustomHashMap<String, Member<T>> ignoreCaseIndex() {
        var current = ignoreCaseNames.get();
        if (current != null)
            return current;
        var built = new Object2ObjectOpenCustomHashMap<String, Member<T>>(count(true), IgnoreCaseStrategy.INSTANCE);
        for (var member : primaries) {
            built.putIfAbsent(member.getName(), member);
        }
        for (var member : aliases) {
            built.putIfAbsent(member.getName(), member);
        }
        // Losing the race is harmless: every thread builds the same map
        return ignoreCaseNames.compareAndSet(null, built) ? built : ignoreCaseNames.get();
    }

    private static <T extends Number> Member<T> hoist(T value, String name, List<Object> rawTags, TagInspector inspector) {
        if (rawTags == null || rawTags.isEmpty())
            return new Member<>(value, name, List.of(), null, null);
        for (var tag : rawTags) {
            Objects.requireNonNull(tag, "Tags cannot contain null for member " + name);
        }
        var tags = new ArrayList<>(rawTags);
        String description = null;
        for (int i = 0; i < tags.size(); i++) {
            var tag = tags.get(i);
            description = inspector.preferredText(tag);
            if (description != null) {
                tags.remove(i);
                tags.add(0, tag);
                break;
            }
        }
        String memberValue = null;
        for (var tag : tags) {
            memberValue = inspector.memberValueText(tag);
            if (memberValue != null)
                break;
        }
        return new Member<>(value, name, Collections.unmodifiableList(tags), description, memberValue);
    }

    private static <T extends Number> Contiguity<T> summarize(IntegralType<T> type, List<Member<T>> primaries) {
        if (primaries.isEmpty())
            return Contiguity.empty();
        var min = primaries.get(0).getValue();
        var max = primaries.get(primaries.size() - 1).getValue();
        // Unsigned distance is exact for every width, including the full 64-bit ranges
        long span = type.toLong(max) - type.toLong(min) + 1;
        return new Contiguity<>(min, max, span == primaries.size());
    }

    private final class MergeIterator implements Iterator<Member<T>> {
        private int primary;
        private int alias;

        @Override
        public boolean hasNext() {
            return primary < primaries.size() || alias < aliases.size();
        }

        @Override
        public Member<T> next() {
            if (!hasNext())
                throw new NoSuchElementException();
            if (alias < aliases.size() && (primary >= primaries.size()
                    || type.lessThan(aliases.get(alias).getValue(), primaries.get(primary).getValue()))) {
                return aliases.get(alias++);
            }
            return primaries.get(primary++);
        }
    }

    @Override
    public String toString() {
        return "MemberCache{" + name + ", " + type + ", primaries=" + primaries.size() + ", aliases=" + aliases.size() + "}";
    }
}
