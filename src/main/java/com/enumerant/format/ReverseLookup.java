package com.enumerant.format;

import com.enumerant.core.Member;
import com.enumerant.core.MemberCache;
import com.enumerant.util.IgnoreCaseStrategy;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenCustomHashMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Text to member table for one selector, built from every cached member's resolved text.
 * Primaries are visited before aliases and the first member to claim a text keeps it.
 */
final class ReverseLookup<T extends Number> {
    private static final Logger log = LoggerFactory.getLogger(ReverseLookup.class);

    private final MemberCache<T> cache;
    private final Selector selector;
    private final Object2ObjectLinkedOpenHashMap<String, Member<T>> exact;
    private final AtomicReference<Object2ObjectOpenCustomHashMap<String, Member<T>>> ignoreCase = new AtomicReference<>();

    private ReverseLookup(MemberCache<T> cache, Selector selector, Object2ObjectLinkedOpenHashMap<String, Member<T>> exact) {
        this.cache = cache;
        this.selector = selector;
        this.exact = exact;
    }

    static <T extends Number> ReverseLookup<T> build(MemberCache<T> cache, Selector selector, Function<Member<T>, String> resolver) {
        var exact = new Object2ObjectLinkedOpenHashMap<String, Member<T>>(cache.count(true));
        for (var member : cache.getPrimaries()) {
            putFirst(exact, resolver.apply(member), member);
        }
        for (var member : cache.getAliases()) {
            putFirst(exact, resolver.apply(member), member);
        }
        log.debug("Built reverse lookup for selector {} on '{}' with {} entries", selector, cache.getName(), exact.size());
        return new ReverseLookup<>(cache, selector, exact);
    }

    Member<T> find(String text, boolean ignoringCase) {
        var member = exact.get(text);
        if (member != null || !ignoringCase)
            return member;
        return ignoreCaseTable().get(text);
    }

    int size() {
        return exact.size();
    }

    private Object2ObjectOpenCustomHashMap<String, Member<T>> ignoreCaseTable() {
        var current = ignoreCase.get();
        if (current != null)
            return current;
        var built = new Object2ObjectOpenCustomHashMap<String, Member<T>>(exact.size(), IgnoreCaseStrategy.INSTANCE);
        // Insertion order of the exact table is member order, so case collisions resolve the same way
        for (var entry : exact.object2ObjectEntrySet()) {
            built.putIfAbsent(entry.getKey(), entry.getValue());
        }
        log.debug("Built case-insensitive reverse lookup for selector {} on '{}'", selector, cache.getName());
        return ignoreCase.compareAndSet(null, built) ? built : ignoreCase.get();
    }

    private static <T extends Number> void putFirst(Object2ObjectLinkedOpenHashMap<String, Member<T>> table, String text, Member<T> member) {
        if (text != null)
            table.putIfAbsent(text, member);
    }
}
