package com.enumerant.format;

import com.enumerant.Constants;
import com.enumerant.core.Member;
import com.enumerant.core.MemberCache;
import com.enumerant.error.EnumerantException;
import com.enumerant.error.ErrorType;
import com.enumerant.types.IntegralType;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMaps;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import lombok.Value;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Value to text and text to value resolution over one member cache.
 * <p>
 * Formatting walks the selector list left to right and returns the first non-null text.
 * Parsing tries a plain decimal literal first, then each selector in order. Selectors that
 * cannot be inverted arithmetically (description, member value, custom) are answered from a reverse lookup
 * built the first time that selector is parsed with.
 */
public final class FormatPipeline<T extends Number> {
    public static final List<Selector> DEFAULT_SELECTORS = List.of(Selector.NAME, Selector.DECIMAL);

    private final MemberCache<T> cache;
    private final IntegralType<T> type;
    private final FormatterRegistry<Function<? super Member<T>, String>> domainFormatters;
    // Copy-on-write; entries are never replaced once published
    private final AtomicReference<Int2ObjectMap<ReverseLookup<T>>> reverseLookups =
            new AtomicReference<>(Int2ObjectMaps.emptyMap());

    public FormatPipeline(MemberCache<T> cache) {
        this.cache = Objects.requireNonNull(cache, "Member cache cannot be null");
        this.type = cache.getType();
        this.domainFormatters = new FormatterRegistry<>(cache.getName(), Constants.DOMAIN_SELECTOR_BASE);
    }

    /**
     * Register a formatter that only this value set understands.
     * The function may return null to mean "does not resolve".
     */
    public Selector registerSelector(Function<? super Member<T>, String> formatter) {
        return domainFormatters.register(formatter);
    }

    // ========== FORMAT ==========

    public String format(T value, Selector... selectors) {
        return format(value, Arrays.asList(selectors));
    }

    /**
     * @return the first non-null text produced by {@code selectors}, or null if none resolves
     * @throws IllegalArgumentException if a selector is neither built in nor issued by this value set
     *                                  or the process-wide registry
     */
    public String format(T value, List<Selector> selectors) {
        Objects.requireNonNull(value, "Value cannot be null");
        Member<T> member = null;
        boolean looked = false;
        for (var selector : orDefault(selectors)) {
            String text;
            switch (selector.getId()) {
                case 0:
                    text = type.toDecimalString(value);
                    break;
                case 1:
                    text = type.toHexString(value);
                    break;
                default:
                    var formatter = formatterFor(selector);
                    if (!looked) {
                        member = cache.getByValue(value).orElse(null);
                        looked = true;
                    }
                    text = member == null ? null : formatter.apply(member);
            }
            if (text != null)
                return text;
        }
        return null;
    }

    /**
     * Format a member that is already resolved, so aliases render under their own name.
     */
    public String formatMember(Member<T> member, List<Selector> selectors) {
        Objects.requireNonNull(member, "Member cannot be null");
        for (var selector : orDefault(selectors)) {
            var text = formatterFor(selector).apply(member);
            if (text != null)
                return text;
        }
        return null;
    }

    // ========== PARSE ==========

    public T parse(String text, boolean ignoreCase, Selector... selectors) throws EnumerantException {
        return parse(text, ignoreCase, Arrays.asList(selectors));
    }

    /**
     * @throws EnumerantException OUT_OF_RANGE if the text is a decimal literal outside the width,
     *                            PARSE_FAILURE if nothing else matches
     */
    public T parse(String text, boolean ignoreCase, List<Selector> selectors) throws EnumerantException {
        return resolve(text, ignoreCase, selectors).getValue();
    }

    public Optional<T> tryParse(String text, boolean ignoreCase, List<Selector> selectors) {
        Objects.requireNonNull(text, "Text cannot be null");
        var match = match(text.trim(), ignoreCase, orDefault(selectors));
        return match == null ? Optional.empty() : Optional.of(match.getValue());
    }

    /**
     * Parse to the matched member. A name or tag match returns that exact member (alias included);
     * a numeric match returns the primary for the value.
     *
     * @throws EnumerantException INVALID_VALUE if a numeric match is not a defined value
     */
    public Member<T> parseMember(String text, boolean ignoreCase, List<Selector> selectors) throws EnumerantException {
        var match = resolve(text, ignoreCase, selectors);
        if (match.getMember() != null)
            return match.getMember();
        var value = match.getValue();
        return cache.getByValue(value).orElseThrow(() -> new EnumerantException(ErrorType.INVALID_VALUE,
                "Value " + type.toDecimalString(value) + " is not defined in " + cache.getName()));
    }

    // ========== INTERNALS ==========

    private Match<T> resolve(String text, boolean ignoreCase, List<Selector> selectors) throws EnumerantException {
        Objects.requireNonNull(text, "Text cannot be null");
        var trimmed = text.trim();
        if (trimmed.isEmpty())
            throw new EnumerantException(ErrorType.PARSE_FAILURE, "Text is empty or whitespace for " + cache.getName());
        var match = match(trimmed, ignoreCase, orDefault(selectors));
        if (match != null)
            return match;
        if (isDecimalLiteral(trimmed))
            throw new EnumerantException(ErrorType.OUT_OF_RANGE,
                    "'" + trimmed + "' is outside the range of " + type + " for " + cache.getName());
        throw new EnumerantException(ErrorType.PARSE_FAILURE,
                "'" + trimmed + "' does not match any member of " + cache.getName());
    }

    private Match<T> match(String trimmed, boolean ignoreCase, List<Selector> selectors) {
        if (trimmed.isEmpty())
            return null;
        if (isDecimalLiteral(trimmed)) {
            var value = type.parseDecimal(trimmed);
            if (value != null)
                return new Match<>(value, null);
        }
        for (var selector : selectors) {
            switch (selector.getId()) {
                case 0: {
                    var value = type.parseDecimal(trimmed);
                    if (value != null)
                        return new Match<>(value, null);
                    break;
                }
                case 1: {
                    var value = type.parseHex(trimmed);
                    if (value != null)
                        return new Match<>(value, null);
                    break;
                }
                case 2: {
                    var member = cache.getByName(trimmed, ignoreCase);
                    if (member.isPresent())
                        return new Match<>(member.get().getValue(), member.get());
                    break;
                }
                default: {
                    var member = reverseLookup(selector).find(trimmed, ignoreCase);
                    if (member != null)
                        return new Match<>(member.getValue(), member);
                }
            }
        }
        return null;
    }

    private ReverseLookup<T> reverseLookup(Selector selector) {
        // Resolved before the cache so a selector issued elsewhere never reaches a slot with the same id
        var formatter = formatterFor(selector);
        var current = reverseLookups.get();
        var existing = current.get(selector.getId());
        if (existing != null)
            return existing;
        var built = ReverseLookup.build(cache, selector, formatter::apply);
        while (true) {
            existing = current.get(selector.getId());
            if (existing != null)
                return existing;
            var next = new Int2ObjectOpenHashMap<ReverseLookup<T>>(current);
            next.put(selector.getId(), built);
            if (reverseLookups.compareAndSet(current, next))
                return built;
            current = reverseLookups.get();
        }
    }

    private Function<? super Member<T>, String> formatterFor(Selector selector) {
        Objects.requireNonNull(selector, "Selector cannot be null");
        switch (selector.getId()) {
            case 0:
                return member -> type.toDecimalString(member.getValue());
            case 1:
                return member -> type.toHexString(member.getValue());
            case 2:
                return Member::getName;
            case 3:
                return Member::getDescription;
            case 4:
                return Member::getMemberValue;
            default:
                if (domainFormatters.issued(selector))
                    return domainFormatters.lookup(selector.getId());
                var global = CustomSelectors.lookup(selector);
                if (global != null)
                    return global;
                throw new IllegalArgumentException("Unknown selector " + selector + " for " + cache.getName());
        }
    }

    private static List<Selector> orDefault(List<Selector> selectors) {
        return selectors == null || selectors.isEmpty() ? DEFAULT_SELECTORS : selectors;
    }

    /**
     * Optional sign followed by at least one ASCII digit and nothing else.
     */
    static boolean isDecimalLiteral(String text) {
        int length = text.length();
        int start = length > 0 && (text.charAt(0) == '-' || text.charAt(0) == '+') ? 1 : 0;
        if (start == length)
            return false;
        for (int i = start; i < length; i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9')
                return false;
        }
        return true;
    }

    @Value
    private static class Match<T extends Number> {
        T value;
        Member<T> member;
    }
}
