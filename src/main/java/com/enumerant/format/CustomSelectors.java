package com.enumerant.format;

import com.enumerant.Constants;
import com.enumerant.core.Member;
import lombok.experimental.UtilityClass;

import java.util.function.Function;

/**
 * Process-wide custom formatters, usable with every value set.
 * <p>
 * The backing registry is append-only and lives for the whole process: its slot table is created
 * by the first registration and read freely afterwards. Formatters for a single value set are
 * registered on that set's {@link FormatPipeline} instead.
 */
@UtilityClass
public class CustomSelectors {

    private static final FormatterRegistry<Function<? super Member<?>, String>> GLOBAL =
            new FormatterRegistry<>("global", Constants.GLOBAL_SELECTOR_BASE);

    /**
     * Register a formatter for every value set. The function may return null to mean "does not resolve".
     */
    public static Selector register(Function<? super Member<?>, String> formatter) {
        return GLOBAL.register(formatter);
    }

    /**
     * True for a selector returned by {@link #register}, or a raw {@link Selector#of(int)} id this
     * registry has handed out.
     */
    public static boolean isRegistered(Selector selector) {
        if (selector.issuer() == null)
            return GLOBAL.owns(selector.getId());
        return GLOBAL.issued(selector);
    }

    static Function<? super Member<?>, String> lookup(Selector selector) {
        return isRegistered(selector) ? GLOBAL.lookup(selector.getId()) : null;
    }
}
