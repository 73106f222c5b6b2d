package com.enumerant;

public final class Constants {
    public static final String DEFAULT_FLAG_DELIMITER = ", ";
    public static final int GLOBAL_SELECTOR_BASE = 100;
    public static final int DOMAIN_SELECTOR_BASE = 10_000;
    public static final int MAX_CUSTOM_SELECTORS = 1024;

    private Constants() {}
}
