package com.enumerant.util;

import lombok.experimental.UtilityClass;

import java.util.Arrays;

/**
 * Prime bucket counts for chained hash tables. Each entry is roughly 1.2x the previous one.
 */
@UtilityClass
public class HashPrimes {

    private static final int[] PRIMES = {
        3, 7, 11, 17, 23, 29, 37, 47, 59, 71, 89, 107, 131, 163, 197, 239, 293, 353, 431, 521, 631, 761, 919,
        1103, 1327, 1597, 1931, 2333, 2801, 3371, 4049, 4861, 5839, 7013, 8419, 10103, 12143, 14591,
        17519, 21023, 25229, 30293, 36353, 43627, 52361, 62851, 75431, 90523, 108631, 130363, 156437,
        187751, 225307, 270371, 324449, 389357, 467237, 560689, 672827, 807403, 968897, 1162687, 1395263,
        1674319, 2009191, 2411033, 2893249, 3471899, 4166287, 4999559, 5999471, 7199369
    };

    /**
     * Smallest table prime greater than or equal to {@code min}; past the table, the next odd prime found by trial division.
     */
    public static int atLeast(int min) {
        if (min < 0)
            throw new IllegalArgumentException("Capacity must be non-negative, got: " + min);
        int slot = Arrays.binarySearch(PRIMES, min);
        if (slot >= 0)
            return PRIMES[slot];
        int insertion = -slot - 1;
        if (insertion < PRIMES.length)
            return PRIMES[insertion];

        for (int candidate = min | 1; candidate < Integer.MAX_VALUE; candidate += 2) {
            if (isOddPrime(candidate))
                return candidate;
        }
        return Integer.MAX_VALUE;
    }

    static boolean isOddPrime(int candidate) {
        int limit = (int) Math.sqrt(candidate);
        for (int divisor = 3; divisor <= limit; divisor += 2) {
            if (candidate % divisor == 0)
                return false;
        }
        return true;
    }
}
