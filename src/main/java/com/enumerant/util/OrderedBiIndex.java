package com.enumerant.util;

import it.unimi.dsi.fastutil.Hash;
import lombok.Value;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Ordered list of (first, second) pairs with hashed lookup by either side.
 * Implementation
 * - One shared entry table in list order, stored as parallel arrays
 * - Two chained hash tables (bucket heads) threaded through the same entries via per-side "next" links
 * - Bucket heads and links hold {@code index + 1}, so zero means empty
 * - Prime capacities, doubled on growth with a full rehash
 * <p>
 * Positional inserts shift every later entry and repair both chains, so an insert is O(n).
 * Meant to be filled once and then only read; not thread-safe while mutating.
 */
public final class OrderedBiIndex<F, S> implements Iterable<OrderedBiIndex.Pair<F, S>> {

    private static final Hash.Strategy<Object> NATURAL = new Hash.Strategy<>() {
        @Override
        public int hashCode(Object o) {
            return o == null ? 0 : o.hashCode();
        }

        @Override
        public boolean equals(Object a, Object b) {
            return Objects.equals(a, b);
        }
    };

    private final Hash.Strategy<? super F> firstStrategy;
    private final Hash.Strategy<? super S> secondStrategy;

    private Object[] firsts;
    private Object[] seconds;
    private int[] firstHashes;
    private int[] secondHashes;
    private int[] firstNext;
    private int[] secondNext;
    private int[] firstBuckets;
    private int[] secondBuckets;
    private int size;
    private int modCount;

    public OrderedBiIndex(int initialCapacity) {
        this(initialCapacity, NATURAL, NATURAL);
    }

    public OrderedBiIndex(int initialCapacity, Hash.Strategy<? super F> firstStrategy, Hash.Strategy<? super S> secondStrategy) {
        this.firstStrategy = Objects.requireNonNull(firstStrategy, "First strategy cannot be null");
        this.secondStrategy = Objects.requireNonNull(secondStrategy, "Second strategy cannot be null");
        allocate(HashPrimes.atLeast(initialCapacity));
    }

    /**
     * Append a pair.
     * @return false without modifying anything if either key is already present
     */
    public boolean add(F first, S second) {
        return insert(size, first, second);
    }

    /**
     * Insert a pair at {@code index}, shifting later entries up by one.
     * @return false without modifying anything if either key is already present
     */
    public boolean insert(int index, F first, S second) {
        Objects.requireNonNull(first, "First key cannot be null");
        Objects.requireNonNull(second, "Second key cannot be null");
        if (index < 0 || index > size)
            throw new IndexOutOfBoundsException("Insert index must be 0-" + size + ", got: " + index);

        int firstHash = firstHash(first);
        if (indexOfFirst(first, firstHash) >= 0)
            return false;
        int secondHash = secondHash(second);
        if (indexOfSecond(second, secondHash) >= 0)
            return false;

        if (size == firsts.length)
            resize(HashPrimes.atLeast(size << 1));

        for (int i = size - 1; i >= index; i--) {
            shiftUp(i);
        }
        size++;

        firsts[index] = first;
        seconds[index] = second;
        firstHashes[index] = firstHash;
        secondHashes[index] = secondHash;
        int firstBucket = firstHash % firstBuckets.length;
        firstNext[index] = firstBuckets[firstBucket];
        firstBuckets[firstBucket] = index + 1;
        int secondBucket = secondHash % secondBuckets.length;
        secondNext[index] = secondBuckets[secondBucket];
        secondBuckets[secondBucket] = index + 1;
        modCount++;
        return true;
    }

    /**
     * Swap the second key at {@code index}, keeping its position and first key.
     * @return false without modifying anything if {@code second} is already present anywhere
     */
    public boolean replaceSecondAt(int index, S second) {
        checkIndex(index);
        Objects.requireNonNull(second, "Second key cannot be null");
        int secondHash = secondHash(second);
        if (indexOfSecond(second, secondHash) >= 0)
            return false;

        unlinkSecond(index);
        seconds[index] = second;
        secondHashes[index] = secondHash;
        int bucket = secondHash % secondBuckets.length;
        secondNext[index] = secondBuckets[bucket];
        secondBuckets[bucket] = index + 1;
        modCount++;
        return true;
    }

    public int indexOfFirst(F first) {
        if (first == null)
            return -1;
        return indexOfFirst(first, firstHash(first));
    }

    public int indexOfSecond(S second) {
        if (second == null)
            return -1;
        return indexOfSecond(second, secondHash(second));
    }

    public boolean containsFirst(F first) {
        return indexOfFirst(first) >= 0;
    }

    public boolean containsSecond(S second) {
        return indexOfSecond(second) >= 0;
    }

    public Pair<F, S> getAt(int index) {
        checkIndex(index);
        return new Pair<>(castFirst(firsts[index]), castSecond(seconds[index]));
    }

    public F getFirstAt(int index) {
        checkIndex(index);
        return castFirst(firsts[index]);
    }

    public S getSecondAt(int index) {
        checkIndex(index);
        return castSecond(seconds[index]);
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int capacity() {
        return firsts.length;
    }

    /**
     * Shrink the backing arrays to the smallest prime that still holds every entry.
     */
    public void trimToSize() {
        int target = HashPrimes.atLeast(size);
        if (target != firsts.length)
            resize(target);
    }

    @Override
    public Iterator<Pair<F, S>> iterator() {
        return new Iterator<>() {
            private final int expectedModCount = modCount;
            private int next;

            @Override
            public boolean hasNext() {
                return next < size;
            }

            @Override
            public Pair<F, S> next() {
                if (expectedModCount != modCount)
                    throw new ConcurrentModificationException("Index was modified during iteration");
                if (next >= size)
                    throw new NoSuchElementException();
                return getAt(next++);
            }
        };
    }

    // ========== INTERNALS ==========

    private int indexOfFirst(F first, int hash) {
        for (int i = firstBuckets[hash % firstBuckets.length] - 1; i >= 0; i = firstNext[i] - 1) {
            if (firstHashes[i] == hash && firstStrategy.equals(castFirst(firsts[i]), first))
                return i;
        }
        return -1;
    }

    private int indexOfSecond(S second, int hash) {
        for (int i = secondBuckets[hash % secondBuckets.length] - 1; i >= 0; i = secondNext[i] - 1) {
            if (secondHashes[i] == hash && secondStrategy.equals(castSecond(seconds[i]), second))
                return i;
        }
        return -1;
    }

    /**
     * Move entry {@code index} to {@code index + 1}, repointing whichever bucket head or
     * chain link referenced it on each side. Callers shift from the tail down.
     */
    private void shiftUp(int index) {
        int firstBucket = firstHashes[index] % firstBuckets.length;
        if (firstBuckets[firstBucket] == index + 1) {
            firstBuckets[firstBucket]++;
        } else {
            int prev = firstBuckets[firstBucket] - 1;
            while (firstNext[prev] != index + 1) {
                prev = firstNext[prev] - 1;
            }
            firstNext[prev]++;
        }

        int secondBucket = secondHashes[index] % secondBuckets.length;
        if (secondBuckets[secondBucket] == index + 1) {
            secondBuckets[secondBucket]++;
        } else {
            int prev = secondBuckets[secondBucket] - 1;
            while (secondNext[prev] != index + 1) {
                prev = secondNext[prev] - 1;
            }
            secondNext[prev]++;
        }

        firsts[index + 1] = firsts[index];
        seconds[index + 1] = seconds[index];
        firstHashes[index + 1] = firstHashes[index];
        secondHashes[index + 1] = secondHashes[index];
        firstNext[index + 1] = firstNext[index];
        secondNext[index + 1] = secondNext[index];
    }

    private void unlinkSecond(int index) {
        int bucket = secondHashes[index] % secondBuckets.length;
        if (secondBuckets[bucket] == index + 1) {
            secondBuckets[bucket] = secondNext[index];
            return;
        }
        int prev = secondBuckets[bucket] - 1;
        while (secondNext[prev] != index + 1) {
            prev = secondNext[prev] - 1;
        }
        secondNext[prev] = secondNext[index];
    }

    private void resize(int newCapacity) {
        Object[] oldFirsts = firsts;
        Object[] oldSeconds = seconds;
        int[] oldFirstHashes = firstHashes;
        int[] oldSecondHashes = secondHashes;

        allocate(newCapacity);
        for (int i = 0; i < size; i++) {
            firsts[i] = oldFirsts[i];
            seconds[i] = oldSeconds[i];
            firstHashes[i] = oldFirstHashes[i];
            secondHashes[i] = oldSecondHashes[i];

            int firstBucket = firstHashes[i] % firstBuckets.length;
            firstNext[i] = firstBuckets[firstBucket];
            firstBuckets[firstBucket] = i + 1;
            int secondBucket = secondHashes[i] % secondBuckets.length;
            secondNext[i] = secondBuckets[secondBucket];
            secondBuckets[secondBucket] = i + 1;
        }
        modCount++;
    }

    private void allocate(int capacity) {
        firsts = new Object[capacity];
        seconds = new Object[capacity];
        firstHashes = new int[capacity];
        secondHashes = new int[capacity];
        firstNext = new int[capacity];
        secondNext = new int[capacity];
        firstBuckets = new int[capacity];
        secondBuckets = new int[capacity];
    }

    private int firstHash(F first) {
        return firstStrategy.hashCode(first) & 0x7FFFFFFF;
    }

    private int secondHash(S second) {
        return secondStrategy.hashCode(second) & 0x7FFFFFFF;
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= size)
            throw new IndexOutOfBoundsException("Index must be 0-" + (size - 1) + ", got: " + index);
    }

    @SuppressWarnings("unchecked")
    private F castFirst(Object o) {
        return (F) o;
    }

    @SuppressWarnings("unchecked")
    private S castSecond(Object o) {
        return (S) o;
    }

    /**
     * One (first, second) entry as seen through {@link #getAt(int)} and iteration.
     */
    @Value
    public static class Pair<F, S> {
        F first;
        S second;
    }
}
