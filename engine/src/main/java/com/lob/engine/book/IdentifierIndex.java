package com.lob.engine.book;

import org.agrona.BitUtil;
import org.agrona.collections.Hashing;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.concurrent.atomic.LongAdder;

/**
 * Fixed-bucket lock-free hash index from a {@code long} key to a value.
 *
 * Each bucket is a singly-linked chain; new entries are pushed at the head with a CAS,
 * so the most recent entry for a key is visited first. Removal is logical only: an
 * erased entry keeps its slot in the chain with a {@code null} value and is never
 * unlinked. Chains therefore only grow, and the total number of physical entries is
 * capped by {@code maxEntries}.
 *
 * {@code null} is the empty sentinel returned by lookups that find nothing, so null
 * values cannot be stored.
 */
public final class IdentifierIndex<V> {

    static final class Entry<V> {
        final long key;
        volatile V value;
        final Entry<V> next;

        Entry(long key, V value, Entry<V> next) {
            this.key = key;
            this.value = value;
            this.next = next;
        }
    }

    private static final VarHandle VALUE;
    static {
        try {
            VALUE = MethodHandles.lookup().findVarHandle(Entry.class, "value", Object.class);
        } catch (ReflectiveOperationException e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    private final String name;
    private final AtomicReferenceArray<Entry<V>> buckets;
    private final int mask;
    private final long maxEntries;
    private final AtomicLong entries = new AtomicLong();
    private final LongAdder live = new LongAdder();

    public IdentifierIndex(String name, int bucketCount, long maxEntries) {
        if (bucketCount <= 0) throw new IllegalArgumentException("bucketCount must be positive: " + bucketCount);
        if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        int size = BitUtil.findNextPositivePowerOfTwo(bucketCount);
        this.name = name;
        this.buckets = new AtomicReferenceArray<>(size);
        this.mask = size - 1;
        this.maxEntries = maxEntries;
    }

    /** Pushes a new entry for {@code key}; existing entries with the same key are left in place. */
    public void insert(long key, V value) {
        checkValue(value);
        reserveEntry();
        int bucket = Hashing.hash(key, mask);
        Entry<V> head;
        Entry<V> entry;
        do {
            head = buckets.get(bucket);
            entry = new Entry<>(key, value, head);
        } while (!buckets.compareAndSet(bucket, head, entry));
        live.increment();
    }

    /**
     * Inserts {@code value} unless a live entry for {@code key} already exists.
     *
     * @return the existing live value, or {@code null} if {@code value} was inserted
     */
    public V insertIfAbsent(long key, V value) {
        checkValue(value);
        int bucket = Hashing.hash(key, mask);
        boolean reserved = false;
        while (true) {
            Entry<V> head = buckets.get(bucket);
            V existing = findFrom(head, key);
            if (existing != null) {
                if (reserved) entries.decrementAndGet();
                return existing;
            }
            if (!reserved) {
                reserveEntry();
                reserved = true;
            }
            // Any concurrent insert into this bucket moves the head, so a successful CAS
            // means no entry for key was pushed since the scan above.
            if (buckets.compareAndSet(bucket, head, new Entry<>(key, value, head))) {
                live.increment();
                return null;
            }
        }
    }

    /** @return the value of the newest live entry for {@code key}, or {@code null} */
    public V find(long key) {
        return findFrom(buckets.get(Hashing.hash(key, mask)), key);
    }

    /**
     * Clears the value of the newest live entry for {@code key}. At most one entry is
     * cleared per call.
     *
     * @return the value that was cleared, or {@code null} if no live entry matched
     */
    @SuppressWarnings("unchecked")
    public V erase(long key) {
        Entry<V> e = buckets.get(Hashing.hash(key, mask));
        while (e != null) {
            if (e.key == key) {
                V current = e.value;
                while (current != null) {
                    if (VALUE.compareAndSet(e, current, null)) {
                        live.decrement();
                        return current;
                    }
                    current = (V) VALUE.getVolatile(e);
                }
            }
            e = e.next;
        }
        return null;
    }

    /**
     * Clears the entry for {@code key} only while it still holds {@code expected}.
     *
     * @return true if this call cleared it
     */
    public boolean remove(long key, V expected) {
        for (Entry<V> e = buckets.get(Hashing.hash(key, mask)); e != null; e = e.next) {
            if (e.key == key && e.value == expected && VALUE.compareAndSet(e, expected, null)) {
                live.decrement();
                return true;
            }
        }
        return false;
    }

    public int bucketCount() { return mask + 1; }

    /** Physical entries ever pushed; erase never lowers this. */
    public long entryCount() { return entries.get(); }

    public long liveCount() { return live.sum(); }

    private V findFrom(Entry<V> e, long key) {
        while (e != null) {
            if (e.key == key) {
                V v = e.value;
                if (v != null) return v;
            }
            e = e.next;
        }
        return null;
    }

    private void reserveEntry() {
        if (entries.incrementAndGet() > maxEntries) {
            entries.decrementAndGet();
            throw new CapacityExceededException(name + " index entries", maxEntries);
        }
    }

    private static void checkValue(Object value) {
        if (value == null) throw new IllegalArgumentException("null values are reserved for logical deletion");
    }
}
