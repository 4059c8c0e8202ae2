package dev.linearhash;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;

/**
 * Hash table from strings to Objects which grows one bucket at a time using linear hashing.
 *
 * Keys are hashed over their UTF-8 encoding. The low {@code bits} of the hash select a bucket; an
 * address past the last bucket is folded back into the half of the table that has not been split
 * yet at the current depth. Whenever an insertion leaves a bucket with more than {@code 2^bits}
 * entries, the bucket at the split pointer (not necessarily the one that overflowed) is split
 * into itself and one newly appended bucket. The table never shrinks.
 *
 * Null keys and null values are not allowed; {@code null} is returned by {@link #lookup} and
 * {@link #remove} to mean "not found".
 *
 * This class is not thread-safe. Callers sharing a table between threads must serialize access
 * themselves.
 *
 * @param <V> the type of mapped values
 */
public class LinearHashTable<V> {
  private static final int DEFAULT_BUCKET_COUNT = 32;
  private static final int MAX_INITIAL_BUCKETS = 1 << 30;

  private final Hasher hasher;
  private final boolean splitting;
  private final ArrayList<List<Entry<V>>> buckets;

  // INVARIANT 0: (1 << (bits - 1)) < buckets.size() <= (1 << bits)
  // INVARIANT 1: 0 <= splitPointer < (1 << (bits - 1))
  // INVARIANT 2: unless buckets.size() == 2^bits, buckets.size() == splitPointer + 2^(bits-1), i.e. the
  //   buckets in [splitPointer, 2^(bits-1)) are the ones still addressed by bits - 1 low bits
  private int bits;
  private int splitPointer;
  private int size;

  public LinearHashTable() {
    this(DEFAULT_BUCKET_COUNT);
  }

  public LinearHashTable(int initialBuckets) {
    this(initialBuckets, DefaultHasher.instance());
  }

  public LinearHashTable(int initialBuckets, final Hasher hasher) {
    this(initialBuckets, hasher, true);
  }

  private LinearHashTable(int initialBuckets, final Hasher hasher, boolean splitting) {
    if (initialBuckets <= 0) {
      throw new IllegalArgumentException("expected positive initialBuckets");
    }
    if (initialBuckets > MAX_INITIAL_BUCKETS) {
      throw new IllegalArgumentException("initialBuckets must not exceed " + MAX_INITIAL_BUCKETS);
    }
    int cap = 2;
    if (initialBuckets > 2) {
      // next power of two >= initialBuckets
      cap = 1 << (32 - Integer.numberOfLeadingZeros(initialBuckets - 1));
    }
    this.hasher = Objects.requireNonNull(hasher);
    this.splitting = splitting;
    this.buckets = new ArrayList<>(cap);
    for (int i = 0; i < cap; i++) {
      this.buckets.add(new ArrayList<>());
    }
    // INVARIANT 0 upheld: cap == 2^bits
    this.bits = Integer.numberOfTrailingZeros(cap);
    this.splitPointer = 0;
    this.size = 0;
  }

  /**
   * Creates a table that keeps its initial bucket count forever. Buckets grow without bound
   * instead of being split.
   */
  public static <V> LinearHashTable<V> fixedSize(int buckets) {
    return new LinearHashTable<>(buckets, DefaultHasher.instance(), false);
  }

  /** Number of buckets, not entries. */
  public int len() {
    return this.buckets.size();
  }

  public int size() {
    return this.size;
  }

  public boolean isEmpty() {
    return this.size == 0;
  }

  public boolean containsKey(String key) {
    return this.lookup(key) != null;
  }

  /**
   * Returns the value stored for {@code key}, or {@code null} if there is none.
   */
  public V lookup(String key) {
    Objects.requireNonNull(key);
    List<Entry<V>> bucket = this.buckets.get(this.address(this.hash(key)));
    for (Entry<V> entry : bucket) {
      if (entry.key.equals(key)) {
        return entry.value;
      }
    }
    return null;
  }

  /**
   * Inserts or overwrites the value for {@code key}.
   *
   * @return {@code true} if the key was new, {@code false} if an existing value was overwritten
   */
  public boolean upsert(String key, V value) {
    Objects.requireNonNull(key);
    Objects.requireNonNull(value);
    int hash = this.hash(key);
    List<Entry<V>> bucket = this.buckets.get(this.address(hash));
    for (Entry<V> entry : bucket) {
      if (entry.key.equals(key)) {
        entry.value = value;
        return false;
      }
    }
    bucket.add(new Entry<>(key, hash, value));
    this.size++;
    if (this.splitting && bucket.size() > (1 << this.bits)) {
      this.split();
    }
    return true;
  }

  /**
   * Removes the entry for {@code key}.
   *
   * @return the removed value, or {@code null} if the key was absent
   */
  public V remove(String key) {
    Objects.requireNonNull(key);
    List<Entry<V>> bucket = this.buckets.get(this.address(this.hash(key)));
    for (int i = 0; i < bucket.size(); i++) {
      if (bucket.get(i).key.equals(key)) {
        this.size--;
        return bucket.remove(i).value;
      }
    }
    return null;
  }

  /** Visits entries bucket by bucket, in insertion order within each bucket. */
  public void forEach(BiConsumer<? super String, ? super V> action) {
    Objects.requireNonNull(action);
    for (List<Entry<V>> bucket : this.buckets) {
      for (Entry<V> entry : bucket) {
        action.accept(entry.key, entry.value);
      }
    }
  }

  @Override
  public String toString() {
    return String.format("LinearHashTable(buckets=%d, mask=%s, splitPointer=%d, size=%d)",
        this.buckets.size(), Integer.toBinaryString((1 << this.bits) - 1), this.splitPointer, this.size);
  }

  /* package-private */ int bits() {
    return this.bits;
  }

  /* package-private */ int splitPointer() {
    return this.splitPointer;
  }

  private int hash(String key) {
    return this.hasher.hashBytes(key.getBytes(StandardCharsets.UTF_8));
  }

  private int address(int hash) {
    int m = hash & ((1 << this.bits) - 1);
    if (m < this.buckets.size()) {
      return m;
    }
    // partner of m has not been appended yet, m ^ 2^(bits-1) < buckets.size() by INVARIANT 0
    return m ^ (1 << (this.bits - 1));
  }

  private void split() {
    if (this.buckets.size() == 1 << this.bits) {
      // every bucket at this depth has been split, start the next round
      this.bits++;
    }
    List<Entry<V>> orig = this.buckets.get(this.splitPointer);
    this.buckets.set(this.splitPointer, new ArrayList<>());
    this.buckets.add(new ArrayList<>());

    this.splitPointer++;
    if (this.buckets.size() == 1 << this.bits) {
      this.splitPointer = 0;
    }

    // each entry lands in its old bucket or in the one just appended, no overflow check needed
    for (Entry<V> entry : orig) {
      this.buckets.get(this.address(entry.hash)).add(entry);
    }
  }

  private static final class Entry<V> {
    final String key;
    final int hash;
    V value;

    Entry(final String key, int hash, V value) {
      this.key = key;
      this.hash = hash;
      this.value = value;
    }
  }
}
