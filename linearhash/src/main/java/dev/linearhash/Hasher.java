package dev.linearhash;

/**
 * Computes hashes of encoded keys for {@link LinearHashTable}. The rules of
 * {@link Object#hashCode} also apply here: equal byte content must always hash
 * to the same value.
 *
 * Only the low bits of the result are used for addressing, so implementations
 * should mix entropy into them.
 */
public interface Hasher {
  int hashBytes(byte[] data);
}
