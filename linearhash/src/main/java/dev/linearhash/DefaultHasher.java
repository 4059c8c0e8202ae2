package dev.linearhash;

/** Polynomial string hash, {@code h = 31 * h + b} over unsigned bytes starting from 0. */
/* package-private */ class DefaultHasher implements Hasher {
  static final int MULTIPLIER = 31;

  private static DefaultHasher instance = null;

  private DefaultHasher() {}

  static DefaultHasher instance() {
    if (instance == null) {
      instance = new DefaultHasher();
    }
    return instance;
  }

  @Override
  public int hashBytes(byte[] keyContent) {
    // wraps mod 2^32; the low bits agree with the same polynomial at any wider width
    int h = 0;
    for (byte b : keyContent) {
      h = MULTIPLIER * h + (b & 0xff);
    }
    return h;
  }
}
