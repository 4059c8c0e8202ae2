package dev.linearhash.app;

import dev.linearhash.LinearHashTable;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;

public class App {
  private static final int DEFAULT_WORDS = 10_000_000;

  private static int genWordId(double uniform) {
    // Prob of returning x is proportional to (x+3.7) ** -1.01, similar to English.
    // Inverse cdf with the maximum of x set to 2**27, ignoring the lhs constant 3.7
    return (int) Math.pow(-0.01 * 15.768233989819334 * uniform + 0.9870018865063785, -100.0);
  }

  private static final double[] LENGTH_CDF = new double[]{
    2.55402880e-15, 3.73483535e-07, 2.06251620e-04, 4.60037401e-03,
    2.77018313e-02, 8.59221455e-02, 1.82026193e-01, 3.04121079e-01,
    4.34720260e-01, 5.58784740e-01, 6.67021855e-01, 7.55676596e-01,
    8.24886736e-01, 8.76934270e-01, 9.14931000e-01, 9.42014131e-01,
    9.60943967e-01, 9.73962076e-01, 9.82793792e-01, 9.88716864e-01,
    9.92650419e-01, 9.95240748e-01, 9.96934095e-01, 9.98034022e-01,
    9.98744497e-01, 9.99201152e-01, 9.99493382e-01, 9.99679661e-01,
    9.99797989e-01, 9.99872918e-01, 9.99920231e-01, 9.99950030e-01
  };

  private static int genWordLen(double uniform) {
    int i = Arrays.binarySearch(LENGTH_CDF, uniform);
    return i >= 0 ? i : -i - 1;
  }

  /** Deterministic stream of words with a Zipf-like frequency distribution. */
  public static final class WordSource {
    private final byte[] alph = "pfscxkde".getBytes(StandardCharsets.US_ASCII);
    private final byte[] wbuf = new byte[32];
    private final Random r = new Random(0L);

    public String next() {
      double uniform = r.nextDouble();
      int wlen = genWordLen(uniform);
      for (int wid = genWordId(uniform), j = 0; j < wlen; j++) {
        wbuf[j] = alph[(wid >> (3 * (j%9))) & 7];
      }
      return new String(wbuf, 0, wlen, StandardCharsets.US_ASCII);
    }
  }

  public static int wordcount(Map<String, Integer> m, int words) {
    WordSource source = new WordSource();
    for (int i = 0; i < words; i++) {
      m.merge(source.next(), 1, (v1, v2) -> v1 + v2);
    }
    System.out.println("Size: " + m.size());
    return m.size();
  }

  public static int wordcount(LinearHashTable<Integer> m, int words) {
    WordSource source = new WordSource();
    for (int i = 0; i < words; i++) {
      String word = source.next();
      Integer prev = m.lookup(word);
      m.upsert(word, prev == null ? 1 : prev + 1);
    }
    System.out.println("Size: " + m.size());
    System.out.println("Table: " + m);
    return m.size();
  }

  public static void main(String[] args) {
    int words = args.length > 1 ? Integer.parseInt(args[1]) : DEFAULT_WORDS;
    switch (args.length > 0 ? args[0] : "") {
      case "java.util":
        wordcount(new HashMap<String, Integer>(), words);
        break;
      case "fastutil":
        wordcount(new Object2IntOpenHashMap<String>(), words);
        break;
      case "fixed":
        wordcount(LinearHashTable.<Integer>fixedSize(1024), words);
        break;
      default:
        wordcount(new LinearHashTable<Integer>(), words);
        break;
    }
  }
}
