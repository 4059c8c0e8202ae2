package dev.linearhash;

import java.util.HashMap;
import java.util.Map;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.infra.Blackhole;

import dev.linearhash.app.App.WordSource;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

@State(Scope.Benchmark)
public class StringIntTableBenchmark {
  @Param({"1000000", "10000000"})
  public int words;

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void wordcountSimulatedLinearHashTable(Blackhole bh) {
    bh.consume(wordcountSimulated(new LinearHashTable<>()));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void wordcountSimulatedFixedSizeTable(Blackhole bh) {
    bh.consume(wordcountSimulated(LinearHashTable.fixedSize(4096)));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void wordcountSimulatedHashMap(Blackhole bh) {
    bh.consume(wordcountSimulated(new HashMap<>()));
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void wordcountSimulatedObject2IntMap(Blackhole bh) {
    bh.consume(wordcountSimulated(new Object2IntOpenHashMap<>()));
  }

  private String[] simulatedWords() {
    WordSource source = new WordSource();
    String[] result = new String[this.words];
    for (int i = 0; i < this.words; i++) {
      result[i] = source.next();
    }
    return result;
  }

  public int wordcountSimulated(Map<String, Integer> m) {
    for (String word : this.simulatedWords()) {
      m.merge(word, 1, (v1, v2) -> v1 + v2);
    }
    return m.size();
  }

  public int wordcountSimulated(LinearHashTable<Integer> m) {
    for (String word : this.simulatedWords()) {
      Integer prev = m.lookup(word);
      m.upsert(word, prev == null ? 1 : prev + 1);
    }
    return m.size();
  }
}
