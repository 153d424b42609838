package dev.dylanburati.persistent;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Consumer;

import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.infra.Blackhole;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Word counts over a simulated English-like word stream. The snapshot variants keep a copy of
 * the counts every {@link #SNAPSHOT_INTERVAL} words, which is free for the persistent map and
 * a full copy for the mutable ones.
 */
@State(Scope.Benchmark)
public class HashTrieMapBenchmark {
  private static final int WORDS = 1_000_000;
  private static final int SNAPSHOT_INTERVAL = 10_000;

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void wordcountHashTrieMap(Blackhole bh) {
    HashTrieMap<String, Integer>[] counts = newHolder();
    counts[0] = HashTrieMap.empty();
    simulateWords(word -> counts[0] = counts[0].insert(word, counts[0].getOrDefault(word, 0) + 1));
    bh.consume(counts[0].size());
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void wordcountHashMap(Blackhole bh) {
    Map<String, Integer> counts = new HashMap<>();
    simulateWords(word -> counts.merge(word, 1, (v1, v2) -> v1 + v2));
    bh.consume(counts.size());
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void wordcountObject2IntMap(Blackhole bh) {
    Object2IntOpenHashMap<String> counts = new Object2IntOpenHashMap<>();
    simulateWords(word -> counts.addTo(word, 1));
    bh.consume(counts.size());
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void snapshotsHashTrieMap(Blackhole bh) {
    HashTrieMap<String, Integer>[] counts = newHolder();
    counts[0] = HashTrieMap.empty();
    List<HashTrieMap<String, Integer>> snapshots = new ArrayList<>();
    int[] seen = new int[1];
    simulateWords(word -> {
      counts[0] = counts[0].insert(word, counts[0].getOrDefault(word, 0) + 1);
      if (++seen[0] % SNAPSHOT_INTERVAL == 0) {
        snapshots.add(counts[0]);
      }
    });
    bh.consume(snapshots);
  }

  @Benchmark
  @BenchmarkMode(Mode.SingleShotTime)
  public void snapshotsObject2IntMap(Blackhole bh) {
    Object2IntOpenHashMap<String> counts = new Object2IntOpenHashMap<>();
    List<Object2IntOpenHashMap<String>> snapshots = new ArrayList<>();
    int[] seen = new int[1];
    simulateWords(word -> {
      counts.addTo(word, 1);
      if (++seen[0] % SNAPSHOT_INTERVAL == 0) {
        snapshots.add(counts.clone());
      }
    });
    bh.consume(snapshots);
  }

  @SuppressWarnings("unchecked")
  private static HashTrieMap<String, Integer>[] newHolder() {
    return (HashTrieMap<String, Integer>[]) new HashTrieMap<?, ?>[1];
  }

  private static int genWordId(double uniform) {
    // Prob of returning x is proportional to (x+3.7) ** -1.01
    // max x is 2**27, constants fitted with scipy.optimize.minimize
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

  private static void simulateWords(Consumer<String> sink) {
    byte[] alph = "pfscxkde".getBytes(StandardCharsets.US_ASCII);
    byte[] wbuf = new byte[32];
    Random r = new Random(0L);
    for (int i = 0; i < WORDS; i++) {
      double uniform = r.nextDouble();
      int wlen = genWordLen(uniform);
      for (int wid = genWordId(uniform), j = 0; j < wlen; j++) {
        wbuf[j] = alph[(wid >> (3 * (j%9))) & 7];
      }
      sink.accept(new String(wbuf, 0, wlen, StandardCharsets.US_ASCII));
    }
  }
}
