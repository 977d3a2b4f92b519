package io.lacuna.scanpath;

import io.lacuna.bifurcan.*;

import java.util.function.Function;

/**
 * @author ztellman
 */
public class Utils {

  public static <K, V> LinearMap<K, ISet<V>> groupBy(Iterable<V> vals, Function<V, K> f) {
    LinearMap<K, ISet<V>> m = new LinearMap<>();
    vals.forEach(v -> m.getOrCreate(f.apply(v), LinearSet::new).add(v));
    return m;
  }

  public static <K> IMap<K, Long> increment(IMap<K, Long> counts, K key) {
    return counts.update(key, n -> n == null ? 1L : n + 1);
  }
}
