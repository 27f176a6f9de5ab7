package membership.identity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Map from a key to an insertion-ordered set of values.
 *
 * <p>{@link #get} never returns {@code null}; absent keys yield an empty set.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class MultiMap<K, V> {
  private final Map<K, Set<V>> entries = new LinkedHashMap<>();

  public void add(K key, V value) {
    entries.computeIfAbsent(key, k -> new LinkedHashSet<>()).add(value);
  }

  /** Returns an unmodifiable view of the values for {@code key}. */
  public Set<V> get(K key) {
    Set<V> values = entries.get(key);
    return values == null ? Collections.emptySet() : Collections.unmodifiableSet(values);
  }
}
