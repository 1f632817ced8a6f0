package works.datashape.de;

import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Pull-based access to the entries of a map or struct,
 * handed to {@link Visitor#visitMap}.
 * <p>
 * Calls alternate between {@link #nextKey} and {@link #nextValue},
 * starting with a key, until {@link #nextKey} returns empty.
 */
public interface MapAccess {
	/**
	 * @return the next key, or empty at the end of the map
	 */
	<K> Optional<K> nextKey(Deserialize<K> key);

	/**
	 * @return the value for the key most recently returned by {@link #nextKey}
	 * @throws IllegalStateException if called out of turn
	 */
	<V> V nextValue(Deserialize<V> value);

	default <K, V> Optional<Map.Entry<K, V>> nextEntry(Deserialize<K> key, Deserialize<V> value) {
		Optional<K> k = nextKey(key);
		if (k.isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(Map.entry(k.get(), nextValue(value)));
	}

	default OptionalInt sizeHint() {
		return OptionalInt.empty();
	}
}
