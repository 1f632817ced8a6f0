package works.datashape.de;

/**
 * Decode-side mapping logic for one type:
 * asks a {@link Deserializer} for the shape it expects,
 * supplying a {@link Visitor} that builds the value.
 * <p>
 * Implementations may carry state that influences decoding,
 * like a pre-allocated collection to fill;
 * stateless ones are usually lambdas or constants.
 * <p>
 * Must never return {@code null}.
 *
 * @param <T> the decoded type
 */
@FunctionalInterface
public interface Deserialize<T> {
	T deserialize(Deserializer deserializer);
}
