package works.datashape.de;

import java.util.List;

/**
 * Access to the payload of an enum variant.
 * The caller picks the method matching the variant's shape,
 * which it knows statically once the variant is identified.
 */
public interface VariantAccess {
	void unitVariant();

	<T> T newtypeVariant(Deserialize<T> value);

	<T> T tupleVariant(int length, Visitor<T> visitor);

	<T> T structVariant(List<String> fields, Visitor<T> visitor);
}
