/**
 * Test support for code built on datashape.
 * <p>
 * {@link works.datashape.testing.TokenSerializer} and {@link works.datashape.testing.TokenDeserializer}
 * record and replay values as flat {@link works.datashape.testing.Token} streams,
 * so {@link works.datashape.ser.Serialize} and {@link works.datashape.de.Deserialize}
 * implementations can be checked without any real format.
 * {@link works.datashape.testing.codec.CodecConformanceTest} does the converse:
 * it checks a format against fixtures covering every shape.
 */
module works.datashape.testing {
	requires transitive works.datashape.core;
	requires transitive org.junit.jupiter.api;
	requires transitive org.junit.jupiter.params;
	requires org.slf4j;

	exports works.datashape.testing;
	exports works.datashape.testing.codec;
	exports works.datashape.testing.state;

	opens works.datashape.testing.codec to org.junit.platform.commons;
}
