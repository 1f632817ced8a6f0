package works.datashape.json;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;
import works.datashape.de.Deserialize;
import works.datashape.de.IgnoredAny;
import works.datashape.de.Visitor;
import works.datashape.exceptions.BorrowUnavailableException;
import works.datashape.exceptions.MalformedInputException;
import works.datashape.exceptions.UnrecognizedContentException;
import works.datashape.impls.Deserializers;
import works.datashape.lifetime.BorrowedText;
import works.datashape.lifetime.Flavor;
import works.datashape.lifetime.Flavors;
import works.datashape.lifetime.InputBuffer;
import works.datashape.testing.state.Payload;
import works.datashape.testing.state.Suit;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonDeserializerTest {
	final Json json = Json.standard();

	@Test
	void whitespaceAroundTokens() {
		assertEquals(List.of(1, 2, 3), json.fromString(" \t[1 ,\n2, 3 ]\r\n", Deserializers.list(Deserializers.I32)));
	}

	@Test
	void integerWidths() {
		assertEquals(-1L, json.fromString("18446744073709551615", Deserializers.U64));
		assertEquals(Long.MIN_VALUE, json.fromString("-9223372036854775808", Deserializers.I64));
		assertEquals(new BigInteger("170141183460469231731687303715884105727"),
			json.fromString("170141183460469231731687303715884105727", Deserializers.I128));
		assertEquals(new BigInteger("340282366920938463463374607431768211455"),
			json.fromString("340282366920938463463374607431768211455", Deserializers.U128));
	}

	@Test
	void outOfRangeInteger_unrecognized() {
		UnrecognizedContentException e = assertThrows(UnrecognizedContentException.class, () -> json.fromString("300", Deserializers.I8));
		assertEquals("invalid value: integer `300`, expected i8", e.getMessage());
	}

	@Test
	void floats() {
		assertEquals(0.1f, json.fromString("0.1", Deserializers.F32));
		assertEquals(-2.5e-3, json.fromString("-2.5E-3", Deserializers.F64));
		assertEquals(3.0, json.fromString("3", Deserializers.F64));
	}

	@Test
	void malformedNumbers_rejected() {
		assertThrows(MalformedInputException.class, () -> json.fromString("01", Deserializers.I32));
		assertThrows(MalformedInputException.class, () -> json.fromString("1.", Deserializers.F64));
		assertThrows(MalformedInputException.class, () -> json.fromString("-", Deserializers.I32));
	}

	@Test
	void trailingCharacters_rejected() {
		MalformedInputException e = assertThrows(MalformedInputException.class, () -> json.fromString("1 2", Deserializers.I32));
		assertThat(e.getMessage(), startsWith("Trailing characters after JSON value"));
		assertEquals(2, e.offset());
	}

	@Test
	void punctuationErrors_rejected() {
		var ints = Deserializers.list(Deserializers.I32);
		assertThrows(MalformedInputException.class, () -> json.fromString("[1,]", ints));
		assertThrows(MalformedInputException.class, () -> json.fromString("[1 2]", ints));
		assertThrows(MalformedInputException.class, () -> json.fromString("[1", ints));
		var strings = Deserializers.map(Deserializers.STRING, Deserializers.I32);
		assertThrows(MalformedInputException.class, () -> json.fromString("{\"a\" 1}", strings));
		assertThrows(MalformedInputException.class, () -> json.fromString("{1:1}", strings));
		assertThrows(MalformedInputException.class, () -> json.fromString("{\"a\":1,}", IgnoredAny.INSTANCE));
	}

	@Test
	void nestingLimit() {
		Json shallow = Json.with(JsonSettings.builder().maxNestingDepth(3).build());
		shallow.fromString("[[[1]]]", IgnoredAny.INSTANCE);
		MalformedInputException e = assertThrows(MalformedInputException.class, () -> shallow.fromString("[[[[1]]]]", IgnoredAny.INSTANCE));
		assertThat(e.getMessage(), startsWith("Nesting deeper than 3"));
		assertThrows(MalformedInputException.class, () -> shallow.fromString("[[[[1]]]]",
			Deserializers.list(Deserializers.list(Deserializers.list(Deserializers.list(Deserializers.I32))))));
	}

	@Test
	void escapes_decoded() {
		assertEquals("a\"b\\c/\n\té😀", json.fromString("\"a\\\"b\\\\c\\/\\n\\t\\u00e9\\ud83d\\ude00\"", Deserializers.STRING));
		assertThrows(MalformedInputException.class, () -> json.fromString("\"\\u12g4\"", Deserializers.STRING));
		assertThrows(MalformedInputException.class, () -> json.fromString("\"\\q\"", Deserializers.STRING));
		assertThrows(MalformedInputException.class, () -> json.fromString("\"unterminated", Deserializers.STRING));
	}

	@Test
	void enums_bareOrTagged() {
		assertEquals(Suit.SPADES, json.fromString("\"SPADES\"", Deserializers.enumByName(Suit.class)));
		assertEquals(new Payload.Wrapped(3), json.fromString("{\"Wrapped\": 3}", Payload.DESERIALIZE));
		assertEquals(new Payload.Pair(1, "one"), json.fromString("{\"Pair\":[1,\"one\"]}", Payload.DESERIALIZE));
		assertEquals(new Payload.Labeled("l", true), json.fromString("{\"Labeled\":{\"enabled\":true,\"label\":\"l\"}}", Payload.DESERIALIZE));
	}

	@Test
	void enumObjectWithTwoMembers_rejected() {
		MalformedInputException e = assertThrows(MalformedInputException.class,
			() -> json.fromString("{\"Wrapped\":3,\"Pair\":[1,\"x\"]}", Payload.DESERIALIZE));
		assertThat(e.getMessage(), startsWith("Enum object must have exactly one member"));
	}

	@Test
	void unknownVariant_unrecognized() {
		assertThrows(UnrecognizedContentException.class, () -> json.fromString("\"JOKER\"", Deserializers.enumByName(Suit.class)));
	}

	@Test
	void structFromArray() {
		assertEquals(Duration.ofSeconds(5, 7), json.fromString("[5, 7]", Deserializers.DURATION_VALUE));
		assertEquals(Duration.ofSeconds(5, 7), json.fromString("{\"nanos\":7,\"secs\":5}", Deserializers.DURATION_VALUE));
	}

	@Test
	void integerMemberNames() {
		Map<Integer, String> map = json.fromString("{\"1\":\"one\",\"-2\":\"minus two\"}", Deserializers.map(Deserializers.I32, Deserializers.STRING));
		assertEquals(Map.of(1, "one", -2, "minus two"), map);
		assertThrows(UnrecognizedContentException.class, () -> json.fromString("{\"x\":\"?\"}", Deserializers.map(Deserializers.I32, Deserializers.STRING)));
	}

	@Test
	void nullAsNoneOrUnit() {
		assertEquals(Optional.empty(), json.fromString("null", Deserializers.optional(Deserializers.I32)));
		assertEquals(Optional.of(4), json.fromString("4", Deserializers.optional(Deserializers.I32)));
	}

	@Test
	void plainString_borrowedFromBuffer() {
		InputBuffer buffer = InputBuffer.ofString("[\"alpha\",\"beta\"]");
		List<CharSequence> texts = json.fromBuffer(buffer, Deserializers.list(BORROWED_TEXT));
		assertTrue(buffer.isLive());
		assertThat(texts.get(0), instanceOf(BorrowedText.class));
		assertTrue(((BorrowedText) texts.get(0)).contentEquals("alpha"));
		assertEquals("beta", texts.get(1).toString());

		buffer.release();
		assertFalse(buffer.isLive());
		assertThrows(IllegalStateException.class, () -> texts.get(0).length());
	}

	@Test
	void fromString_lendsNothing() {
		assertThrows(BorrowUnavailableException.class, () -> json.fromString("\"gone\"", BORROWED_TEXT));
		assertEquals("kept", json.fromString("\"kept\"", Deserializers.STRING));
	}

	@Test
	void escapedString_cannotBeBorrowed() {
		InputBuffer buffer = InputBuffer.ofString("\"line\\nbreak\"");
		try {
			assertThrows(BorrowUnavailableException.class, () -> json.fromBuffer(buffer, BORROWED_TEXT));
		} finally {
			buffer.release();
		}
	}

	@Test
	void ownedString_borrowedWhenThatIsAllTheVisitorTakes() {
		InputBuffer buffer = InputBuffer.ofString("\"held\"");
		CharSequence text = json.fromBuffer(buffer, d -> d.deserializeString(new Visitor<CharSequence>() {
			@Override public String expecting() { return "borrowed text"; }
			@Override public Set<Flavor> acceptedFlavors() { return Flavors.BORROWED_ONLY; }
			@Override public CharSequence visitBorrowedStr(BorrowedText value) { return value; }
		}));
		assertThat(text, instanceOf(BorrowedText.class));
		assertEquals("held", text.toString());
		buffer.release();
		assertThrows(IllegalStateException.class, text::length);
	}

	@Test
	void utf8Buffer_lendsNothing() {
		InputBuffer buffer = InputBuffer.ofUtf8("\"bytes\"");
		try {
			assertThrows(BorrowUnavailableException.class, () -> json.fromBuffer(buffer, BORROWED_TEXT));
			assertTrue(buffer.isLive());
			assertEquals("bytes", json.fromBuffer(buffer, Deserializers.STRING));
		} finally {
			buffer.release();
		}
	}

	@Test
	void invalidUtf8_rejected() {
		InputBuffer buffer = InputBuffer.ofBytes(new byte[] { '"', (byte) 0xFF, (byte) 0xC3, '"' });
		try {
			MalformedInputException e = assertThrows(MalformedInputException.class, () -> json.fromBuffer(buffer, Deserializers.STRING));
			assertThat(e.getMessage(), startsWith("Invalid UTF-8"));
			assertEquals(1, e.offset());
		} finally {
			buffer.release();
		}

		InputBuffer truncated = InputBuffer.ofBytes(new byte[] { '"', 'a', '"', ' ', (byte) 0xC3 });
		try {
			assertThrows(MalformedInputException.class, () -> json.fromBuffer(truncated, Deserializers.STRING));
		} finally {
			truncated.release();
		}
	}

	@Test
	void transientString_onlyValidDuringVisit() {
		List<CharSequence> seen = new ArrayList<>();
		String copied = json.fromString("\"esc\\taped\"", d -> d.deserializeStr(new Visitor<String>() {
			@Override public String expecting() { return "a transient string"; }
			@Override public Set<Flavor> acceptedFlavors() { return Set.of(Flavor.TRANSIENT); }

			@Override
			public String visitStr(CharSequence value) {
				seen.add(value);
				return value.toString();
			}
		}));
		assertEquals("esc\taped", copied);
		assertEquals(0, seen.get(0).length());
	}

	@Test
	void utf8Buffer_decodedBeforeReading() {
		InputBuffer buffer = InputBuffer.ofUtf8("{\"é\":[true,false]}");
		try {
			Map<String, List<Boolean>> map = json.fromBuffer(buffer, Deserializers.map(Deserializers.STRING, Deserializers.list(Deserializers.BOOL)));
			assertEquals(Map.of("é", List.of(true, false)), map);
		} finally {
			buffer.release();
		}
	}

	static final Deserialize<CharSequence> BORROWED_TEXT = d -> d.deserializeStr(new Visitor<CharSequence>() {
		@Override public String expecting() { return "borrowed text"; }
		@Override public Set<Flavor> acceptedFlavors() { return Flavors.BORROWED_ONLY; }
		@Override public CharSequence visitBorrowedStr(BorrowedText value) { return value; }
	});
}
