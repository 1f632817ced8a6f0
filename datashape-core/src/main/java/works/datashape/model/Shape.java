package works.datashape.model;

import works.datashape.de.Expected;

import static works.datashape.model.ShapeGroup.BINARY;
import static works.datashape.model.ShapeGroup.EMPTY_MARKER;
import static works.datashape.model.ShapeGroup.FIXED_KEY_VALUE;
import static works.datashape.model.ShapeGroup.FIXED_SEQUENCE;
import static works.datashape.model.ShapeGroup.OPTIONAL;
import static works.datashape.model.ShapeGroup.PRIMITIVE;
import static works.datashape.model.ShapeGroup.SINGLE_PAYLOAD_WRAPPER;
import static works.datashape.model.ShapeGroup.TEXT;
import static works.datashape.model.ShapeGroup.VARIABLE_SEQUENCE;

/**
 * The closed set of abstract value shapes that every in-memory structure
 * maps to, and that every format must be able to write and read.
 * <p>
 * A mapping picks exactly one shape for a given type,
 * and the same shape is used for both encoding and decoding.
 */
public enum Shape implements Expected {
	BOOL(PRIMITIVE, "a boolean"),
	I8(PRIMITIVE, "i8"),
	I16(PRIMITIVE, "i16"),
	I32(PRIMITIVE, "i32"),
	I64(PRIMITIVE, "i64"),
	I128(PRIMITIVE, "i128"),
	U8(PRIMITIVE, "u8"),
	U16(PRIMITIVE, "u16"),
	U32(PRIMITIVE, "u32"),
	U64(PRIMITIVE, "u64"),
	U128(PRIMITIVE, "u128"),
	F32(PRIMITIVE, "f32"),
	F64(PRIMITIVE, "f64"),

	/**
	 * A Unicode scalar value; that is, a code point that is not a surrogate.
	 */
	CHAR(PRIMITIVE, "a character"),

	/**
	 * UTF-8 code units with an explicit length; may contain the zero character.
	 */
	STRING(TEXT, "a string"),

	BYTES(BINARY, "a byte array"),
	OPTION(OPTIONAL, "an option"),

	/**
	 * The anonymous empty value.
	 */
	UNIT(EMPTY_MARKER, "unit"),

	/**
	 * A named empty value.
	 */
	UNIT_STRUCT(EMPTY_MARKER, "a unit struct"),

	/**
	 * One arm of a closed enumeration carrying no payload.
	 */
	UNIT_VARIANT(EMPTY_MARKER, "a unit variant"),

	NEWTYPE_STRUCT(SINGLE_PAYLOAD_WRAPPER, "a newtype struct"),
	NEWTYPE_VARIANT(SINGLE_PAYLOAD_WRAPPER, "a newtype variant"),
	SEQ(VARIABLE_SEQUENCE, "a sequence"),
	MAP(VARIABLE_SEQUENCE, "a map"),
	TUPLE(FIXED_SEQUENCE, "a tuple"),
	TUPLE_STRUCT(FIXED_SEQUENCE, "a tuple struct"),
	TUPLE_VARIANT(FIXED_SEQUENCE, "a tuple variant"),
	STRUCT(FIXED_KEY_VALUE, "a struct"),
	STRUCT_VARIANT(FIXED_KEY_VALUE, "a struct variant"),
	;

	private final ShapeGroup group;
	private final String description;

	Shape(ShapeGroup group, String description) {
		this.group = group;
		this.description = description;
	}

	public ShapeGroup group() {
		return group;
	}

	/**
	 * @return true for the four shapes that carry a variant discriminant
	 */
	public boolean isVariant() {
		return switch (this) {
			case UNIT_VARIANT, NEWTYPE_VARIANT, TUPLE_VARIANT, STRUCT_VARIANT -> true;
			default -> false;
		};
	}

	/**
	 * @return true for shapes that carry a type name
	 */
	public boolean isNamed() {
		return switch (this) {
			case UNIT_STRUCT, NEWTYPE_STRUCT, TUPLE_STRUCT, STRUCT -> true;
			default -> isVariant();
		};
	}

	/**
	 * @return true for shapes whose number of elements or fields is known
	 * before any serialized data is inspected
	 */
	public boolean hasStaticLength() {
		return group == FIXED_SEQUENCE || group == FIXED_KEY_VALUE;
	}

	/**
	 * @return true for shapes whose length can only be determined from the data
	 */
	public boolean hasVariableLength() {
		return group == VARIABLE_SEQUENCE;
	}

	/**
	 * @return true for shapes written and read as sessions of elements or entries
	 */
	public boolean isCompound() {
		return hasStaticLength() || hasVariableLength();
	}

	@Override
	public String expecting() {
		return description;
	}
}
