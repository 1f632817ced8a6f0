package works.datashape.compact;

/**
 * @param maxLength the largest declared length of a string, byte array, sequence or map
 *                  that will be accepted; larger declarations fail before anything is allocated
 * @param maxNestingDepth how deeply sequences, maps and structs may nest
 */
public record CompactSettings(
	int maxLength,
	int maxNestingDepth
) {
	public static final CompactSettings DEFAULT = new CompactSettings(16 * 1024 * 1024, 128);

	public CompactSettings {
		if (maxLength < 0) {
			throw new IllegalArgumentException("maxLength must not be negative: " + maxLength);
		}
		if (maxNestingDepth < 1) {
			throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
		}
	}

	public CompactSettings withMaxLength(int maxLength) {
		return new CompactSettings(maxLength, maxNestingDepth);
	}

	public CompactSettings withMaxNestingDepth(int maxNestingDepth) {
		return new CompactSettings(maxLength, maxNestingDepth);
	}
}
