package works.oscq;

/**
 * Valid bounds for one value slot of a {@link LeafNode}.
 * Serialized as {@code {"MIN": min, "MAX": max}}.
 */
public record Range(float min, float max) {
	public Range {
		if (Float.isNaN(min) || Float.isNaN(max)) {
			throw new IllegalArgumentException("Range bounds must be numbers");
		}
		if (min > max) {
			throw new IllegalArgumentException("Range minimum " + min + " exceeds maximum " + max);
		}
	}

	public static Range of(float min, float max) {
		return new Range(min, max);
	}
}
