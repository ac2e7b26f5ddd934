package works.oscq;

import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * A single OSC endpoint.
 * <p>
 * {@link #values()} has one entry per value slot. When present,
 * {@link #range()} and {@link #unit()} have exactly one entry per slot too.
 */
public record LeafNode(
	String fullPath,
	String description,
	Access access,
	List<OscValue> values,
	Optional<List<Range>> range,
	Optional<List<OscUnit>> unit
) implements OscNode {
	public LeafNode {
		requireNonNull(fullPath);
		requireNonNull(description);
		requireNonNull(access);
		values = List.copyOf(values);
		if (values.isEmpty()) {
			throw new IllegalArgumentException("Endpoint " + fullPath + " must have at least one value");
		}
		range = range.map(List::copyOf);
		unit = unit.map(List::copyOf);
		int slots = values.size();
		range.ifPresent(r -> checkSlots(fullPath, "range", r.size(), slots));
		unit.ifPresent(u -> checkSlots(fullPath, "unit", u.size(), slots));
	}

	/**
	 * @return the OSC type tag string, one tag per value slot
	 */
	public String typeTag() {
		return values.stream()
			.map(OscValue::typeTag)
			.collect(joining());
	}

	private static void checkSlots(String fullPath, String what, int actual, int expected) {
		if (actual != expected) {
			throw new IllegalArgumentException("Endpoint " + fullPath + " has " + expected + " value slots but " + actual + " " + what + " entries");
		}
	}
}
