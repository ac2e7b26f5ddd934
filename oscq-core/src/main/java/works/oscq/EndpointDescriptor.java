package works.oscq;

import java.util.List;
import java.util.Optional;
import lombok.Builder;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * Everything needed to add one endpoint to an {@link AddressTree.Builder}.
 * <p>
 * Only {@code path} and {@code initialValue} are required:
 * <pre>
 * EndpointDescriptor.builder()
 *     .path("/synth/cutoff")
 *     .initialValue(OscValue.of(440f))
 *     .range(Range.of(20f, 20000f))
 *     .unit(OscUnit.Time.HZ)
 *     .build();
 * </pre>
 *
 * @param description defaults to the empty string
 * @param access defaults to {@link Access#READ_WRITE}
 */
@Builder
public record EndpointDescriptor(
	String path,
	OscValue initialValue,
	String description,
	@Nullable Range range,
	Access access,
	@Nullable OscUnit unit
) {
	public EndpointDescriptor {
		requireNonNull(path, "path");
		requireNonNull(initialValue, "initialValue");
		if (description == null) {
			description = "";
		}
		if (access == null) {
			access = Access.READ_WRITE;
		}
	}

	public static EndpointDescriptor of(String path, OscValue initialValue) {
		return new EndpointDescriptor(path, initialValue, "", null, Access.READ_WRITE, null);
	}

	LeafNode toLeaf() {
		return new LeafNode(
			path,
			description,
			access,
			List.of(initialValue),
			Optional.ofNullable(range).map(r -> List.of(r)),
			Optional.ofNullable(unit).map(u -> List.of(u)));
	}
}
