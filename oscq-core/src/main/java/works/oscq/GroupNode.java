package works.oscq;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * A container node. Its {@link #contents()} map path segments to child nodes
 * in insertion order, which is also the order in which they are serialized.
 * A group never carries a value, so its {@link #access()} is always {@link Access#NO_VALUE}.
 */
public record GroupNode(
	String fullPath,
	String description,
	Map<String, OscNode> contents
) implements OscNode {
	public GroupNode {
		requireNonNull(fullPath);
		requireNonNull(description);
		contents = Collections.unmodifiableMap(new LinkedHashMap<>(contents));
	}

	@Override
	public Access access() {
		return Access.NO_VALUE;
	}
}
