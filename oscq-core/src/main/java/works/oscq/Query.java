package works.oscq;

import java.util.Optional;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * One OSCQuery request: a node path, plus an optional single attribute to return
 * instead of the whole node.
 *
 * @param attribute the raw attribute name. It may name no known {@link Attribute},
 *                  in which case the answer is an empty object.
 */
public record Query(String path, Optional<String> attribute) {
	public Query {
		requireNonNull(path);
		requireNonNull(attribute);
	}

	public static Query of(String path) {
		return new Query(path, Optional.empty());
	}

	public static Query of(String path, String attribute) {
		return new Query(path, Optional.of(attribute));
	}

	public static Query of(String path, Attribute attribute) {
		return of(path, attribute.wireName());
	}

	/**
	 * Builds a query from the pieces of an HTTP request.
	 * The attribute is the first non-empty name in the query string;
	 * {@code VALUE}, {@code VALUE=}, {@code VALUE&x=1} and {@code &VALUE} all request {@code VALUE}.
	 *
	 * @param path an already-decoded request path
	 * @param rawQuery the query string without the leading {@code ?}, or null if there was none
	 */
	public static Query parse(String path, @Nullable String rawQuery) {
		if (rawQuery == null) {
			return of(path);
		}
		for (String parameter : rawQuery.split("&")) {
			int eq = parameter.indexOf('=');
			String name = (eq >= 0) ? parameter.substring(0, eq) : parameter;
			if (!name.isEmpty()) {
				return of(path, name);
			}
		}
		return of(path);
	}

	/**
	 * @return the requested attribute if it's one the OSCQuery schema defines
	 */
	public Optional<Attribute> knownAttribute() {
		return attribute.flatMap(Attribute::fromWireName);
	}

	public boolean isHostInfo() {
		return knownAttribute().filter(a -> a == Attribute.HOST_INFO).isPresent();
	}
}
