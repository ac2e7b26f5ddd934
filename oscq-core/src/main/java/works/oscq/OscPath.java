package works.oscq;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import works.oscq.exceptions.InvalidPathException;

/**
 * Splitting and joining of OSC addresses.
 */
final class OscPath {
	static final String ROOT = "/";
	static final String SEPARATOR = "/";

	/**
	 * Characters OSC reserves for address patterns,
	 * plus the space, which OSC also excludes from addresses.
	 */
	private static final String RESERVED = " #*,?[]{}";

	private OscPath() {}

	/**
	 * Strict parsing for endpoint paths.
	 *
	 * @return the non-empty segments of {@code path}, in order
	 */
	static List<String> parseEndpoint(String path) throws InvalidPathException {
		if (!path.startsWith(SEPARATOR)) {
			throw new InvalidPathException(path, "must start with \"/\"");
		}
		List<String> segments = split(path);
		for (String segment : segments) {
			if (segment.isEmpty()) {
				throw new InvalidPathException(path, "contains an empty segment");
			}
			for (int i = 0; i < segment.length(); i++) {
				char c = segment.charAt(i);
				if (RESERVED.indexOf(c) >= 0) {
					throw new InvalidPathException(path, "segment \"" + segment + "\" contains reserved character '" + c + "'");
				}
			}
		}
		return segments;
	}

	/**
	 * Lenient parsing for query paths: the empty string and {@code "/"} both name the root,
	 * and one trailing separator is ignored.
	 *
	 * @return the segments of {@code path}, or empty if it can't name any node
	 */
	static Optional<List<String>> parseQuery(String path) {
		if (path.isEmpty() || path.equals(ROOT)) {
			return Optional.of(List.of());
		}
		if (!path.startsWith(SEPARATOR)) {
			return Optional.empty();
		}
		String trimmed = path.endsWith(SEPARATOR)
			? path.substring(0, path.length() - 1)
			: path;
		List<String> segments = split(trimmed);
		if (segments.contains("")) {
			return Optional.empty();
		}
		return Optional.of(segments);
	}

	static String child(String parentPath, String segment) {
		if (parentPath.equals(ROOT)) {
			return ROOT + segment;
		} else {
			return parentPath + SEPARATOR + segment;
		}
	}

	/**
	 * @param path must start with {@code /}
	 */
	private static List<String> split(String path) {
		// limit -1 keeps trailing empty strings, so "/a/" yields ["a", ""]
		return Arrays.asList(path.substring(1).split(SEPARATOR, -1));
	}
}
