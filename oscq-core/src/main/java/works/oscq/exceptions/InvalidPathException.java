package works.oscq.exceptions;

/**
 * The endpoint path is not a well-formed OSC address:
 * it doesn't start with {@code /}, has an empty segment,
 * or uses a character OSC reserves for address patterns.
 */
public final class InvalidPathException extends InsertionException {
	public InvalidPathException(String path, String reason) {
		super(path, "Invalid path \"" + path + "\": " + reason);
	}
}
