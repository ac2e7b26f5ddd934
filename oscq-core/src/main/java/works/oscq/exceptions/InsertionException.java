package works.oscq.exceptions;

/**
 * An endpoint could not be added to an address tree.
 * The tree is left exactly as it was before the failed call.
 */
public sealed abstract class InsertionException extends Exception permits InvalidPathException, PathConflictException {
	private final String path;

	protected InsertionException(String path, String message) {
		super(message);
		this.path = path;
	}

	/**
	 * @return the path of the endpoint that was rejected
	 */
	public String path() {
		return path;
	}
}
