package works.oscq.exceptions;

/**
 * The endpoint would occupy a path that already holds a node,
 * or would have to descend through an existing endpoint.
 */
public final class PathConflictException extends InsertionException {
	private final String conflictingPath;

	public PathConflictException(String path, String conflictingPath, String reason) {
		super(path, "Cannot insert \"" + path + "\": " + reason + " at \"" + conflictingPath + "\"");
		this.conflictingPath = conflictingPath;
	}

	/**
	 * @return the full path of the existing node that is in the way
	 */
	public String conflictingPath() {
		return conflictingPath;
	}
}
