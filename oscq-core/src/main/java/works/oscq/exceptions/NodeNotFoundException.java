package works.oscq.exceptions;

/**
 * A query named a path that has no node.
 * Transports report this to the client as "not found".
 */
public class NodeNotFoundException extends Exception {
	private final String path;

	public NodeNotFoundException(String path) {
		super("No node at \"" + path + "\"");
		this.path = path;
	}

	public String path() {
		return path;
	}
}
