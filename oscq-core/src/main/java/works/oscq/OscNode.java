package works.oscq;

/**
 * One vertex of an {@link AddressTree}: either a {@link GroupNode}
 * holding further nodes, or a {@link LeafNode} describing one OSC endpoint.
 * <p>
 * Nodes are immutable, so a published tree can be read from any number of threads.
 */
public sealed interface OscNode permits GroupNode, LeafNode {
	/**
	 * @return the full OSC address of this node; {@code "/"} for the root
	 */
	String fullPath();

	String description();

	Access access();
}
