package works.oscq.jackson;

import org.jetbrains.annotations.Nullable;
import works.oscq.Attribute;
import works.oscq.HostInfo;
import works.oscq.OscNode;

/**
 * What to write for one node: the whole object, or only one of its attributes.
 *
 * @param hostInfo non-null only for the root, whose object also carries {@code HOST_INFO}
 * @param only if non-null, the single attribute to write; the object is empty if the node lacks it
 */
record NodeView(
	OscNode node,
	@Nullable HostInfo hostInfo,
	@Nullable Attribute only
) {
	boolean includes(Attribute attribute) {
		return only == null || only == attribute;
	}
}
