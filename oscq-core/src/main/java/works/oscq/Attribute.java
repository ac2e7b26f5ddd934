package works.oscq;

import java.util.Optional;

/**
 * The attribute keys of the OSCQuery JSON schema.
 * Each can also be requested on its own with a query string such as {@code ?VALUE}.
 */
public enum Attribute {
	DESCRIPTION,
	FULL_PATH,
	ACCESS,
	CONTENTS,
	TYPE,
	VALUE,
	RANGE,
	UNIT,

	/**
	 * Root-scoped: answered with the server's {@link HostInfo} whatever the requested path.
	 */
	HOST_INFO;

	public String wireName() {
		return name();
	}

	/**
	 * Attribute names are case-sensitive, as in the OSCQuery proposal.
	 */
	public static Optional<Attribute> fromWireName(String name) {
		for (Attribute attribute : values()) {
			if (attribute.wireName().equals(name)) {
				return Optional.of(attribute);
			}
		}
		return Optional.empty();
	}
}
