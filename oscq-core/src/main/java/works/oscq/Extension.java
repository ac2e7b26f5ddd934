package works.oscq;

/**
 * The optional OSCQuery features a server can advertise in
 * {@code HOST_INFO.EXTENSIONS}.
 * <p>
 * Declaration order is the order in which the flags are serialized.
 */
public enum Extension {
	ACCESS,
	VALUE,
	RANGE,
	DESCRIPTION,
	TAGS,
	EXTENDED_TYPE,
	UNIT,
	CRITICAL,
	CLIPMODE,
	LISTEN,
	PATH_CHANGED;

	/**
	 * @return the key used for this flag on the wire
	 */
	public String wireName() {
		return name();
	}
}
