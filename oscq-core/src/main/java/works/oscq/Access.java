package works.oscq;

/**
 * Which OSC operations an endpoint accepts.
 * Serialized as its integer {@link #code()}, never as a name.
 */
public enum Access {
	NO_VALUE(0),
	READ_ONLY(1),
	WRITE_ONLY(2),
	READ_WRITE(3);

	private final int code;

	Access(int code) {
		this.code = code;
	}

	public int code() {
		return code;
	}

	public static Access fromCode(int code) {
		for (Access access : values()) {
			if (access.code == code) {
				return access;
			}
		}
		throw new IllegalArgumentException("No access mode has code " + code);
	}
}
