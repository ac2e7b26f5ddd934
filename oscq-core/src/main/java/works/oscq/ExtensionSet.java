package works.oscq;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * An immutable set of enabled {@link Extension}s.
 * <p>
 * Enabling is idempotent and order-independent: any sequence of
 * {@link #enable} calls naming the same extensions yields equal sets.
 * <p>
 * An enabled extension declares a capability only. Nothing checks that the
 * nodes of a tree actually carry the corresponding attributes.
 */
public final class ExtensionSet {
	private final Set<Extension> enabled;

	private ExtensionSet(Set<Extension> enabled) {
		this.enabled = enabled;
	}

	public static ExtensionSet none() {
		return NONE;
	}

	public static ExtensionSet all() {
		return new ExtensionSet(Collections.unmodifiableSet(EnumSet.allOf(Extension.class)));
	}

	public static ExtensionSet of(Extension... extensions) {
		ExtensionSet result = NONE;
		for (Extension e : extensions) {
			result = result.enable(e);
		}
		return result;
	}

	public ExtensionSet enable(Extension extension) {
		if (enabled.contains(extension)) {
			return this;
		}
		EnumSet<Extension> copy = enabled.isEmpty()
			? EnumSet.noneOf(Extension.class)
			: EnumSet.copyOf(enabled);
		copy.add(extension);
		return new ExtensionSet(Collections.unmodifiableSet(copy));
	}

	public boolean isEnabled(Extension extension) {
		return enabled.contains(extension);
	}

	/**
	 * @return every known extension, in declaration order, mapped to whether it is enabled.
	 * No extension is ever left out.
	 */
	public Map<Extension, Boolean> asMap() {
		Map<Extension, Boolean> result = new LinkedHashMap<>();
		for (Extension e : Extension.values()) {
			result.put(e, enabled.contains(e));
		}
		return Collections.unmodifiableMap(result);
	}

	@Override
	public boolean equals(Object o) {
		if (o == null || getClass() != o.getClass()) {
			return false;
		}
		return enabled.equals(((ExtensionSet) o).enabled);
	}

	@Override
	public int hashCode() {
		return enabled.hashCode();
	}

	@Override
	public String toString() {
		return "ExtensionSet" + enabled;
	}

	private static final ExtensionSet NONE = new ExtensionSet(Collections.unmodifiableSet(EnumSet.noneOf(Extension.class)));
}
