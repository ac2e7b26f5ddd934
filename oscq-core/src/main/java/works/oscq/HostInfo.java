package works.oscq;

import lombok.Builder;
import lombok.With;

import static java.util.Objects.requireNonNull;

/**
 * Identity of an OSCQuery server and the OSC endpoint clients should talk to.
 * Only the root of an {@link AddressTree} carries one.
 *
 * @param oscTransport defaults to {@value #DEFAULT_TRANSPORT}
 * @param extensions defaults to {@link ExtensionSet#none()}
 */
@With
@Builder(toBuilder = true)
public record HostInfo(
	String name,
	String oscIp,
	int oscPort,
	String oscTransport,
	ExtensionSet extensions
) {
	public static final String DEFAULT_TRANSPORT = "UDP";

	public HostInfo {
		requireNonNull(name);
		requireNonNull(oscIp);
		if (oscPort < 0 || oscPort > 65535) {
			throw new IllegalArgumentException("OSC port out of range: " + oscPort);
		}
		if (oscTransport == null) {
			oscTransport = DEFAULT_TRANSPORT;
		}
		if (extensions == null) {
			extensions = ExtensionSet.none();
		}
	}

	public static HostInfo of(String name, String oscIp, int oscPort) {
		return new HostInfo(name, oscIp, oscPort, DEFAULT_TRANSPORT, ExtensionSet.none());
	}

	public HostInfo withExtension(Extension extension) {
		return withExtensions(extensions.enable(extension));
	}
}
