package works.oscq.jackson;

import tools.jackson.core.Version;
import tools.jackson.databind.JacksonModule;
import tools.jackson.databind.ser.Serializers;

import static java.util.Objects.requireNonNull;

/**
 * Installs the OSCQuery serializers into a mapper.
 * Obtain one from {@link OscQuerySerializer#module()}.
 */
public final class OscQueryJacksonModule extends JacksonModule {
	private final Serializers serializers;

	OscQueryJacksonModule(Serializers serializers) {
		this.serializers = requireNonNull(serializers);
	}

	@Override
	public String getModuleName() {
		return "OscQuery";
	}

	@Override
	public Version version() {
		return Version.unknownVersion();
	}

	@Override
	public void setupModule(SetupContext context) {
		context.addSerializers(serializers);
	}

}
