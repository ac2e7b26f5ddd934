package works.oscq.example;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import works.oscq.Access;
import works.oscq.AddressTree;
import works.oscq.EndpointDescriptor;
import works.oscq.Extension;
import works.oscq.HostInfo;
import works.oscq.OscUnit;
import works.oscq.OscValue;
import works.oscq.Range;
import works.oscq.exceptions.InsertionException;

/**
 * The address space of a toy synthesizer.
 * Nothing listens on the advertised OSC port; this only demonstrates discovery.
 */
@Configuration
public class SynthTree {

	@Bean
	AddressTree addressTree(
		@Value("${oscq.example.name:Example Synth}") String name,
		@Value("${oscq.example.osc-ip:127.0.0.1}") String oscIp,
		@Value("${oscq.example.osc-port:9000}") int oscPort
	) throws InsertionException {
		HostInfo hostInfo = HostInfo.of(name, oscIp, oscPort)
			.withExtension(Extension.ACCESS)
			.withExtension(Extension.VALUE)
			.withExtension(Extension.RANGE)
			.withExtension(Extension.DESCRIPTION)
			.withExtension(Extension.UNIT);
		AddressTree tree = AddressTree.builder(hostInfo)
			.insert(EndpointDescriptor.builder()
				.path("/synth/cutoff")
				.initialValue(OscValue.of(440f))
				.description("Filter cutoff frequency")
				.range(Range.of(20f, 20000f))
				.unit(OscUnit.Time.HZ)
				.build())
			.insert(EndpointDescriptor.builder()
				.path("/synth/resonance")
				.initialValue(OscValue.of(0.2f))
				.description("Filter resonance")
				.range(Range.of(0f, 1f))
				.build())
			.insert(EndpointDescriptor.builder()
				.path("/synth/waveform")
				.initialValue(OscValue.of("saw"))
				.description("Oscillator waveform")
				.build())
			.insert(EndpointDescriptor.builder()
				.path("/mixer/volume")
				.initialValue(OscValue.of(-6f))
				.description("Output level")
				.range(Range.of(-96f, 6f))
				.unit(OscUnit.Gain.DB)
				.build())
			.insert(EndpointDescriptor.builder()
				.path("/transport/playing")
				.initialValue(OscValue.of(false))
				.access(Access.READ_ONLY)
				.description("Whether the sequencer is running")
				.build())
			.insert(EndpointDescriptor.builder()
				.path("/transport/tap")
				.initialValue(OscValue.impulse())
				.access(Access.WRITE_ONLY)
				.description("Tap tempo")
				.build())
			.build();
		LOGGER.info("Serving {} for \"{}\" (OSC at {}:{})", tree, name, oscIp, oscPort);
		return tree;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(SynthTree.class);
}
