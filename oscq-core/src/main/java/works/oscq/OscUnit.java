package works.oscq;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

/**
 * Units of measurement from the OSCQuery proposal.
 * Each category is an enum; the wire form is {@code <category>.<unit>},
 * for example {@code distance.cm} or {@code speed.km/h}.
 *
 * @see #parse
 */
public sealed interface OscUnit permits
	OscUnit.Distance,
	OscUnit.Angle,
	OscUnit.Gain,
	OscUnit.Time,
	OscUnit.Speed
{
	String category();

	/**
	 * @return the part after the category prefix
	 */
	String symbol();

	default String wireName() {
		return category() + "." + symbol();
	}

	enum Distance implements OscUnit {
		METER("m"),
		KILOMETER("km"),
		DECIMETER("dm"),
		CENTIMETER("cm"),
		MILLIMETER("mm"),
		MICROMETER("um"),
		NANOMETER("nm"),
		PICOMETER("pm"),
		INCHES("inch"),
		FEET("feet"),
		MILES("mile"),
		PIXELS("pixels");

		private final String symbol;

		Distance(String symbol) {
			this.symbol = symbol;
		}

		@Override public String category() { return "distance"; }
		@Override public String symbol() { return symbol; }
	}

	enum Angle implements OscUnit {
		DEGREE("degree"),
		RADIAN("radian");

		private final String symbol;

		Angle(String symbol) {
			this.symbol = symbol;
		}

		@Override public String category() { return "angle"; }
		@Override public String symbol() { return symbol; }
	}

	/**
	 * {@link #LINEAR} is a normalized range mapping to (-inf, 0dB];
	 * {@link #DB} is clipped to a minimum headroom value and {@link #DB_RAW} is not.
	 */
	enum Gain implements OscUnit {
		LINEAR("linear"),
		MIDIGAIN("midigain"),
		DB("db"),
		DB_RAW("db-raw");

		private final String symbol;

		Gain(String symbol) {
			this.symbol = symbol;
		}

		@Override public String category() { return "gain"; }
		@Override public String symbol() { return symbol; }
	}

	/**
	 * Time and pitch.
	 */
	enum Time implements OscUnit {
		SECOND("second"),
		BARK("bark"),
		BPM("bpm"),
		CENTS("cents"),
		HZ("hz"),
		MEL("mel"),
		MIDINOTE("midinote"),
		MILLISECOND("ms"),
		SPEED("speed"),
		SAMPLES("samples");

		private final String symbol;

		Time(String symbol) {
			this.symbol = symbol;
		}

		@Override public String category() { return "time"; }
		@Override public String symbol() { return symbol; }
	}

	enum Speed implements OscUnit {
		METERS_PER_SECOND("m/s"),
		MILES_PER_HOUR("mph"),
		KILOMETERS_PER_HOUR("km/h"),
		KNOTS("knots"),
		FEET_PER_SECOND("ft/s"),
		FEET_PER_HOUR("ft/h"),
		PIXELS_PER_SECOND("pix/s");

		private final String symbol;

		Speed(String symbol) {
			this.symbol = symbol;
		}

		@Override public String category() { return "speed"; }
		@Override public String symbol() { return symbol; }
	}

	/**
	 * @return every known unit, grouped by category
	 */
	static List<OscUnit> all() {
		return Stream.<OscUnit[]>of(
				Distance.values(),
				Angle.values(),
				Gain.values(),
				Time.values(),
				Speed.values())
			.flatMap(Arrays::stream)
			.toList();
	}

	/**
	 * Inverse of {@link #wireName()}.
	 *
	 * @throws IllegalArgumentException if {@code wireName} is not a known unit
	 */
	static OscUnit parse(String wireName) {
		return all().stream()
			.filter(u -> u.wireName().equals(wireName))
			.findFirst()
			.orElseThrow(() -> new IllegalArgumentException("Unknown unit: \"" + wireName + "\""));
	}
}
