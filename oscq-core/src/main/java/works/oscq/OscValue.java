package works.oscq;

import com.illposed.osc.argument.OSCColor;
import com.illposed.osc.argument.OSCImpulse;
import com.illposed.osc.argument.OSCMidiMessage;
import com.illposed.osc.argument.OSCTimeTag64;
import java.util.Arrays;
import java.util.List;

import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * One typed OSC argument, as stored in the {@code VALUE} of a {@link LeafNode}.
 * <p>
 * The set of variants is closed. Each one knows its OSC type tag;
 * encoding the value as JSON is the serializer's job.
 * Payloads with structure of their own (colors, MIDI messages, time tags)
 * use the JavaOSC argument classes.
 */
public sealed interface OscValue permits
	OscValue.IntValue,
	OscValue.FloatValue,
	OscValue.StringValue,
	OscValue.BlobValue,
	OscValue.TimeTagValue,
	OscValue.LongValue,
	OscValue.DoubleValue,
	OscValue.CharValue,
	OscValue.ColorValue,
	OscValue.MidiValue,
	OscValue.BoolValue,
	OscValue.NilValue,
	OscValue.ImpulseValue,
	OscValue.ArrayValue
{
	/**
	 * @return the OSC type tag string for this value, such as {@code "f"},
	 * or {@code "[ff]"} for an array
	 */
	String typeTag();

	record IntValue(int value) implements OscValue {
		@Override public String typeTag() { return "i"; }
	}

	record FloatValue(float value) implements OscValue {
		@Override public String typeTag() { return "f"; }
	}

	record StringValue(String value) implements OscValue {
		public StringValue {
			requireNonNull(value);
		}

		@Override public String typeTag() { return "s"; }
	}

	record BlobValue(byte[] value) implements OscValue {
		public BlobValue {
			value = value.clone();
		}

		@Override
		public byte[] value() {
			return value.clone();
		}

		@Override public String typeTag() { return "b"; }

		@Override
		public boolean equals(Object o) {
			return o instanceof BlobValue other && Arrays.equals(value, other.value);
		}

		@Override
		public int hashCode() {
			return Arrays.hashCode(value);
		}

		@Override
		public String toString() {
			return "BlobValue[" + value.length + " bytes]";
		}
	}

	record TimeTagValue(OSCTimeTag64 value) implements OscValue {
		public TimeTagValue {
			requireNonNull(value);
		}

		@Override public String typeTag() { return "t"; }
	}

	record LongValue(long value) implements OscValue {
		@Override public String typeTag() { return "h"; }
	}

	record DoubleValue(double value) implements OscValue {
		@Override public String typeTag() { return "d"; }
	}

	record CharValue(char value) implements OscValue {
		@Override public String typeTag() { return "c"; }
	}

	record ColorValue(OSCColor value) implements OscValue {
		public ColorValue {
			requireNonNull(value);
		}

		@Override public String typeTag() { return "r"; }
	}

	record MidiValue(OSCMidiMessage value) implements OscValue {
		public MidiValue {
			requireNonNull(value);
		}

		@Override public String typeTag() { return "m"; }
	}

	record BoolValue(boolean value) implements OscValue {
		@Override public String typeTag() { return value ? "T" : "F"; }
	}

	record NilValue() implements OscValue {
		@Override public String typeTag() { return "N"; }
	}

	/**
	 * OSC's "infinitum", which JavaOSC calls an impulse.
	 */
	record ImpulseValue() implements OscValue {
		@Override public String typeTag() { return "I"; }
	}

	record ArrayValue(List<OscValue> elements) implements OscValue {
		public ArrayValue {
			elements = List.copyOf(elements);
		}

		@Override
		public String typeTag() {
			return elements.stream()
				.map(OscValue::typeTag)
				.collect(joining("", "[", "]"));
		}
	}

	static OscValue of(int value) { return new IntValue(value); }
	static OscValue of(float value) { return new FloatValue(value); }
	static OscValue of(String value) { return new StringValue(value); }
	static OscValue of(byte[] value) { return new BlobValue(value); }
	static OscValue of(OSCTimeTag64 value) { return new TimeTagValue(value); }
	static OscValue of(long value) { return new LongValue(value); }
	static OscValue of(double value) { return new DoubleValue(value); }
	static OscValue of(char value) { return new CharValue(value); }
	static OscValue of(OSCColor value) { return new ColorValue(value); }
	static OscValue of(OSCMidiMessage value) { return new MidiValue(value); }
	static OscValue of(boolean value) { return new BoolValue(value); }
	static OscValue nil() { return NIL; }
	static OscValue impulse() { return IMPULSE; }
	static OscValue array(OscValue... elements) { return new ArrayValue(List.of(elements)); }

	/**
	 * Converts an argument of a JavaOSC message into the corresponding variant.
	 * {@code null} is nil, and a {@link List} becomes an {@link ArrayValue}.
	 *
	 * @throws IllegalArgumentException if the argument type has no OSC equivalent
	 */
	static OscValue fromArgument(Object argument) {
		if (argument == null) {
			return NIL;
		} else if (argument instanceof Integer i) {
			return of(i.intValue());
		} else if (argument instanceof Float f) {
			return of(f.floatValue());
		} else if (argument instanceof String s) {
			return of(s);
		} else if (argument instanceof byte[] b) {
			return of(b);
		} else if (argument instanceof OSCTimeTag64 t) {
			return of(t);
		} else if (argument instanceof Long l) {
			return of(l.longValue());
		} else if (argument instanceof Double d) {
			return of(d.doubleValue());
		} else if (argument instanceof Character c) {
			return of(c.charValue());
		} else if (argument instanceof OSCColor c) {
			return of(c);
		} else if (argument instanceof OSCMidiMessage m) {
			return of(m);
		} else if (argument instanceof Boolean b) {
			return of(b.booleanValue());
		} else if (argument instanceof OSCImpulse) {
			return IMPULSE;
		} else if (argument instanceof List<?> list) {
			return new ArrayValue(list.stream()
				.map(OscValue::fromArgument)
				.toList());
		} else {
			throw new IllegalArgumentException("Unsupported OSC argument type: " + argument.getClass().getName());
		}
	}

	OscValue NIL = new NilValue();
	OscValue IMPULSE = new ImpulseValue();
}
