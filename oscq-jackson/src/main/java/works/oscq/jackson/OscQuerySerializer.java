package works.oscq.jackson;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.illposed.osc.argument.OSCColor;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.concurrent.ConcurrentHashMap;
import org.jetbrains.annotations.Nullable;
import tools.jackson.core.JsonGenerator;
import tools.jackson.databind.BeanDescription;
import tools.jackson.databind.JavaType;
import tools.jackson.databind.SerializationConfig;
import tools.jackson.databind.SerializationContext;
import tools.jackson.databind.ValueSerializer;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.ser.Serializers;
import works.oscq.Access;
import works.oscq.AddressTree;
import works.oscq.Extension;
import works.oscq.ExtensionSet;
import works.oscq.GroupNode;
import works.oscq.HostInfo;
import works.oscq.LeafNode;
import works.oscq.OscNode;
import works.oscq.OscUnit;
import works.oscq.OscValue;
import works.oscq.OscValue.ArrayValue;
import works.oscq.OscValue.BlobValue;
import works.oscq.OscValue.BoolValue;
import works.oscq.OscValue.CharValue;
import works.oscq.OscValue.ColorValue;
import works.oscq.OscValue.DoubleValue;
import works.oscq.OscValue.FloatValue;
import works.oscq.OscValue.ImpulseValue;
import works.oscq.OscValue.IntValue;
import works.oscq.OscValue.LongValue;
import works.oscq.OscValue.MidiValue;
import works.oscq.OscValue.NilValue;
import works.oscq.OscValue.StringValue;
import works.oscq.OscValue.TimeTagValue;
import works.oscq.Range;

import static works.oscq.Attribute.ACCESS;
import static works.oscq.Attribute.CONTENTS;
import static works.oscq.Attribute.DESCRIPTION;
import static works.oscq.Attribute.FULL_PATH;
import static works.oscq.Attribute.HOST_INFO;
import static works.oscq.Attribute.RANGE;
import static works.oscq.Attribute.TYPE;
import static works.oscq.Attribute.UNIT;
import static works.oscq.Attribute.VALUE;

/**
 * Writes address trees in the JSON format of the OSCQuery proposal.
 * <p>
 * The output is exact: field names, field order, and number formats
 * are what OSCQuery clients expect, so everything is written by hand
 * rather than left to Jackson's bean introspection.
 * <p>
 * Node fields appear in this order: {@code DESCRIPTION}, {@code FULL_PATH}, {@code ACCESS},
 * {@code CONTENTS} (groups only), {@code TYPE}, {@code VALUE}, {@code RANGE}, {@code UNIT}
 * (leaves only; the last two only when present), and {@code HOST_INFO} (root only).
 */
public final class OscQuerySerializer {

	public OscQuerySerializer() {
	}

	public OscQueryJacksonModule module() {
		return new OscQueryJacksonModule(new OscQuerySerializers());
	}

	/**
	 * @return a builder already configured with {@link #module()}
	 */
	public JsonMapper.Builder mapperBuilder() {
		return JsonMapper.builder()
			.addModule(module());
	}

	private static final class OscQuerySerializers extends Serializers.Base {
		private final Map<JavaType, ValueSerializer<?>> memo = new ConcurrentHashMap<>();

		@Override
		public ValueSerializer<?> findSerializer(SerializationConfig config, JavaType type, BeanDescription.Supplier beanDescRef, JsonFormat.Value formatOverrides) {
			return lookup(type);
		}

		/**
		 * Enums never reach {@link #findSerializer}.
		 */
		@Override
		public ValueSerializer<?> findEnumSerializer(SerializationConfig config, JavaType type, BeanDescription.Supplier beanDescRef, JsonFormat.Value formatOverrides) {
			return lookup(type);
		}

		private @Nullable ValueSerializer<?> lookup(JavaType type) {
			ValueSerializer<?> result = memo.get(type);
			if (result == null) {
				result = getValueSerializer(type.getRawClass());
				if (result != null) {
					memo.put(type, result);
				}
			}
			return result;
		}

		private static @Nullable ValueSerializer<?> getValueSerializer(Class<?> theClass) {
			if (AddressTree.class.isAssignableFrom(theClass)) {
				return addressTreeSerializer();
			} else if (NodeView.class.isAssignableFrom(theClass)) {
				return nodeViewSerializer();
			} else if (OscNode.class.isAssignableFrom(theClass)) {
				return nodeSerializer();
			} else if (HostInfo.class.isAssignableFrom(theClass)) {
				return hostInfoSerializer();
			} else if (ExtensionSet.class.isAssignableFrom(theClass)) {
				return extensionSetSerializer();
			} else if (OscValue.class.isAssignableFrom(theClass)) {
				return valueSerializer();
			} else if (Range.class.isAssignableFrom(theClass)) {
				return rangeSerializer();
			} else if (OscUnit.class.isAssignableFrom(theClass)) {
				return unitSerializer();
			} else if (Access.class.isAssignableFrom(theClass)) {
				return accessSerializer();
			} else {
				return null;
			}
		}

		private static ValueSerializer<AddressTree> addressTreeSerializer() {
			return new ValueSerializer<>() {
				@Override
				public void serialize(AddressTree value, JsonGenerator gen, SerializationContext serializers) {
					writeNode(gen, new NodeView(value.root(), value.hostInfo().orElse(null), null));
				}
			};
		}

		private static ValueSerializer<NodeView> nodeViewSerializer() {
			return new ValueSerializer<>() {
				@Override
				public void serialize(NodeView value, JsonGenerator gen, SerializationContext serializers) {
					writeNode(gen, value);
				}
			};
		}

		private static ValueSerializer<OscNode> nodeSerializer() {
			return new ValueSerializer<>() {
				@Override
				public void serialize(OscNode value, JsonGenerator gen, SerializationContext serializers) {
					writeNode(gen, new NodeView(value, null, null));
				}
			};
		}

		private static ValueSerializer<HostInfo> hostInfoSerializer() {
			return new ValueSerializer<>() {
				@Override
				public void serialize(HostInfo value, JsonGenerator gen, SerializationContext serializers) {
					writeHostInfo(gen, value);
				}
			};
		}

		private static ValueSerializer<ExtensionSet> extensionSetSerializer() {
			return new ValueSerializer<>() {
				@Override
				public void serialize(ExtensionSet value, JsonGenerator gen, SerializationContext serializers) {
					writeExtensions(gen, value);
				}
			};
		}

		private static ValueSerializer<OscValue> valueSerializer() {
			return new ValueSerializer<>() {
				@Override
				public void serialize(OscValue value, JsonGenerator gen, SerializationContext serializers) {
					writeValue(gen, value);
				}
			};
		}

		private static ValueSerializer<Range> rangeSerializer() {
			return new ValueSerializer<>() {
				@Override
				public void serialize(Range value, JsonGenerator gen, SerializationContext serializers) {
					writeRange(gen, value);
				}
			};
		}

		private static ValueSerializer<OscUnit> unitSerializer() {
			return new ValueSerializer<>() {
				@Override
				public void serialize(OscUnit value, JsonGenerator gen, SerializationContext serializers) {
					gen.writeString(value.wireName());
				}
			};
		}

		private static ValueSerializer<Access> accessSerializer() {
			return new ValueSerializer<>() {
				@Override
				public void serialize(Access value, JsonGenerator gen, SerializationContext serializers) {
					gen.writeNumber(value.code());
				}
			};
		}
	}

	static void writeNode(JsonGenerator gen, NodeView view) {
		OscNode node = view.node();
		gen.writeStartObject();
		if (view.includes(DESCRIPTION)) {
			gen.writeName(DESCRIPTION.wireName());
			gen.writeString(node.description());
		}
		if (view.includes(FULL_PATH)) {
			gen.writeName(FULL_PATH.wireName());
			gen.writeString(node.fullPath());
		}
		if (view.includes(ACCESS)) {
			gen.writeName(ACCESS.wireName());
			gen.writeNumber(node.access().code());
		}
		if (node instanceof GroupNode group) {
			if (view.includes(CONTENTS)) {
				gen.writeName(CONTENTS.wireName());
				writeContents(gen, group);
			}
		} else if (node instanceof LeafNode leaf) {
			writeLeafFields(gen, leaf, view);
		} else {
			throw new IllegalStateException("Unexpected node type: " + node.getClass());
		}
		if (view.hostInfo() != null && view.includes(HOST_INFO)) {
			gen.writeName(HOST_INFO.wireName());
			writeHostInfo(gen, view.hostInfo());
		}
		gen.writeEndObject();
	}

	private static void writeContents(JsonGenerator gen, GroupNode group) {
		gen.writeStartObject();
		for (Entry<String, OscNode> child : group.contents().entrySet()) {
			gen.writeName(child.getKey());
			writeNode(gen, new NodeView(child.getValue(), null, null));
		}
		gen.writeEndObject();
	}

	private static void writeLeafFields(JsonGenerator gen, LeafNode leaf, NodeView view) {
		if (view.includes(TYPE)) {
			gen.writeName(TYPE.wireName());
			gen.writeString(leaf.typeTag());
		}
		if (view.includes(VALUE)) {
			gen.writeName(VALUE.wireName());
			writeValues(gen, leaf.values());
		}
		if (view.includes(RANGE) && leaf.range().isPresent()) {
			gen.writeName(RANGE.wireName());
			gen.writeStartArray();
			for (Range range : leaf.range().get()) {
				writeRange(gen, range);
			}
			gen.writeEndArray();
		}
		if (view.includes(UNIT) && leaf.unit().isPresent()) {
			gen.writeName(UNIT.wireName());
			gen.writeStartArray();
			for (OscUnit unit : leaf.unit().get()) {
				gen.writeString(unit.wireName());
			}
			gen.writeEndArray();
		}
	}

	private static void writeValues(JsonGenerator gen, List<OscValue> values) {
		gen.writeStartArray();
		for (OscValue value : values) {
			writeValue(gen, value);
		}
		gen.writeEndArray();
	}

	/**
	 * Floats are written as floats, so {@code 1.0f} comes out as {@code 1.0}
	 * rather than with the extra digits of its double widening.
	 * JSON has no NaN or infinity; those are written as {@code null}.
	 */
	static void writeValue(JsonGenerator gen, OscValue value) {
		if (value instanceof IntValue v) {
			gen.writeNumber(v.value());
		} else if (value instanceof FloatValue v) {
			if (Float.isFinite(v.value())) {
				gen.writeNumber(v.value());
			} else {
				gen.writeNull();
			}
		} else if (value instanceof StringValue v) {
			gen.writeString(v.value());
		} else if (value instanceof BlobValue v) {
			gen.writeBinary(v.value());
		} else if (value instanceof TimeTagValue v) {
			// NTP time is an unsigned 64-bit quantity
			gen.writeNumber(new BigInteger(Long.toUnsignedString(v.value().getNtpTime())));
		} else if (value instanceof LongValue v) {
			gen.writeNumber(v.value());
		} else if (value instanceof DoubleValue v) {
			if (Double.isFinite(v.value())) {
				gen.writeNumber(v.value());
			} else {
				gen.writeNull();
			}
		} else if (value instanceof CharValue v) {
			gen.writeString(String.valueOf(v.value()));
		} else if (value instanceof ColorValue v) {
			gen.writeString(colorString(v.value()));
		} else if (value instanceof MidiValue v) {
			gen.writeStartArray();
			for (byte b : v.value().toContentArray()) {
				gen.writeNumber(b & 0xFF);
			}
			gen.writeEndArray();
		} else if (value instanceof BoolValue v) {
			gen.writeBoolean(v.value());
		} else if (value instanceof NilValue || value instanceof ImpulseValue) {
			gen.writeNull();
		} else if (value instanceof ArrayValue v) {
			writeValues(gen, v.elements());
		} else {
			throw new IllegalStateException("Unexpected value type: " + value.getClass());
		}
	}

	static String colorString(OSCColor color) {
		return String.format("#%02x%02x%02x%02x",
			color.getRed() & 0xFF,
			color.getGreen() & 0xFF,
			color.getBlue() & 0xFF,
			color.getAlpha() & 0xFF);
	}

	private static void writeRange(JsonGenerator gen, Range range) {
		gen.writeStartObject();
		gen.writeName("MIN");
		gen.writeNumber(range.min());
		gen.writeName("MAX");
		gen.writeNumber(range.max());
		gen.writeEndObject();
	}

	static void writeHostInfo(JsonGenerator gen, HostInfo hostInfo) {
		gen.writeStartObject();
		gen.writeName("NAME");
		gen.writeString(hostInfo.name());
		gen.writeName("OSC_IP");
		gen.writeString(hostInfo.oscIp());
		gen.writeName("OSC_PORT");
		gen.writeNumber(hostInfo.oscPort());
		gen.writeName("OSC_TRANSPORT");
		gen.writeString(hostInfo.oscTransport());
		gen.writeName("EXTENSIONS");
		writeExtensions(gen, hostInfo.extensions());
		gen.writeEndObject();
	}

	/**
	 * Every known extension is listed, enabled or not.
	 * Clients rely on that to tell "unsupported" from "unknown".
	 */
	private static void writeExtensions(JsonGenerator gen, ExtensionSet extensions) {
		gen.writeStartObject();
		for (Entry<Extension, Boolean> entry : extensions.asMap().entrySet()) {
			gen.writeName(entry.getKey().wireName());
			gen.writeBoolean(entry.getValue());
		}
		gen.writeEndObject();
	}

}
