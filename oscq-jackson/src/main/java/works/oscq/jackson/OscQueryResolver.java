package works.oscq.jackson;

import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import works.oscq.AddressTree;
import works.oscq.Attribute;
import works.oscq.HostInfo;
import works.oscq.OscNode;
import works.oscq.Query;
import works.oscq.exceptions.NodeNotFoundException;

import static java.util.Objects.requireNonNull;

/**
 * Answers OSCQuery discovery requests against one published {@link AddressTree}.
 * <ol>
 *     <li>
 *         {@code ?HOST_INFO} returns the host info object whatever the path,
 *         even a path with no node; a tree without host info answers {@code {}}.
 *     </li>
 *     <li>
 *         Otherwise the path must name a node, or {@link NodeNotFoundException} is thrown.
 *     </li>
 *     <li>
 *         With no attribute, the answer is the node's full object.
 *         With one, it is an object holding just that attribute, or {@code {}}
 *         if the node doesn't carry it. Missing metadata is not an error.
 *     </li>
 * </ol>
 * Holds no per-request state, so one instance can serve any number of threads.
 */
public final class OscQueryResolver {
	private final AddressTree tree;
	private final ObjectMapper mapper;

	/**
	 * @param mapper must have the {@link OscQuerySerializer#module() module} installed
	 */
	public OscQueryResolver(AddressTree tree, ObjectMapper mapper) {
		this.tree = requireNonNull(tree);
		this.mapper = requireNonNull(mapper);
	}

	public OscQueryResolver(AddressTree tree) {
		this(tree, new OscQuerySerializer().mapperBuilder().build());
	}

	public AddressTree tree() {
		return tree;
	}

	public JsonNode resolve(Query query) throws NodeNotFoundException {
		return mapper.valueToTree(payload(query));
	}

	public JsonNode resolve(String path, @Nullable String attribute) throws NodeNotFoundException {
		return resolve(new Query(path, Optional.ofNullable(attribute)));
	}

	/**
	 * Like {@link #resolve} but with the outcome expressed as a status and body,
	 * ready for a transport to send.
	 *
	 * @param rawQuery the query string without its {@code ?}, or null
	 */
	public OscQueryResponse respond(String path, @Nullable String rawQuery) {
		Query query = Query.parse(path, rawQuery);
		try {
			String body = mapper.writeValueAsString(payload(query));
			LOGGER.debug("{} -> {} bytes", query, body.length());
			return OscQueryResponse.ok(body);
		} catch (NodeNotFoundException e) {
			LOGGER.debug("{} -> not found", query);
			return OscQueryResponse.notFound();
		}
	}

	/**
	 * @return the object to serialize for {@code query}
	 */
	private Object payload(Query query) throws NodeNotFoundException {
		if (query.isHostInfo()) {
			return tree.hostInfo()
				.<Object>map(h -> h)
				.orElseGet(mapper::createObjectNode);
		}

		OscNode node = tree.lookup(query.path())
			.orElseThrow(() -> new NodeNotFoundException(query.path()));
		HostInfo hostInfo = (node == tree.root())
			? tree.hostInfo().orElse(null)
			: null;

		if (query.attribute().isEmpty()) {
			return new NodeView(node, hostInfo, null);
		}
		Optional<Attribute> attribute = query.knownAttribute();
		if (attribute.isEmpty()) {
			LOGGER.trace("Unknown attribute {} requested at {}", query.attribute().get(), query.path());
			return mapper.createObjectNode();
		}
		return new NodeView(node, hostInfo, attribute.get());
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(OscQueryResolver.class);
}
