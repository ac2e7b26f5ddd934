package works.oscq;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.oscq.exceptions.InvalidPathException;
import works.oscq.exceptions.PathConflictException;

import static java.util.Objects.requireNonNull;

/**
 * A published, immutable OSCQuery address space:
 * a root {@link GroupNode} plus the optional {@link HostInfo} that goes with it.
 * <p>
 * Trees are assembled with a {@link Builder} and can't change afterward,
 * so any number of request threads may read one concurrently without locking.
 * Live values would need a separate, synchronized store keyed by path.
 */
public final class AddressTree {
	private final GroupNode root;
	private final @Nullable HostInfo hostInfo;
	private final int endpointCount;

	private AddressTree(GroupNode root, @Nullable HostInfo hostInfo, int endpointCount) {
		this.root = root;
		this.hostInfo = hostInfo;
		this.endpointCount = endpointCount;
	}

	/**
	 * Starts a tree whose root is an empty group at {@code "/"}.
	 */
	public static Builder builder(@Nullable HostInfo hostInfo) {
		return new Builder(hostInfo);
	}

	public static Builder builder() {
		return new Builder(null);
	}

	public GroupNode root() {
		return root;
	}

	public Optional<HostInfo> hostInfo() {
		return Optional.ofNullable(hostInfo);
	}

	public int endpointCount() {
		return endpointCount;
	}

	/**
	 * Walks the tree one segment at a time.
	 * Both {@code ""} and {@code "/"} name the root, and a trailing {@code /} is ignored.
	 *
	 * @return the node at {@code path}, or empty if there is none
	 */
	public Optional<OscNode> lookup(String path) {
		Optional<List<String>> segments = OscPath.parseQuery(path);
		if (segments.isEmpty()) {
			return Optional.empty();
		}
		OscNode current = root;
		for (String segment : segments.get()) {
			if (current instanceof GroupNode group) {
				current = group.contents().get(segment);
				if (current == null) {
					return Optional.empty();
				}
			} else {
				return Optional.empty();
			}
		}
		return Optional.of(current);
	}

	@Override
	public String toString() {
		return "AddressTree(" + endpointCount + " endpoints, hostInfo=" + hostInfo + ")";
	}

	/**
	 * Accumulates endpoints before the tree is published.
	 * Not thread-safe; a builder is meant to be used by one thread and then discarded.
	 */
	public static final class Builder {
		private final @Nullable HostInfo hostInfo;
		private final PendingGroup root = new PendingGroup(OscPath.ROOT);
		private int endpointCount = 0;

		private Builder(@Nullable HostInfo hostInfo) {
			this.hostInfo = hostInfo;
		}

		/**
		 * Adds a leaf for {@code descriptor}, creating any missing groups along its path.
		 * <p>
		 * All checks happen before anything is modified,
		 * so a failed call leaves the builder exactly as it was.
		 *
		 * @throws InvalidPathException if the path is malformed
		 * @throws PathConflictException if a node already exists at the path,
		 * or an existing endpoint lies along it
		 */
		public Builder insert(EndpointDescriptor descriptor) throws InvalidPathException, PathConflictException {
			requireNonNull(descriptor);
			String path = descriptor.path();
			List<String> segments = OscPath.parseEndpoint(path);
			int last = segments.size() - 1;

			// Find how far the existing groups reach, checking for conflicts along the way
			PendingGroup deepestExisting = root;
			int depth = 0;
			while (depth < last) {
				Pending next = deepestExisting.children.get(segments.get(depth));
				if (next == null) {
					break;
				} else if (next instanceof PendingLeaf leaf) {
					throw new PathConflictException(path, leaf.node.fullPath(), "an endpoint already exists");
				}
				deepestExisting = (PendingGroup) next;
				depth++;
			}
			if (depth == last) {
				Pending occupant = deepestExisting.children.get(segments.get(last));
				if (occupant != null) {
					String reason = (occupant instanceof PendingGroup)
						? "a group already exists"
						: "an endpoint already exists";
					throw new PathConflictException(path, occupant.fullPath(), reason);
				}
			}

			// Validated. Now it's safe to modify.
			PendingGroup parent = deepestExisting;
			for (; depth < last; depth++) {
				PendingGroup created = new PendingGroup(OscPath.child(parent.fullPath, segments.get(depth)));
				parent.children.put(segments.get(depth), created);
				LOGGER.trace("Created group {}", created.fullPath);
				parent = created;
			}
			LeafNode leaf = descriptor.toLeaf();
			assert leaf.fullPath().equals(OscPath.child(parent.fullPath, segments.get(last)));
			parent.children.put(segments.get(last), new PendingLeaf(leaf));
			endpointCount++;
			LOGGER.debug("Inserted endpoint {} type \"{}\" access {}", path, leaf.typeTag(), leaf.access());
			return this;
		}

		/**
		 * Takes an immutable snapshot of everything inserted so far.
		 */
		public AddressTree build() {
			AddressTree result = new AddressTree(root.freeze(), hostInfo, endpointCount);
			LOGGER.info("Built address tree with {} endpoint{}", endpointCount, (endpointCount == 1) ? "" : "s");
			return result;
		}
	}

	private sealed interface Pending permits PendingGroup, PendingLeaf {
		String fullPath();
		OscNode freeze();
	}

	private static final class PendingGroup implements Pending {
		final String fullPath;
		final Map<String, Pending> children = new LinkedHashMap<>();

		PendingGroup(String fullPath) {
			this.fullPath = fullPath;
		}

		@Override
		public String fullPath() {
			return fullPath;
		}

		@Override
		public GroupNode freeze() {
			Map<String, OscNode> contents = new LinkedHashMap<>();
			children.forEach((segment, child) -> contents.put(segment, child.freeze()));
			return new GroupNode(fullPath, "", contents);
		}
	}

	private record PendingLeaf(LeafNode node) implements Pending {
		@Override
		public String fullPath() {
			return node.fullPath();
		}

		@Override
		public OscNode freeze() {
			return node;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AddressTree.class);
}
