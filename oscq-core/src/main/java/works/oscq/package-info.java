/**
 * The OSCQuery address-tree model.
 * <p>
 * Build a tree by inserting {@link works.oscq.EndpointDescriptor}s into an
 * {@link works.oscq.AddressTree.Builder}; the resulting {@link works.oscq.AddressTree}
 * is immutable and can be served to any number of clients.
 * Encoding it as JSON lives in the {@code oscq-jackson} module.
 */
package works.oscq;
