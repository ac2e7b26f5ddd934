/**
 * Checked exceptions raised while building and querying an address tree.
 */
package works.oscq.exceptions;
