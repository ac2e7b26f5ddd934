/**
 * JSON encoding of OSCQuery address trees using Jackson, and the query resolver
 * that answers discovery requests.
 * <p>
 * See {@link works.oscq.jackson.OscQueryResolver} for the main entry point.
 */
package works.oscq.jackson;
