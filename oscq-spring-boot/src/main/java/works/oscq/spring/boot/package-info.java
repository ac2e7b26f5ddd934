/**
 * Spring Boot auto-configuration that serves an {@link works.oscq.AddressTree} bean
 * as an OSCQuery HTTP endpoint.
 */
package works.oscq.spring.boot;
