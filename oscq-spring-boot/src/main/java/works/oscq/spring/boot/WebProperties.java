package works.oscq.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param enabled whether to serve the tree at all; defaults to true
 * @param prettyPrint indent JSON responses; defaults to false
 * @param allowedOrigin if set, sent as {@code Access-Control-Allow-Origin}
 *                      so browser-based OSCQuery clients can read the responses
 */
@ConfigurationProperties(prefix = "oscq.web")
public record WebProperties(
	Boolean enabled,
	Boolean prettyPrint,
	String allowedOrigin
) {
	public boolean isPrettyPrint() {
		return Boolean.TRUE.equals(prettyPrint);
	}
}
