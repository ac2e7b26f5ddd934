package works.oscq.spring.boot;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UriUtils;
import works.oscq.jackson.OscQueryResolver;
import works.oscq.jackson.OscQueryResponse;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.springframework.http.HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN;

/**
 * Serves the address tree: every {@code GET} or {@code HEAD} is an OSCQuery request,
 * whose path names a node and whose query string optionally names one attribute.
 * Other methods continue down the filter chain untouched.
 */
@RequiredArgsConstructor
public class OscQueryFilter extends OncePerRequestFilter {
	private final OscQueryResolver resolver;
	private final WebProperties properties;

	@Override
	protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain) throws ServletException, IOException {
		if (!isQuery(request)) {
			filterChain.doFilter(request, response);
			return;
		}

		String path = UriUtils.decode(
			request.getRequestURI().substring(request.getContextPath().length()),
			UTF_8);
		OscQueryResponse result = resolver.respond(path, request.getQueryString());

		if (properties.allowedOrigin() != null) {
			response.setHeader(ACCESS_CONTROL_ALLOW_ORIGIN, properties.allowedOrigin());
		}
		if (!result.isFound()) {
			LOGGER.debug("No OSCQuery node for {} {}", request.getMethod(), request.getRequestURI());
			response.sendError(HttpServletResponse.SC_NOT_FOUND);
			return;
		}

		byte[] body = result.body().getBytes(UTF_8);
		response.setStatus(HttpServletResponse.SC_OK);
		response.setContentType(OscQueryResponse.CONTENT_TYPE);
		response.setCharacterEncoding(UTF_8.name());
		response.setContentLength(body.length);
		if ("GET".equals(request.getMethod())) {
			response.getOutputStream().write(body);
		}
	}

	/**
	 * The OSCQuery protocol only reads, so only the safe methods are answered.
	 */
	private boolean isQuery(HttpServletRequest request) {
		return switch (request.getMethod()) {
			case "GET", "HEAD" -> true;
			default -> false;
		};
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(OscQueryFilter.class);
}
