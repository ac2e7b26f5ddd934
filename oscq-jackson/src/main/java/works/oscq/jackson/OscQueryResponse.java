package works.oscq.jackson;

/**
 * What a transport should send back for one query.
 *
 * @param body JSON text; empty when {@link #status()} is {@link #NOT_FOUND}
 */
public record OscQueryResponse(int status, String body) {
	public static final int OK = 200;
	public static final int NOT_FOUND = 404;

	public static final String CONTENT_TYPE = "application/json";

	public static OscQueryResponse ok(String body) {
		return new OscQueryResponse(OK, body);
	}

	public static OscQueryResponse notFound() {
		return new OscQueryResponse(NOT_FOUND, "");
	}

	public boolean isFound() {
		return status == OK;
	}
}
