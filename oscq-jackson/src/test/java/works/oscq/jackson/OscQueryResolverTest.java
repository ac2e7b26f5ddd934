package works.oscq.jackson;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import works.oscq.AddressTree;
import works.oscq.Attribute;
import works.oscq.EndpointDescriptor;
import works.oscq.OscValue;
import works.oscq.Query;
import works.oscq.exceptions.NodeNotFoundException;
import works.oscq.testing.TestTrees;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static works.oscq.jackson.OscQuerySerializerTest.ENDPOINT1;
import static works.oscq.jackson.OscQuerySerializerTest.README_HOST_INFO;
import static works.oscq.jackson.OscQuerySerializerTest.README_ROOT;

class OscQueryResolverTest {
	OscQueryResolver resolver;

	@BeforeEach
	void setup() {
		resolver = new OscQueryResolver(TestTrees.readme());
	}

	@Test
	void root_fullDocument() throws NodeNotFoundException {
		assertEquals(README_ROOT, resolver.resolve(Query.of("/")).toString());
		assertEquals(README_ROOT, resolver.resolve("", null).toString());
	}

	@Test
	void leaf_fullObject() throws NodeNotFoundException {
		assertEquals(ENDPOINT1, resolver.resolve("/endpoint1", null).toString());
		assertEquals(ENDPOINT1, resolver.resolve("/endpoint1/", null).toString());
	}

	@ParameterizedTest
	@CsvSource(delimiter = '|', value = {
		"/endpoint1 | VALUE       | {\"VALUE\":[0.0]}",
		"/endpoint1 | TYPE        | {\"TYPE\":\"f\"}",
		"/endpoint1 | ACCESS      | {\"ACCESS\":3}",
		"/endpoint1 | RANGE       | {\"RANGE\":[{\"MIN\":0.0,\"MAX\":100.0}]}",
		"/endpoint1 | UNIT        | {\"UNIT\":[\"distance.cm\"]}",
		"/endpoint1 | DESCRIPTION | {\"DESCRIPTION\":\"This is endpoint1\"}",
		"/endpoint1 | FULL_PATH   | {\"FULL_PATH\":\"/endpoint1\"}",
		"/endpoint2 | VALUE       | {\"VALUE\":[0]}",
		"/endpoint2 | ACCESS      | {\"ACCESS\":1}",
		"/           | ACCESS     | {\"ACCESS\":0}",
		"/           | DESCRIPTION | {\"DESCRIPTION\":\"\"}",
	})
	void singleAttribute(String path, String attribute, String expected) throws NodeNotFoundException {
		assertEquals(expected, resolver.resolve(path, attribute).toString());
	}

	@ParameterizedTest
	@CsvSource({
		"/endpoint2, RANGE",
		"/endpoint2, UNIT",
		"/endpoint1, CONTENTS",
		"/, VALUE",
		"/, TYPE",
		"/, RANGE",
	})
	void absentAttribute_emptyObject(String path, String attribute) throws NodeNotFoundException {
		assertEquals("{}", resolver.resolve(path, attribute).toString());
	}

	@ParameterizedTest
	@ValueSource(strings = { "BOGUS", "value", "Host_Info", "CLIPMODE" })
	void unknownAttribute_emptyObject(String attribute) throws NodeNotFoundException {
		assertEquals("{}", resolver.resolve("/endpoint1", attribute).toString());
	}

	@Test
	void contents_ofRoot() throws NodeNotFoundException {
		assertEquals("{\"CONTENTS\":{\"endpoint1\":" + ENDPOINT1 + ",\"endpoint2\":"
				+ OscQuerySerializerTest.ENDPOINT2 + "}}",
			resolver.resolve("/", "CONTENTS").toString());
	}

	@ParameterizedTest
	@ValueSource(strings = { "/", "", "/endpoint1", "/does/not/exist", "not-even-a-path" })
	void hostInfo_anyPath(String path) throws NodeNotFoundException {
		assertEquals(README_HOST_INFO, resolver.resolve(path, Attribute.HOST_INFO.wireName()).toString());
	}

	@Test
	void hostInfo_absent_emptyObject() throws NodeNotFoundException {
		OscQueryResolver bare = new OscQueryResolver(AddressTree.builder().build());
		assertEquals("{}", bare.resolve("/", "HOST_INFO").toString());
		assertEquals("{\"DESCRIPTION\":\"\",\"FULL_PATH\":\"/\",\"ACCESS\":0,\"CONTENTS\":{}}",
			bare.resolve("/", null).toString());
	}

	@Test
	void hostInfo_onlyOnRoot() throws Exception {
		OscQueryResolver nested = new OscQueryResolver(TestTrees.nested());
		assertFalse(nested.resolve("/synth", null).has("HOST_INFO"));
		assertTrue(nested.resolve("/", null).has("HOST_INFO"));
	}

	@ParameterizedTest
	@ValueSource(strings = { "/nope", "/endpoint1/child", "endpoint1", "//" })
	void missingNode_throws(String path) {
		NodeNotFoundException e = assertThrows(NodeNotFoundException.class, () -> resolver.resolve(path, null));
		assertEquals(path, e.path());
		assertThrows(NodeNotFoundException.class, () -> resolver.resolve(path, "VALUE"));
		assertThrows(NodeNotFoundException.class, () -> resolver.resolve(path, "BOGUS"));
	}

	@Test
	void respond_found() {
		OscQueryResponse response = resolver.respond("/endpoint1", "VALUE");
		assertEquals(OscQueryResponse.OK, response.status());
		assertTrue(response.isFound());
		assertEquals("{\"VALUE\":[0.0]}", response.body());
	}

	@Test
	void respond_ignoresQueryParameterValues() {
		assertEquals("{\"VALUE\":[0.0]}", resolver.respond("/endpoint1", "VALUE=7&foo=bar").body());
		assertEquals(ENDPOINT1, resolver.respond("/endpoint1", "").body());
		assertEquals("{\"VALUE\":[0.0]}", resolver.respond("/endpoint1", "&VALUE").body());
		assertEquals("{\"TYPE\":\"f\"}", resolver.respond("/endpoint1", "=1&TYPE").body());
	}

	@Test
	void respond_notFound() {
		OscQueryResponse response = resolver.respond("/nope", null);
		assertEquals(OscQueryResponse.NOT_FOUND, response.status());
		assertFalse(response.isFound());
		assertEquals("", response.body());
	}

	@Test
	void respond_hostInfoAtMissingPath_found() {
		assertEquals(README_HOST_INFO, resolver.respond("/nope", "HOST_INFO").body());
	}

	@Test
	void concurrentReaders_seeSameAnswer() throws Exception {
		AddressTree tree = TestTrees.build(AddressTree.builder(),
			EndpointDescriptor.of("/a", OscValue.of(1)));
		OscQueryResolver shared = new OscQueryResolver(tree);
		String expected = shared.respond("/a", "VALUE").body();

		Thread[] threads = new Thread[8];
		String[] results = new String[threads.length];
		for (int i = 0; i < threads.length; i++) {
			int index = i;
			threads[i] = new Thread(() -> results[index] = shared.respond("/a", "VALUE").body());
			threads[i].start();
		}
		for (Thread thread : threads) {
			thread.join();
		}
		for (String result : results) {
			assertEquals(expected, result);
		}
	}
}
