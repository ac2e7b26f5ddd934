package works.oscq.spring.boot;

import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.core.env.MapPropertySource;
import works.oscq.AddressTree;
import works.oscq.jackson.OscQueryResolver;
import works.oscq.jackson.OscQuerySerializer;
import works.oscq.testing.TestTrees;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OscQueryAutoConfigurationTest {

	@Test
	void withTree_servesIt() {
		try (var context = context(TestTrees.readme(), Map.of())) {
			AddressTree tree = context.getBean(AddressTree.class);
			assertSame(tree, context.getBean(OscQueryResolver.class).tree());
			assertEquals(1, context.getBeansOfType(OscQueryFilter.class).size());
		}
	}

	@Test
	void withoutTree_noResolverOrFilter() {
		try (var context = context(null, Map.of())) {
			assertEquals(1, context.getBeansOfType(OscQuerySerializer.class).size());
			assertTrue(context.getBeansOfType(OscQueryResolver.class).isEmpty());
			assertTrue(context.getBeansOfType(OscQueryFilter.class).isEmpty());
		}
	}

	@Test
	void disabled_noFilter() {
		try (var context = context(TestTrees.readme(), Map.of("oscq.web.enabled", "false"))) {
			assertEquals(1, context.getBeansOfType(OscQueryResolver.class).size());
			assertTrue(context.getBeansOfType(OscQueryFilter.class).isEmpty());
		}
	}

	@Test
	void prettyPrint_indents() {
		try (var context = context(TestTrees.readme(), Map.of("oscq.web.pretty-print", "true"))) {
			String body = context.getBean(OscQueryResolver.class).respond("/", null).body();
			assertThat(body, containsString("\n"));
		}
	}

	@Test
	void compactByDefault() {
		try (var context = context(TestTrees.readme(), Map.of())) {
			String body = context.getBean(OscQueryResolver.class).respond("/", null).body();
			assertFalse(body.contains("\n"));
		}
	}

	private static AnnotationConfigApplicationContext context(AddressTree tree, Map<String, Object> properties) {
		AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext();
		context.getEnvironment().getPropertySources().addFirst(new MapPropertySource("test", properties));
		if (tree != null) {
			context.registerBean(AddressTree.class, () -> tree);
		}
		context.register(OscQueryAutoConfiguration.class);
		context.refresh();
		return context;
	}
}
