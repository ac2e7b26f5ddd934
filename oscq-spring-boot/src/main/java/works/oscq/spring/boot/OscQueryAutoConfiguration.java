package works.oscq.spring.boot;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import tools.jackson.databind.json.JsonMapper;
import works.oscq.AddressTree;
import works.oscq.jackson.OscQueryResolver;
import works.oscq.jackson.OscQuerySerializer;

import static tools.jackson.databind.SerializationFeature.INDENT_OUTPUT;

/**
 * Publishes the application's {@link AddressTree} bean over HTTP.
 * Define the tree as a bean and this does the rest.
 */
@AutoConfiguration
@EnableConfigurationProperties(WebProperties.class)
public class OscQueryAutoConfiguration {
	@Bean
	@ConditionalOnMissingBean
	OscQuerySerializer oscQuerySerializer() {
		return new OscQuerySerializer();
	}

	@Bean
	@ConditionalOnMissingBean
	@ConditionalOnBean(AddressTree.class)
	OscQueryResolver oscQueryResolver(
		AddressTree tree,
		OscQuerySerializer serializer,
		WebProperties properties
	) {
		JsonMapper.Builder mapper = serializer.mapperBuilder();
		if (properties.isPrettyPrint()) {
			mapper = mapper.enable(INDENT_OUTPUT);
		}
		return new OscQueryResolver(tree, mapper.build());
	}

	@Bean
	@ConditionalOnProperty(
		prefix = "oscq.web",
		name = "enabled",
		matchIfMissing = true)
	@ConditionalOnBean(AddressTree.class) // Because of matchIfMissing
	OscQueryFilter oscQueryFilter(
		OscQueryResolver resolver,
		WebProperties properties
	) {
		return new OscQueryFilter(resolver, properties);
	}

}
