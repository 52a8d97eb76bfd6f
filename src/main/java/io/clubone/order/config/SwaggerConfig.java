package io.clubone.order.config;

import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;

/**
 * OpenAPI document for the order and quotation endpoints.
 */
@Configuration
public class SwaggerConfig {

	@Value("${swagger.title}")
	private String title;

	@Value("${swagger.description}")
	private String description;

	@Value("${swagger.version}")
	private String version;

	@Value("${swagger.contact.name}")
	private String contactName;

	@Value("${swagger.contact.email}")
	private String contactEmail;

	// public address when the service sits behind a gateway
	@Value("${swagger.server-url:/}")
	private String serverUrl;

	@Bean
	public OpenAPI orderLifecycleApi() {
		Contact contact = new Contact().name(contactName).email(contactEmail);
		return new OpenAPI()
			.info(new Info().title(title).description(description).version(version).contact(contact))
			.servers(List.of(new Server().url(serverUrl)));
	}
}
