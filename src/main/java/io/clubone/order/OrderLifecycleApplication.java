package io.clubone.order;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Properties;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import lombok.extern.slf4j.Slf4j;

@SpringBootApplication
@OpenAPIDefinition(info = @Info(title = "clubone Order Lifecycle Api", version = "1.0", description = "Orders and quotations"))
@Slf4j
public class OrderLifecycleApplication {

	public static void main(String[] args) {
		SpringApplication.run(OrderLifecycleApplication.class, args);
		log.info("... Application started Successfully ...");
	}

	@Bean
	public BuildProperties buildProperties() {
		return new BuildProperties(new Properties());
	}

	@Bean
	public WebMvcConfigurer corsConfigurer() {
		return new WebMvcConfigurer() {
			@Override
			public void addCorsMappings(CorsRegistry registry) {
				registry.addMapping("/**")
				.allowedOriginPatterns("*")
				.allowedMethods("GET", "POST", "PATCH", "DELETE", "OPTIONS")
				.allowedHeaders("*")
				.allowCredentials(true);
			}
		};
	}

	// JDK client so that PATCH works
	@Bean("orderBackendRestTemplate")
	public RestTemplate orderBackendRestTemplate(@Value("${order.backend.connect-timeout-ms:5000}") long connectTimeoutMs,
			@Value("${order.backend.read-timeout-ms:10000}") long readTimeoutMs) {
		HttpClient httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofMillis(connectTimeoutMs)).build();
		JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
		requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));
		return new RestTemplate(requestFactory);
	}
}
