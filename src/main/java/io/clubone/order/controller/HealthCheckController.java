package io.clubone.order.controller;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.info.BuildProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import io.clubone.order.baseobject.Docs;
import io.clubone.order.baseobject.Version;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;

@RestController
@Slf4j
@Tag(name = "Health Check", description = "Build and version probe")
public class HealthCheckController {

	@Autowired
	private BuildProperties buildProperties;

	@Operation(summary = "Service liveness and build information")
	@GetMapping({ "/health" })
	public Version getVersion(HttpServletRequest httpServletRequest) {
		log.debug("inside getVersion() method start");
		Docs docs = new Docs();
		docs.setStatus("Live - " + this.buildProperties.get("time"));
		docs.setUrl(httpServletRequest.getRequestURL().toString().replace("health", "swagger-ui.html"));
		Version version = new Version();
		version.setVersion(getClass().getPackage().getImplementationVersion());
		version.setDocs(docs);
		log.debug("inside getVersion() method end");
		return version;
	}
}
