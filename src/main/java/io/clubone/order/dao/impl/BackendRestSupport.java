package io.clubone.order.dao.impl;

import java.util.ArrayList;
import java.util.List;

import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.clubone.order.exception.StaleWriteException;
import io.clubone.order.exception.TransportException;
import lombok.extern.slf4j.Slf4j;

/**
 * Shared RestTemplate plumbing for the backend DAOs: JSON headers, error
 * translation and tolerant decoding of list/record bodies.
 */
@Slf4j
abstract class BackendRestSupport {

	protected final RestTemplate restTemplate;

	protected final ObjectMapper objectMapper;

	protected final String baseUrl;

	protected BackendRestSupport(RestTemplate restTemplate, ObjectMapper objectMapper, String baseUrl) {
		this.restTemplate = restTemplate;
		this.objectMapper = objectMapper;
		this.baseUrl = baseUrl;
	}

	protected JsonNode exchange(String operation, String path, HttpMethod method, Object payload,
			Object... uriVariables) {
		HttpHeaders headers = new HttpHeaders();
		headers.setContentType(MediaType.APPLICATION_JSON);
		headers.setAccept(List.of(MediaType.APPLICATION_JSON));
		HttpEntity<Object> entity = new HttpEntity<>(payload, headers);

		try {
			ResponseEntity<JsonNode> response = restTemplate.exchange(baseUrl + path, method, entity,
					JsonNode.class, uriVariables);
			return response.getBody();
		} catch (HttpStatusCodeException ex) {
			int status = ex.getStatusCode().value();
			String message = "Error calling order backend " + operation + ": " + ex.getStatusCode() + " body="
					+ ex.getResponseBodyAsString();
			if (status == 409 || status == 412) {
				throw new StaleWriteException(operation, status, message, ex);
			}
			throw new TransportException(operation, status, message, ex);
		} catch (RestClientException ex) {
			throw new TransportException(operation, null,
					"Order backend unreachable for " + operation + ": " + ex.getMessage(), ex);
		}
	}

	/**
	 * Decodes every object element of the array. Null and non-object elements
	 * carry no record and are skipped.
	 */
	protected <T> List<T> readList(String operation, JsonNode array, Class<T> type) {
		List<T> out = new ArrayList<>(array.size());
		for (JsonNode node : array) {
			if (node == null || !node.isObject()) {
				log.debug("{}: skipping non-record list element {}", operation, node);
				continue;
			}
			out.add(read(operation, node, type));
		}
		return out;
	}

	protected <T> T read(String operation, JsonNode node, Class<T> type) {
		if (node == null)
			return null;
		try {
			return objectMapper.treeToValue(node, type);
		} catch (Exception ex) {
			throw new TransportException(operation, null,
					"Undecodable " + type.getSimpleName() + " from order backend: " + ex.getMessage(), ex);
		}
	}
}
