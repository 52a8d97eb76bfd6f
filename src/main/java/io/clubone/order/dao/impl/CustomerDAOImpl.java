package io.clubone.order.dao.impl;

import java.util.List;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.clubone.order.dao.CustomerDAO;
import io.clubone.order.dao.utils.BackendPayloadUtils;
import io.clubone.order.vo.RawCustomer;

@Service
public class CustomerDAOImpl extends BackendRestSupport implements CustomerDAO {

	static final String CUSTOMERS_LIST = "/customers/list";

	public CustomerDAOImpl(@Qualifier("orderBackendRestTemplate") RestTemplate restTemplate,
			ObjectMapper objectMapper, @Value("${order.backend.base-url}") String baseUrl) {
		super(restTemplate, objectMapper, baseUrl);
	}

	@Override
	public List<RawCustomer> fetchCustomers() {
		JsonNode body = exchange("fetchCustomers", CUSTOMERS_LIST, HttpMethod.GET, null);
		return readList("fetchCustomers", BackendPayloadUtils.unwrapList(body, "customers"), RawCustomer.class);
	}
}
