package io.clubone.order.dao.impl;

import java.util.List;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import io.clubone.order.dao.OrderBackendDAO;
import io.clubone.order.dao.utils.BackendPayloadUtils;
import io.clubone.order.exception.TransportException;
import io.clubone.order.request.CreateOrderRequest;
import io.clubone.order.request.QuotationUpdateRequest;
import io.clubone.order.vo.RawOrder;
import io.clubone.order.vo.RawQuotation;
import lombok.extern.slf4j.Slf4j;

@Service
@Slf4j
public class OrderBackendDAOImpl extends BackendRestSupport implements OrderBackendDAO {

	static final String ORDERS_LIST = "/orders/list";
	static final String QUOTATIONS_LIST = "/orders/quotation/list";
	static final String ORDER_UPDATE = "/orders/update";
	static final String QUOTATION_UPDATE = "/orders/quotation/update";
	static final String ORDER_CREATE = "/orders/create";
	static final String ORDER_DELETE = "/orders/delete/{id}";

	public OrderBackendDAOImpl(@Qualifier("orderBackendRestTemplate") RestTemplate restTemplate,
			ObjectMapper objectMapper, @Value("${order.backend.base-url}") String baseUrl) {
		super(restTemplate, objectMapper, baseUrl);
	}

	@Override
	public List<RawOrder> fetchOrders() {
		JsonNode body = exchange("fetchOrders", ORDERS_LIST, HttpMethod.GET, null);
		List<RawOrder> orders = readList("fetchOrders", BackendPayloadUtils.unwrapList(body, "orders"),
				RawOrder.class);
		log.debug("Fetched {} orders from backend", orders.size());
		return orders;
	}

	@Override
	public List<RawQuotation> fetchQuotations() {
		JsonNode body = exchange("fetchQuotations", QUOTATIONS_LIST, HttpMethod.GET, null);
		List<RawQuotation> quotations = readList("fetchQuotations",
				BackendPayloadUtils.unwrapList(body, "quotations"), RawQuotation.class);
		log.debug("Fetched {} quotations from backend", quotations.size());
		return quotations;
	}

	@Override
	public RawOrder submitOrderStatus(String orderId, String backendStatus, String note) {
		OrderUpdatePayload payload = new OrderUpdatePayload();
		payload.orderId = orderId;
		payload.values = new OrderUpdateValues();
		payload.values.status = backendStatus;
		payload.values.notes = note;
		log.debug("PATCH {} orderId={} status={}", ORDER_UPDATE, orderId, backendStatus);

		JsonNode body = exchange("submitOrderStatus", ORDER_UPDATE, HttpMethod.PATCH, payload);
		return read("submitOrderStatus", BackendPayloadUtils.unwrapRecord(body, "order"), RawOrder.class);
	}

	@Override
	public RawQuotation submitQuotationUpdate(String quotationId, QuotationUpdateRequest values) {
		QuotationUpdatePayload payload = new QuotationUpdatePayload();
		payload.quotationId = quotationId;
		payload.values = values;
		log.debug("PATCH {} quotationId={} status={}", QUOTATION_UPDATE, quotationId, values.getStatus());

		JsonNode body = exchange("submitQuotationUpdate", QUOTATION_UPDATE, HttpMethod.PATCH, payload);
		return read("submitQuotationUpdate", BackendPayloadUtils.unwrapRecord(body, "quotation"),
				RawQuotation.class);
	}

	@Override
	public RawOrder createOrder(CreateOrderRequest request) {
		JsonNode body = exchange("createOrder", ORDER_CREATE, HttpMethod.POST, request);
		RawOrder created = read("createOrder", BackendPayloadUtils.unwrapRecord(body, "order"), RawOrder.class);
		if (created == null) {
			throw new TransportException("createOrder", null, "Order backend returned no order for createOrder",
					null);
		}
		return created;
	}

	@Override
	public void deleteOrder(String id) {
		exchange("deleteOrder", ORDER_DELETE, HttpMethod.DELETE, null, id);
	}

	// request bodies of the update endpoints

	@JsonInclude(JsonInclude.Include.NON_NULL)
	public static class OrderUpdatePayload {
		public String orderId;
		public OrderUpdateValues values;
	}

	@JsonInclude(JsonInclude.Include.NON_NULL)
	public static class OrderUpdateValues {
		public String status;
		public String notes;
	}

	@JsonInclude(JsonInclude.Include.NON_NULL)
	public static class QuotationUpdatePayload {
		public String quotationId;
		public QuotationUpdateRequest values;
	}
}
