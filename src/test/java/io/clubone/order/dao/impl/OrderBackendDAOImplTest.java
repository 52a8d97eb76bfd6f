package io.clubone.order.dao.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.clubone.order.exception.StaleWriteException;
import io.clubone.order.exception.TransportException;
import io.clubone.order.request.CreateOrderRequest;
import io.clubone.order.request.QuotationUpdateRequest;
import io.clubone.order.vo.RawCustomer;
import io.clubone.order.vo.RawOrder;
import io.clubone.order.vo.RawQuotation;
import io.clubone.order.vo.RawQuotationProduct;

class OrderBackendDAOImplTest {

	private static final String BASE_URL = "http://backend.test/api";

	private MockRestServiceServer server;

	private OrderBackendDAOImpl dao;

	private CustomerDAOImpl customerDAO;

	@BeforeEach
	void setUp() {
		RestTemplate restTemplate = new RestTemplate();
		server = MockRestServiceServer.bindTo(restTemplate).build();
		ObjectMapper objectMapper = new ObjectMapper();
		dao = new OrderBackendDAOImpl(restTemplate, objectMapper, BASE_URL);
		customerDAO = new CustomerDAOImpl(restTemplate, objectMapper, BASE_URL);
	}

	@Test
	@DisplayName("order list is read from the orders envelope")
	void fetchOrdersFromEnvelope() {
		server.expect(requestTo(BASE_URL + "/orders/list")).andExpect(method(HttpMethod.GET))
				.andRespond(withSuccess("{\"orders\":[{\"_id\":\"o-1\",\"orderId\":\"ORD-2025-001\","
						+ "\"status\":\"PAID\",\"totalAmount\":120.5,"
						+ "\"products\":[{\"productId\":\"p-1\",\"quantity\":2,\"price\":60.25}],"
						+ "\"unknownField\":true}]}", MediaType.APPLICATION_JSON));

		List<RawOrder> orders = dao.fetchOrders();

		server.verify();
		assertEquals(1, orders.size());
		assertEquals("o-1", orders.get(0).getId());
		assertEquals("ORD-2025-001", orders.get(0).getOrderId());
		assertEquals(0, new BigDecimal("60.25").compareTo(orders.get(0).getProducts().get(0).getPrice()));
	}

	@Test
	void fetchQuotationsFromBareArray() {
		server.expect(requestTo(BASE_URL + "/orders/quotation/list"))
				.andRespond(withSuccess("[{\"_id\":\"q-1\",\"status\":\"NEGOTIATING\"},{\"_id\":\"q-2\"}]",
						MediaType.APPLICATION_JSON));

		List<RawQuotation> quotations = dao.fetchQuotations();

		assertEquals(2, quotations.size());
		assertEquals("NEGOTIATING", quotations.get(0).getStatus());
	}

	@Test
	void fetchQuotationsFromDataEnvelope() {
		server.expect(requestTo(BASE_URL + "/orders/quotation/list"))
				.andRespond(withSuccess("{\"success\":true,\"data\":[{\"_id\":\"q-1\"}]}", MediaType.APPLICATION_JSON));

		assertEquals("q-1", dao.fetchQuotations().get(0).getId());
	}

	@Test
	@DisplayName("null and non-object list elements are skipped")
	void skipsNonRecordListElements() {
		server.expect(requestTo(BASE_URL + "/orders/list"))
				.andRespond(withSuccess("[null,{\"_id\":\"o-1\",\"status\":\"PAID\"},\"junk\",42]",
						MediaType.APPLICATION_JSON));

		List<RawOrder> orders = dao.fetchOrders();

		assertEquals(1, orders.size());
		assertEquals("o-1", orders.get(0).getId());
	}

	@Test
	void unexpectedListBodyReadsAsEmpty() {
		server.expect(requestTo(BASE_URL + "/orders/list"))
				.andRespond(withSuccess("{\"message\":\"no orders\"}", MediaType.APPLICATION_JSON));

		assertEquals(0, dao.fetchOrders().size());
	}

	@Test
	@DisplayName("order status update sends orderId and values, and reads the echoed record")
	void submitOrderStatus() {
		server.expect(requestTo(BASE_URL + "/orders/update")).andExpect(method(HttpMethod.PATCH))
				.andExpect(jsonPath("$.orderId").value("ORD-2025-001"))
				.andExpect(jsonPath("$.values.status").value("SHIPPED"))
				.andExpect(jsonPath("$.values.notes").doesNotExist())
				.andRespond(withSuccess("{\"order\":{\"_id\":\"o-1\",\"status\":\"SHIPPED\"}}",
						MediaType.APPLICATION_JSON));

		RawOrder updated = dao.submitOrderStatus("ORD-2025-001", "SHIPPED", null);

		server.verify();
		assertEquals("SHIPPED", updated.getStatus());
	}

	@Test
	void submitQuotationUpdateSendsLines() {
		QuotationUpdateRequest values = QuotationUpdateRequest.builder()
				.status("ACCEPTED")
				.products(List.of(RawQuotationProduct.builder().productId("p-1").quantity(2)
						.targetPrice(new BigDecimal("100")).quotedPrice(new BigDecimal("100")).build()))
				.build();
		server.expect(requestTo(BASE_URL + "/orders/quotation/update")).andExpect(method(HttpMethod.PATCH))
				.andExpect(jsonPath("$.quotationId").value("q-1"))
				.andExpect(jsonPath("$.values.status").value("ACCEPTED"))
				.andExpect(jsonPath("$.values.products[0].quotedPrice").value(100))
				.andRespond(withSuccess("{\"_id\":\"q-1\",\"status\":\"ACCEPTED\"}", MediaType.APPLICATION_JSON));

		RawQuotation updated = dao.submitQuotationUpdate("q-1", values);

		server.verify();
		assertEquals("ACCEPTED", updated.getStatus());
	}

	@Test
	@DisplayName("an update answered without a record yields null")
	void submitWithoutRecordReturnsNull() {
		server.expect(requestTo(BASE_URL + "/orders/quotation/update"))
				.andRespond(withSuccess("{\"message\":\"updated\"}", MediaType.APPLICATION_JSON));

		assertNull(dao.submitQuotationUpdate("q-1", QuotationUpdateRequest.builder().status("REJECTED").build()));
	}

	@Test
	@DisplayName("conflicts surface as stale writes")
	void conflictIsStaleWrite() {
		server.expect(requestTo(BASE_URL + "/orders/update"))
				.andRespond(withStatus(HttpStatus.CONFLICT).body("{\"error\":\"version mismatch\"}")
						.contentType(MediaType.APPLICATION_JSON));

		StaleWriteException ex = assertThrows(StaleWriteException.class,
				() -> dao.submitOrderStatus("ORD-1", "PAID", null));

		assertEquals(409, ex.getUpstreamStatus());
		assertEquals("submitOrderStatus", ex.getOperation());
	}

	@Test
	void serverErrorIsTransportFailure() {
		server.expect(requestTo(BASE_URL + "/orders/list")).andRespond(withServerError());

		TransportException ex = assertThrows(TransportException.class, () -> dao.fetchOrders());

		assertFalse(ex instanceof StaleWriteException);
		assertEquals(500, ex.getUpstreamStatus());
	}

	@Test
	void createOrderWithoutRecordFails() {
		server.expect(requestTo(BASE_URL + "/orders/create")).andExpect(method(HttpMethod.POST))
				.andRespond(withSuccess("{\"message\":\"created\"}", MediaType.APPLICATION_JSON));

		CreateOrderRequest request = new CreateOrderRequest(null, null,
				List.of(new CreateOrderRequest.Product("p-1", 1, BigDecimal.TEN)), null, null, null);

		TransportException ex = assertThrows(TransportException.class, () -> dao.createOrder(request));
		assertEquals("createOrder", ex.getOperation());
	}

	@Test
	void deleteOrderUsesIdInPath() {
		server.expect(requestTo(BASE_URL + "/orders/delete/o-1")).andExpect(method(HttpMethod.DELETE))
				.andRespond(withSuccess());

		dao.deleteOrder("o-1");

		server.verify();
	}

	@Test
	void fetchCustomersFromEnvelope() {
		server.expect(requestTo(BASE_URL + "/customers/list"))
				.andRespond(withSuccess("{\"customers\":[{\"_id\":\"c-1\",\"fullName\":\"Asha Rao\"}]}",
						MediaType.APPLICATION_JSON));

		List<RawCustomer> customers = customerDAO.fetchCustomers();

		assertEquals("Asha Rao", customers.get(0).getFullName());
	}
}
