package io.clubone.order.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.math.BigDecimal;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import io.clubone.order.exception.GlobalExceptionHandlerController;
import io.clubone.order.exception.ResourceNotFoundException;
import io.clubone.order.exception.TransportException;
import io.clubone.order.helper.OrderProgressHelper;
import io.clubone.order.response.OrderStatsResponse;
import io.clubone.order.service.OrderFeedService;
import io.clubone.order.service.OrderLifecycleService;
import io.clubone.order.util.LifecycleAction;
import io.clubone.order.util.SourceKind;
import io.clubone.order.util.Turn;
import io.clubone.order.vo.UnifiedOrderDTO;

@ExtendWith(MockitoExtension.class)
class OrderControllerTest {

	@Mock
	private OrderFeedService orderFeedService;

	@Mock
	private OrderLifecycleService lifecycleService;

	@Spy
	private OrderProgressHelper progressHelper;

	@InjectMocks
	private OrderController controller;

	private MockMvc mockMvc;

	@BeforeEach
	void setUp() {
		mockMvc = MockMvcBuilders.standaloneSetup(controller)
				.setControllerAdvice(new GlobalExceptionHandlerController())
				.build();
	}

	@Test
	void listsUnifiedFeed() throws Exception {
		when(orderFeedService.listUnified()).thenReturn(List.of(quotation("negotiation")));

		mockMvc.perform(get("/api/orders"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$[0].displayNumber").value("QUO-1"))
				.andExpect(jsonPath("$[0].sourceKind").value("quotation"))
				.andExpect(jsonPath("$[0].status").value("negotiation"));
	}

	@Test
	@DisplayName("turn endpoint reports whose move it is and the admin's actions")
	void turnEndpoint() throws Exception {
		UnifiedOrderDTO quotation = quotation("negotiation");
		when(orderFeedService.getOrder("QUO-1")).thenReturn(quotation);
		when(lifecycleService.turnOf(quotation)).thenReturn(Turn.ADMIN);
		when(lifecycleService.isTerminal("negotiation")).thenReturn(false);
		when(lifecycleService.availableActions(quotation)).thenReturn(
				List.of(LifecycleAction.SEND_QUOTE, LifecycleAction.ACCEPT_COUNTER, LifecycleAction.REJECT_COUNTER));

		mockMvc.perform(get("/api/orders/QUO-1/turn"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.turn").value("ADMIN"))
				.andExpect(jsonPath("$.terminal").value(false))
				.andExpect(jsonPath("$.availableActions[0]").value("sendQuote"))
				.andExpect(jsonPath("$.availableActions[1]").value("acceptCounter"));
	}

	@Test
	void progressEndpoint() throws Exception {
		when(orderFeedService.getOrder("QUO-1")).thenReturn(quotation("negotiation"));

		mockMvc.perform(get("/api/orders/QUO-1/progress"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.currentStageIndex").value(2))
				.andExpect(jsonPath("$.stages.length()").value(7))
				.andExpect(jsonPath("$.stages[2].state").value("CURRENT"));
	}

	@Test
	void statsEndpoint() throws Exception {
		when(orderFeedService.stats()).thenReturn(OrderStatsResponse.builder().total(3).pending(1).processing(1)
				.shipped(1).completed(0).totalValue(new BigDecimal("600")).build());

		mockMvc.perform(get("/api/orders/stats"))
				.andExpect(status().isOk())
				.andExpect(jsonPath("$.total").value(3))
				.andExpect(jsonPath("$.totalValue").value(600));
	}

	@Test
	void missingOrderIsNotFound() throws Exception {
		when(orderFeedService.getOrder("nope")).thenThrow(new ResourceNotFoundException("Order", "idOrNumber", "nope"));

		mockMvc.perform(get("/api/orders/nope"))
				.andExpect(status().isNotFound())
				.andExpect(jsonPath("$.errorType").value("lifecycle"));
	}

	@Test
	@DisplayName("backend failures map to 502 with the failing operation")
	void transportFailureIsBadGateway() throws Exception {
		when(orderFeedService.listUnified()).thenThrow(new TransportException("fetchOrders", 503, "unavailable", null));

		mockMvc.perform(get("/api/orders"))
				.andExpect(status().isBadGateway())
				.andExpect(jsonPath("$.operation").value("fetchOrders"))
				.andExpect(jsonPath("$.upstreamStatus").value(503));
	}

	@Test
	void blankStatusIsRejectedByValidation() throws Exception {
		mockMvc.perform(patch("/api/orders/o-1/status").contentType(MediaType.APPLICATION_JSON)
				.content("{\"status\":\"\"}"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.errorType").value("validation"));

		verify(lifecycleService, never()).updateOrderStatus(any(), any());
	}

	@Test
	void createOrderReturnsCreated() throws Exception {
		when(orderFeedService.createOrder(any())).thenReturn(UnifiedOrderDTO.builder().id("o-9")
				.displayNumber("ORD-2025-009").sourceKind(SourceKind.ORDER).status("payment_pending").build());

		mockMvc.perform(post("/api/orders").contentType(MediaType.APPLICATION_JSON)
				.content("{\"customerId\":\"c-1\",\"products\":[{\"productId\":\"p-1\",\"quantity\":2,\"price\":10}]}"))
				.andExpect(status().isCreated())
				.andExpect(jsonPath("$.displayNumber").value("ORD-2025-009"));
	}

	@Test
	void deleteOrderReturnsNoContent() throws Exception {
		mockMvc.perform(delete("/api/orders/o-1")).andExpect(status().isNoContent());

		verify(orderFeedService).deleteOrder(eq("o-1"));
	}

	private static UnifiedOrderDTO quotation(String status) {
		return UnifiedOrderDTO.builder().id("q-1").displayNumber("QUO-1").sourceKind(SourceKind.QUOTATION)
				.status(status).lineItems(List.of()).build();
	}
}
