package io.clubone.order.controller;

import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.clubone.order.helper.OrderProgressHelper;
import io.clubone.order.request.CreateOrderRequest;
import io.clubone.order.request.UpdateOrderStatusRequest;
import io.clubone.order.response.LifecycleActionResponse;
import io.clubone.order.response.OrderProgressResponse;
import io.clubone.order.response.OrderStatsResponse;
import io.clubone.order.response.TurnResponse;
import io.clubone.order.service.OrderFeedService;
import io.clubone.order.service.OrderLifecycleService;
import io.clubone.order.vo.UnifiedOrderDTO;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/orders")
@Tag(name = "Orders", description = "Unified order and quotation feed")
public class OrderController {

	@Autowired
	private OrderFeedService orderFeedService;

	@Autowired
	private OrderLifecycleService lifecycleService;

	@Autowired
	private OrderProgressHelper progressHelper;

	@Operation(summary = "Orders and quotations, most recently updated first")
	@GetMapping
	public ResponseEntity<List<UnifiedOrderDTO>> listUnified() {
		return ResponseEntity.ok(orderFeedService.listUnified());
	}

	@GetMapping("/orders-only")
	public ResponseEntity<List<UnifiedOrderDTO>> listOrders() {
		return ResponseEntity.ok(orderFeedService.listOrders());
	}

	@GetMapping("/quotations-only")
	public ResponseEntity<List<UnifiedOrderDTO>> listQuotations() {
		return ResponseEntity.ok(orderFeedService.listQuotations());
	}

	@Operation(summary = "Dashboard counters over the unified feed")
	@GetMapping("/stats")
	public ResponseEntity<OrderStatsResponse> stats() {
		return ResponseEntity.ok(orderFeedService.stats());
	}

	@GetMapping("/{id}")
	public ResponseEntity<UnifiedOrderDTO> getOrder(@PathVariable String id) {
		return ResponseEntity.ok(orderFeedService.getOrder(id));
	}

	@Operation(summary = "Stepper projection of the record's status")
	@GetMapping("/{id}/progress")
	public ResponseEntity<OrderProgressResponse> progress(@PathVariable String id) {
		return ResponseEntity.ok(progressHelper.project(orderFeedService.getOrder(id)));
	}

	@Operation(summary = "Whose move it is and what the admin can do next")
	@GetMapping("/{id}/turn")
	public ResponseEntity<TurnResponse> turn(@PathVariable String id) {
		UnifiedOrderDTO order = orderFeedService.getOrder(id);
		return ResponseEntity.ok(new TurnResponse(order.getId(), order.getSourceKind(), order.getStatus(),
				lifecycleService.turnOf(order), lifecycleService.isTerminal(order.getStatus()),
				lifecycleService.availableActions(order)));
	}

	@PostMapping
	public ResponseEntity<UnifiedOrderDTO> createOrder(@Valid @RequestBody CreateOrderRequest request) {
		return ResponseEntity.status(HttpStatus.CREATED).body(orderFeedService.createOrder(request));
	}

	@DeleteMapping("/{id}")
	public ResponseEntity<Void> deleteOrder(@PathVariable String id) {
		orderFeedService.deleteOrder(id);
		return ResponseEntity.noContent().build();
	}

	@Operation(summary = "Move an order to a fulfilment stage")
	@PatchMapping("/{id}/status")
	public ResponseEntity<LifecycleActionResponse> updateStatus(@PathVariable String id,
			@Valid @RequestBody UpdateOrderStatusRequest request) {
		return ResponseEntity.ok(lifecycleService.updateOrderStatus(id, request));
	}
}
