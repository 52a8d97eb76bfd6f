package io.clubone.order.controller;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import io.clubone.order.request.RejectQuotationRequest;
import io.clubone.order.request.SendQuoteRequest;
import io.clubone.order.response.LifecycleActionResponse;
import io.clubone.order.service.OrderLifecycleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/quotations/{id}")
@Tag(name = "Quotations", description = "Admin side of the quotation negotiation")
public class QuotationController {

	@Autowired
	private OrderLifecycleService lifecycleService;

	@Operation(summary = "Send quoted prices to the customer")
	@PostMapping("/send-quote")
	public ResponseEntity<LifecycleActionResponse> sendQuote(@PathVariable String id,
			@Valid @RequestBody(required = false) SendQuoteRequest request) {
		return ResponseEntity.ok(lifecycleService.sendQuote(id, request));
	}

	@PostMapping("/accept-counter")
	public ResponseEntity<LifecycleActionResponse> acceptCounter(@PathVariable String id) {
		return ResponseEntity.ok(lifecycleService.acceptCounter(id));
	}

	@PostMapping("/reject-counter")
	public ResponseEntity<LifecycleActionResponse> rejectCounter(@PathVariable String id,
			@RequestBody(required = false) RejectQuotationRequest request) {
		return ResponseEntity.ok(lifecycleService.rejectCounter(id, request));
	}

	@Operation(summary = "Accept the customer's target prices as they are")
	@PostMapping("/accept-request")
	public ResponseEntity<LifecycleActionResponse> acceptQuoteRequest(@PathVariable String id) {
		return ResponseEntity.ok(lifecycleService.acceptQuoteRequest(id));
	}

	@PostMapping("/reject-request")
	public ResponseEntity<LifecycleActionResponse> rejectQuoteRequest(@PathVariable String id,
			@RequestBody(required = false) RejectQuotationRequest request) {
		return ResponseEntity.ok(lifecycleService.rejectQuoteRequest(id, request));
	}
}
