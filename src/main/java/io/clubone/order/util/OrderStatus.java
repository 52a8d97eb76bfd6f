package io.clubone.order.util;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Unified status vocabulary shared by orders and quotations.
 *
 * Quotations move through QUOTE_REQUESTED, QUOTE_SENT, NEGOTIATION and end in
 * ORDER_BOOKED or REJECTED. Orders move from PAYMENT_PENDING to DELIVERED or
 * CANCELLED. PACKED, COMPLETED, RETURNED, REFUNDED and ON_HOLD are dashboard
 * codes the backend never emits directly; they only arrive through the order
 * pass-through rule.
 */
public enum OrderStatus {
	QUOTE_REQUESTED("quote_requested", "Quote Requested"),
	QUOTE_SENT("quote_sent", "Quote Sent"),
	NEGOTIATION("negotiation", "Negotiation"),
	ORDER_BOOKED("order_booked", "Order Booked"),
	CONFIRMED("confirmed", "Confirmed"),
	PAYMENT_PENDING("payment_pending", "Payment Pending"),
	PAID("paid", "Paid"),
	PROCESSING("processing", "Processing"),
	PACKED("packed", "Packed"),
	SHIPPED("shipped", "Shipment Booked"),
	DELIVERED("delivered", "Delivered"),
	COMPLETED("completed", "Completed"),
	CANCELLED("cancelled", "Cancelled"),
	REJECTED("rejected", "Rejected"),
	RETURNED("returned", "Returned"),
	REFUNDED("refunded", "Refunded"),
	ON_HOLD("on_hold", "On Hold");

	private static final Map<String, OrderStatus> BY_CODE = Arrays.stream(values())
			.collect(Collectors.toUnmodifiableMap(OrderStatus::getCode, Function.identity()));

	private final String code;

	private final String label;

	OrderStatus(String code, String label) {
		this.code = code;
		this.label = label;
	}

	public String getCode() {
		return code;
	}

	public String getLabel() {
		return label;
	}

	/**
	 * @return the status for a unified code, or null when the code is not part of
	 *         the vocabulary
	 */
	public static OrderStatus fromCode(String code) {
		if (code == null)
			return null;
		return BY_CODE.get(code);
	}
}
