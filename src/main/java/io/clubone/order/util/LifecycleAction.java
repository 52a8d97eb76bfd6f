package io.clubone.order.util;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Named transitions of the negotiation and fulfilment lifecycle.
 */
public enum LifecycleAction {
	SEND_QUOTE("sendQuote"),
	ACCEPT_COUNTER("acceptCounter"),
	REJECT_COUNTER("rejectCounter"),
	ACCEPT_QUOTE_REQUEST("acceptQuoteRequest"),
	REJECT_QUOTE_REQUEST("rejectQuoteRequest"),
	UPDATE_ORDER_STATUS("updateOrderStatus");

	private final String actionName;

	LifecycleAction(String actionName) {
		this.actionName = actionName;
	}

	@JsonValue
	public String getActionName() {
		return actionName;
	}
}
