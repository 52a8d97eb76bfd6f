package io.clubone.order.service;

import java.util.List;

import io.clubone.order.request.RejectQuotationRequest;
import io.clubone.order.request.SendQuoteRequest;
import io.clubone.order.request.UpdateOrderStatusRequest;
import io.clubone.order.response.LifecycleActionResponse;
import io.clubone.order.util.LifecycleAction;
import io.clubone.order.util.Turn;
import io.clubone.order.vo.UnifiedOrderDTO;

/**
 * Admin-side transitions of the quotation negotiation and order fulfilment
 * lifecycle. Every action re-reads the record, checks its precondition, submits
 * the change and returns the record as the backend now holds it.
 */
public interface OrderLifecycleService {

	Turn turnOf(UnifiedOrderDTO order);

	List<LifecycleAction> availableActions(UnifiedOrderDTO order);

	boolean isTerminal(String status);

	LifecycleActionResponse sendQuote(String idOrNumber, SendQuoteRequest request);

	LifecycleActionResponse acceptCounter(String idOrNumber);

	LifecycleActionResponse rejectCounter(String idOrNumber, RejectQuotationRequest request);

	LifecycleActionResponse acceptQuoteRequest(String idOrNumber);

	LifecycleActionResponse rejectQuoteRequest(String idOrNumber, RejectQuotationRequest request);

	LifecycleActionResponse updateOrderStatus(String idOrNumber, UpdateOrderStatusRequest request);
}
