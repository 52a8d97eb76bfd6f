package io.clubone.order.dao;

import java.util.List;

import io.clubone.order.request.CreateOrderRequest;
import io.clubone.order.request.QuotationUpdateRequest;
import io.clubone.order.vo.RawOrder;
import io.clubone.order.vo.RawQuotation;

/**
 * REST access to the order/quotation backend. Every failure surfaces as
 * {@link io.clubone.order.exception.TransportException}; optimistic-lock
 * rejections as {@link io.clubone.order.exception.StaleWriteException}.
 */
public interface OrderBackendDAO {

	List<RawOrder> fetchOrders();

	List<RawQuotation> fetchQuotations();

	/** @return the updated record, or null when the backend echoes nothing */
	RawOrder submitOrderStatus(String orderId, String backendStatus, String note);

	/** @return the updated record, or null when the backend echoes nothing */
	RawQuotation submitQuotationUpdate(String quotationId, QuotationUpdateRequest values);

	RawOrder createOrder(CreateOrderRequest payload);

	void deleteOrder(String id);
}
