package io.clubone.order.service;

import java.util.List;

import io.clubone.order.request.CreateOrderRequest;
import io.clubone.order.response.OrderStatsResponse;
import io.clubone.order.vo.UnifiedOrderDTO;

public interface OrderFeedService {

	/**
	 * Orders and quotations merged into one list, most recently updated first.
	 * Fails as a whole when either collection cannot be read.
	 */
	List<UnifiedOrderDTO> listUnified();

	List<UnifiedOrderDTO> listOrders();

	List<UnifiedOrderDTO> listQuotations();

	UnifiedOrderDTO getOrder(String idOrNumber);

	UnifiedOrderDTO createOrder(CreateOrderRequest request);

	void deleteOrder(String id);

	OrderStatsResponse stats();
}
