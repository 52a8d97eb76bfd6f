package io.clubone.order.util;

/**
 * Status codes the backend accepts on order records.
 */
public enum BackendOrderStatus {
	PENDING, CONFIRMED, PAID, PROCESSING, SHIPPED, DELIVERED, CANCELLED
}
