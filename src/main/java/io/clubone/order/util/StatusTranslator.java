package io.clubone.order.util;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Translation between the backend's status enums and the unified vocabulary.
 * Every method is total: unknown input maps to a fixed default and never throws.
 */
public final class StatusTranslator {

	private static final Map<String, OrderStatus> QUOTATION_TO_UNIFIED = Map.of(
			BackendQuotationStatus.PENDING.name(), OrderStatus.QUOTE_REQUESTED,
			BackendQuotationStatus.QUOTE_SENT.name(), OrderStatus.QUOTE_SENT,
			BackendQuotationStatus.NEGOTIATING.name(), OrderStatus.NEGOTIATION,
			BackendQuotationStatus.ACCEPTED.name(), OrderStatus.ORDER_BOOKED,
			BackendQuotationStatus.REJECTED.name(), OrderStatus.REJECTED);

	private static final Map<OrderStatus, BackendQuotationStatus> UNIFIED_TO_QUOTATION = QUOTATION_TO_UNIFIED
			.entrySet().stream()
			.collect(Collectors.toUnmodifiableMap(Map.Entry::getValue,
					e -> BackendQuotationStatus.valueOf(e.getKey())));

	private static final Map<String, OrderStatus> ORDER_TO_UNIFIED = Map.of(
			BackendOrderStatus.PENDING.name(), OrderStatus.PAYMENT_PENDING,
			BackendOrderStatus.CONFIRMED.name(), OrderStatus.CONFIRMED,
			BackendOrderStatus.PAID.name(), OrderStatus.PAID,
			BackendOrderStatus.PROCESSING.name(), OrderStatus.PROCESSING,
			BackendOrderStatus.SHIPPED.name(), OrderStatus.SHIPPED,
			BackendOrderStatus.DELIVERED.name(), OrderStatus.DELIVERED,
			BackendOrderStatus.CANCELLED.name(), OrderStatus.CANCELLED);

	// stage submitted from the tracking UI -> backend order status
	private static final Map<String, BackendOrderStatus> ORDER_STAGE_SUBMISSION = Map.of(
			OrderStatus.PROCESSING.getCode(), BackendOrderStatus.PAID,
			OrderStatus.SHIPPED.getCode(), BackendOrderStatus.SHIPPED,
			OrderStatus.DELIVERED.getCode(), BackendOrderStatus.DELIVERED,
			OrderStatus.COMPLETED.getCode(), BackendOrderStatus.DELIVERED);

	public static final Set<OrderStatus> QUOTATION_STATUSES = Set.of(OrderStatus.QUOTE_REQUESTED,
			OrderStatus.QUOTE_SENT, OrderStatus.NEGOTIATION, OrderStatus.ORDER_BOOKED, OrderStatus.REJECTED);

	public static final Set<OrderStatus> ORDER_STATUSES = Set.of(OrderStatus.PAYMENT_PENDING,
			OrderStatus.CONFIRMED, OrderStatus.PAID, OrderStatus.PROCESSING, OrderStatus.SHIPPED,
			OrderStatus.DELIVERED, OrderStatus.CANCELLED);

	private StatusTranslator() {
	}

	/**
	 * Maps a raw backend status to its unified code. Unknown quotation codes fall
	 * back to {@code quote_requested}; unknown order codes pass through
	 * lower-cased. A missing status is read as the record kind's initial state.
	 */
	public static String toUnifiedStatus(String rawStatus, SourceKind sourceKind) {
		if (sourceKind == SourceKind.QUOTATION) {
			OrderStatus mapped = rawStatus == null ? null : QUOTATION_TO_UNIFIED.get(rawStatus);
			return mapped != null ? mapped.getCode() : OrderStatus.QUOTE_REQUESTED.getCode();
		}
		if (rawStatus == null)
			return OrderStatus.PAYMENT_PENDING.getCode();
		OrderStatus mapped = ORDER_TO_UNIFIED.get(rawStatus);
		return mapped != null ? mapped.getCode() : rawStatus.toLowerCase(Locale.ROOT);
	}

	/**
	 * Inverse of the quotation table.
	 *
	 * @throws IllegalArgumentException when the status has no quotation
	 *                                  counterpart
	 */
	public static String toBackendQuotationStatus(OrderStatus status) {
		BackendQuotationStatus backend = UNIFIED_TO_QUOTATION.get(status);
		if (backend == null)
			throw new IllegalArgumentException("No quotation status for " + status);
		return backend.name();
	}

	/**
	 * Backend status submitted when the tracking UI moves an order to a stage.
	 */
	public static String toBackendOrderStatus(String submittedStatus) {
		if (submittedStatus == null)
			return null;
		BackendOrderStatus remapped = ORDER_STAGE_SUBMISSION.get(submittedStatus);
		return remapped != null ? remapped.name() : submittedStatus.toUpperCase(Locale.ROOT);
	}

	/**
	 * Reads a timeline code that may be either a backend code or already a
	 * unified code.
	 */
	public static String timelineStatus(String code, SourceKind sourceKind) {
		if (code != null && OrderStatus.fromCode(code) != null)
			return code;
		return toUnifiedStatus(code, sourceKind);
	}
}
