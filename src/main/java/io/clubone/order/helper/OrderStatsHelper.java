package io.clubone.order.helper;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import io.clubone.order.response.OrderStatsResponse;
import io.clubone.order.util.OrderStatus;
import io.clubone.order.vo.UnifiedOrderDTO;

/**
 * Dashboard counters. Cancelled and rejected records are left out of every
 * figure; returned and refunded ones count but add nothing to the total value.
 */
@Component
public class OrderStatsHelper {

	private static final Set<String> INACTIVE = codes(OrderStatus.CANCELLED, OrderStatus.REJECTED);

	private static final Set<String> PENDING = codes(OrderStatus.QUOTE_REQUESTED, OrderStatus.QUOTE_SENT,
			OrderStatus.NEGOTIATION, OrderStatus.CONFIRMED, OrderStatus.PAYMENT_PENDING);

	private static final Set<String> PROCESSING = codes(OrderStatus.PROCESSING, OrderStatus.PACKED,
			OrderStatus.ORDER_BOOKED, OrderStatus.PAID);

	private static final Set<String> COMPLETED = codes(OrderStatus.DELIVERED, OrderStatus.COMPLETED);

	private static final Set<String> NO_VALUE = codes(OrderStatus.RETURNED, OrderStatus.REFUNDED);

	public OrderStatsResponse compute(List<UnifiedOrderDTO> orders) {
		List<UnifiedOrderDTO> active = orders.stream().filter(o -> !in(INACTIVE, o.getStatus())).toList();

		BigDecimal totalValue = active.stream()
				.filter(o -> !in(NO_VALUE, o.getStatus()))
				.map(UnifiedOrderDTO::getTotalAmount)
				.filter(Objects::nonNull)
				.reduce(BigDecimal.ZERO, BigDecimal::add);

		return OrderStatsResponse.builder()
				.total(active.size())
				.pending(count(active, PENDING))
				.processing(count(active, PROCESSING))
				.shipped(active.stream().filter(o -> OrderStatus.SHIPPED.getCode().equals(o.getStatus())).count())
				.completed(count(active, COMPLETED))
				.totalValue(totalValue)
				.build();
	}

	private static long count(List<UnifiedOrderDTO> orders, Set<String> statuses) {
		return orders.stream().filter(o -> in(statuses, o.getStatus())).count();
	}

	private static boolean in(Set<String> statuses, String status) {
		return status != null && statuses.contains(status);
	}

	private static Set<String> codes(OrderStatus... statuses) {
		return Arrays.stream(statuses).map(OrderStatus::getCode).collect(Collectors.toUnmodifiableSet());
	}
}
