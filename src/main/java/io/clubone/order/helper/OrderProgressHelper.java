package io.clubone.order.helper;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Component;

import io.clubone.order.response.OrderProgressResponse;
import io.clubone.order.response.ProgressStageDTO;
import io.clubone.order.util.OrderStatus;
import io.clubone.order.util.StageState;
import io.clubone.order.vo.OrderTimelineDTO;
import io.clubone.order.vo.UnifiedOrderDTO;

/**
 * Projects a unified status onto the fixed stepper sequence
 * quote_requested → quote_sent → negotiation → order_booked → processing →
 * shipped → delivered.
 *
 * Rejected records (cancelled, rejected, returned, refunded) stop at the last
 * stage they reached according to their timeline; that stage is marked
 * REJECTED and everything after it PENDING.
 */
@Component
public class OrderProgressHelper {

	public static final List<OrderStatus> STAGES = List.of(OrderStatus.QUOTE_REQUESTED, OrderStatus.QUOTE_SENT,
			OrderStatus.NEGOTIATION, OrderStatus.ORDER_BOOKED, OrderStatus.PROCESSING, OrderStatus.SHIPPED,
			OrderStatus.DELIVERED);

	private static final Map<OrderStatus, OrderStatus> COLLAPSE = Map.of(
			OrderStatus.CONFIRMED, OrderStatus.ORDER_BOOKED,
			OrderStatus.PAYMENT_PENDING, OrderStatus.ORDER_BOOKED,
			OrderStatus.PAID, OrderStatus.ORDER_BOOKED,
			OrderStatus.PACKED, OrderStatus.PROCESSING,
			OrderStatus.COMPLETED, OrderStatus.DELIVERED);

	// statuses searched, in order, for a stage's timestamp after the exact match
	private static final Map<OrderStatus, List<OrderStatus>> STAGE_SOURCES = Map.of(
			OrderStatus.ORDER_BOOKED, List.of(OrderStatus.CONFIRMED, OrderStatus.PAYMENT_PENDING, OrderStatus.PAID,
					OrderStatus.ORDER_BOOKED),
			OrderStatus.PROCESSING, List.of(OrderStatus.PROCESSING, OrderStatus.PACKED),
			OrderStatus.SHIPPED, List.of(OrderStatus.SHIPPED),
			OrderStatus.DELIVERED, List.of(OrderStatus.DELIVERED, OrderStatus.COMPLETED));

	private static final Set<OrderStatus> REJECTION_STATUSES = Set.of(OrderStatus.CANCELLED, OrderStatus.REJECTED,
			OrderStatus.RETURNED, OrderStatus.REFUNDED);

	public OrderProgressResponse project(UnifiedOrderDTO order) {
		return project(order.getStatus(), order.getTimeline());
	}

	public OrderProgressResponse project(String status, List<OrderTimelineDTO> timeline) {
		List<OrderTimelineDTO> history = timeline == null ? List.of() : timeline;
		boolean rejected = isRejectionStatus(status);
		int currentIndex = stageIndex(status);
		int rejectionIndex = rejected ? lastStageBeforeRejection(history) : -1;

		List<ProgressStageDTO> stages = new ArrayList<>(STAGES.size());
		for (int i = 0; i < STAGES.size(); i++) {
			OrderStatus stage = STAGES.get(i);
			StageState state = rejected ? rejectedState(i, rejectionIndex) : state(i, currentIndex);
			stages.add(new ProgressStageDTO(stage.getCode(), stage.getLabel(), state, stageDate(stage, history)));
		}
		return new OrderProgressResponse(status, rejected, rejected ? -1 : currentIndex, rejectionIndex, stages);
	}

	public static boolean isRejectionStatus(String status) {
		OrderStatus parsed = OrderStatus.fromCode(status);
		return parsed != null && REJECTION_STATUSES.contains(parsed);
	}

	/**
	 * @return position of the status in the stage sequence after collapsing, or
	 *         -1 when it has no stage
	 */
	public static int stageIndex(String status) {
		OrderStatus parsed = OrderStatus.fromCode(status);
		if (parsed == null)
			return -1;
		return STAGES.indexOf(COLLAPSE.getOrDefault(parsed, parsed));
	}

	private static int lastStageBeforeRejection(List<OrderTimelineDTO> history) {
		for (int i = history.size() - 1; i >= 0; i--) {
			String entryStatus = history.get(i).status();
			int index = stageIndex(entryStatus);
			if (index != -1 && !isRejectionStatus(entryStatus)) {
				return index;
			}
		}
		return 0;
	}

	private static StageState state(int index, int currentIndex) {
		if (index < currentIndex)
			return StageState.COMPLETED;
		if (index == currentIndex)
			return StageState.CURRENT;
		return StageState.PENDING;
	}

	private static StageState rejectedState(int index, int rejectionIndex) {
		if (index < rejectionIndex)
			return StageState.COMPLETED;
		if (index == rejectionIndex)
			return StageState.REJECTED;
		return StageState.PENDING;
	}

	private static Instant stageDate(OrderStatus stage, List<OrderTimelineDTO> history) {
		Instant exact = earliest(stage, history);
		if (exact != null)
			return exact;
		for (OrderStatus source : STAGE_SOURCES.getOrDefault(stage, List.of(stage))) {
			Instant match = earliest(source, history);
			if (match != null)
				return match;
		}
		return null;
	}

	private static Instant earliest(OrderStatus status, List<OrderTimelineDTO> history) {
		Instant earliest = null;
		for (OrderTimelineDTO entry : history) {
			if (status.getCode().equals(entry.status()) && entry.timestamp() != null
					&& (earliest == null || entry.timestamp().isBefore(earliest))) {
				earliest = entry.timestamp();
			}
		}
		return earliest;
	}
}
