package io.clubone.order.helper;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import io.clubone.order.response.OrderProgressResponse;
import io.clubone.order.response.ProgressStageDTO;
import io.clubone.order.util.StageState;
import io.clubone.order.vo.OrderTimelineDTO;

class OrderProgressHelperTest {

	private final OrderProgressHelper helper = new OrderProgressHelper();

	private static final String[] NON_REJECTED = { "quote_requested", "quote_sent", "negotiation", "order_booked",
			"confirmed", "payment_pending", "paid", "processing", "packed", "shipped", "delivered", "completed" };

	@Test
	@DisplayName("stages before the current one are completed, later ones pending")
	void marksStagesAroundCurrent() {
		OrderProgressResponse progress = helper.project("shipped", List.of());

		assertFalse(progress.isRejected());
		assertEquals(5, progress.getCurrentStageIndex());
		List<ProgressStageDTO> stages = progress.getStages();
		assertEquals(7, stages.size());
		for (int i = 0; i < 5; i++) {
			assertEquals(StageState.COMPLETED, stages.get(i).state());
		}
		assertEquals(StageState.CURRENT, stages.get(5).state());
		assertEquals(StageState.PENDING, stages.get(6).state());
		assertEquals("Shipment Booked", stages.get(5).label());
	}

	@Test
	@DisplayName("collapsed statuses land on their stage")
	void collapsesStatuses() {
		assertEquals(3, helper.project("paid", null).getCurrentStageIndex());
		assertEquals(3, helper.project("payment_pending", null).getCurrentStageIndex());
		assertEquals(4, helper.project("packed", null).getCurrentStageIndex());
		assertEquals(6, helper.project("completed", null).getCurrentStageIndex());
	}

	@Test
	@DisplayName("completed stage count never decreases along the sequence")
	void progressIsMonotonic() {
		int previous = -1;
		for (String status : NON_REJECTED) {
			long completed = helper.project(status, null).getStages().stream()
					.filter(s -> s.state() == StageState.COMPLETED).count();
			assertTrue(completed >= previous, status);
			previous = (int) completed;
		}
	}

	@Test
	void statusOutsideSequenceLeavesEveryStagePending() {
		OrderProgressResponse progress = helper.project("on_hold", null);

		assertEquals(-1, progress.getCurrentStageIndex());
		assertTrue(progress.getStages().stream().allMatch(s -> s.state() == StageState.PENDING));
	}

	@Test
	@DisplayName("a rejected record stops at the last stage it reached")
	void rejectionStopsAtLastReachedStage() {
		List<OrderTimelineDTO> timeline = List.of(
				entry("quote_requested", "2025-01-01T00:00:00Z"),
				entry("quote_sent", "2025-01-02T00:00:00Z"),
				entry("negotiation", "2025-01-03T00:00:00Z"),
				entry("rejected", "2025-01-04T00:00:00Z"));

		OrderProgressResponse progress = helper.project("rejected", timeline);

		assertTrue(progress.isRejected());
		assertEquals(2, progress.getRejectionStageIndex());
		List<ProgressStageDTO> stages = progress.getStages();
		assertEquals(StageState.COMPLETED, stages.get(0).state());
		assertEquals(StageState.COMPLETED, stages.get(1).state());
		assertEquals(StageState.REJECTED, stages.get(2).state());
		for (int i = 3; i < stages.size(); i++) {
			assertEquals(StageState.PENDING, stages.get(i).state());
		}
	}

	@Test
	void rejectionWithoutHistoryRejectsFirstStage() {
		OrderProgressResponse progress = helper.project("cancelled", List.of(entry("cancelled", "2025-01-04T00:00:00Z")));

		assertEquals(0, progress.getRejectionStageIndex());
		assertEquals(StageState.REJECTED, progress.getStages().get(0).state());
	}

	@Test
	@DisplayName("stage dates use the earliest exact match, then the collapsed statuses")
	void stageDates() {
		List<OrderTimelineDTO> timeline = List.of(
				entry("payment_pending", "2025-02-01T00:00:00Z"),
				entry("paid", "2025-02-02T00:00:00Z"),
				entry("shipped", "2025-02-05T00:00:00Z"),
				entry("shipped", "2025-02-04T00:00:00Z"));

		List<ProgressStageDTO> stages = helper.project("shipped", timeline).getStages();

		assertEquals(Instant.parse("2025-02-01T00:00:00Z"), stages.get(3).reachedAt());
		assertEquals(Instant.parse("2025-02-04T00:00:00Z"), stages.get(5).reachedAt());
		assertNull(stages.get(4).reachedAt());
	}

	private static OrderTimelineDTO entry(String status, String timestamp) {
		return new OrderTimelineDTO(status, Instant.parse(timestamp), null, null);
	}
}
