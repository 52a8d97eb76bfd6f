package io.clubone.order.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StatusTranslatorTest {

	@Test
	@DisplayName("quotation statuses map to the negotiation vocabulary")
	void quotationStatuses() {
		assertEquals("quote_requested", StatusTranslator.toUnifiedStatus("PENDING", SourceKind.QUOTATION));
		assertEquals("quote_sent", StatusTranslator.toUnifiedStatus("QUOTE_SENT", SourceKind.QUOTATION));
		assertEquals("negotiation", StatusTranslator.toUnifiedStatus("NEGOTIATING", SourceKind.QUOTATION));
		assertEquals("order_booked", StatusTranslator.toUnifiedStatus("ACCEPTED", SourceKind.QUOTATION));
		assertEquals("rejected", StatusTranslator.toUnifiedStatus("REJECTED", SourceKind.QUOTATION));
	}

	@Test
	@DisplayName("order statuses map to the fulfilment vocabulary")
	void orderStatuses() {
		assertEquals("payment_pending", StatusTranslator.toUnifiedStatus("PENDING", SourceKind.ORDER));
		assertEquals("confirmed", StatusTranslator.toUnifiedStatus("CONFIRMED", SourceKind.ORDER));
		assertEquals("paid", StatusTranslator.toUnifiedStatus("PAID", SourceKind.ORDER));
		assertEquals("processing", StatusTranslator.toUnifiedStatus("PROCESSING", SourceKind.ORDER));
		assertEquals("shipped", StatusTranslator.toUnifiedStatus("SHIPPED", SourceKind.ORDER));
		assertEquals("delivered", StatusTranslator.toUnifiedStatus("DELIVERED", SourceKind.ORDER));
		assertEquals("cancelled", StatusTranslator.toUnifiedStatus("CANCELLED", SourceKind.ORDER));
	}

	@Test
	@DisplayName("unknown codes: quotations fall back to quote_requested, orders pass through lower-cased")
	void unknownCodes() {
		assertEquals("quote_requested", StatusTranslator.toUnifiedStatus("ARCHIVED", SourceKind.QUOTATION));
		assertEquals("quote_requested", StatusTranslator.toUnifiedStatus(null, SourceKind.QUOTATION));
		assertEquals("on_hold", StatusTranslator.toUnifiedStatus("ON_HOLD", SourceKind.ORDER));
		assertEquals("payment_pending", StatusTranslator.toUnifiedStatus(null, SourceKind.ORDER));
	}

	@Test
	@DisplayName("every quotation status survives a round trip through the backend code")
	void quotationRoundTrip() {
		for (OrderStatus status : StatusTranslator.QUOTATION_STATUSES) {
			String backend = StatusTranslator.toBackendQuotationStatus(status);
			assertEquals(status.getCode(), StatusTranslator.toUnifiedStatus(backend, SourceKind.QUOTATION));
		}
	}

	@Test
	void noQuotationCounterpartForOrderOnlyStatus() {
		assertThrows(IllegalArgumentException.class,
				() -> StatusTranslator.toBackendQuotationStatus(OrderStatus.SHIPPED));
	}

	@Test
	@DisplayName("tracking stages are remapped before submission")
	void orderStageSubmission() {
		assertEquals("PAID", StatusTranslator.toBackendOrderStatus("processing"));
		assertEquals("SHIPPED", StatusTranslator.toBackendOrderStatus("shipped"));
		assertEquals("DELIVERED", StatusTranslator.toBackendOrderStatus("delivered"));
		assertEquals("DELIVERED", StatusTranslator.toBackendOrderStatus("completed"));
		assertEquals("CANCELLED", StatusTranslator.toBackendOrderStatus("cancelled"));
	}

	@Test
	void timelineAcceptsUnifiedAndBackendCodes() {
		assertEquals("negotiation", StatusTranslator.timelineStatus("negotiation", SourceKind.QUOTATION));
		assertEquals("negotiation", StatusTranslator.timelineStatus("NEGOTIATING", SourceKind.QUOTATION));
		assertEquals("paid", StatusTranslator.timelineStatus("PAID", SourceKind.ORDER));
	}
}
