package io.clubone.order.util;

/**
 * Status codes the backend accepts on quotation records.
 */
public enum BackendQuotationStatus {
	PENDING, QUOTE_SENT, NEGOTIATING, ACCEPTED, REJECTED
}
