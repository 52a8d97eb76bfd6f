package io.clubone.order.util;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which backend collection a unified record was read from. Fixes the status
 * subset and the transition table that apply to the record.
 */
public enum SourceKind {
	ORDER("order"), QUOTATION("quotation");

	private final String code;

	SourceKind(String code) {
		this.code = code;
	}

	@JsonValue
	public String getCode() {
		return code;
	}
}
