package io.clubone.order.util;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StageState {
	COMPLETED("completed"), CURRENT("current"), PENDING("pending"), REJECTED("rejected");

	private final String code;

	StageState(String code) {
		this.code = code;
	}

	@JsonValue
	public String getCode() {
		return code;
	}
}
