package io.clubone.order.util;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Turn {
	ADMIN("admin"), CUSTOMER("customer"), NONE("none");

	private final String code;

	Turn(String code) {
		this.code = code;
	}

	@JsonValue
	public String getCode() {
		return code;
	}
}
