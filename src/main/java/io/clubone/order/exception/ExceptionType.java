package io.clubone.order.exception;

public enum ExceptionType {

	ERROR("error"),
	VALIDATION("validation"),
	TRANSPORT("transport"),
	LIFECYCLE("lifecycle");

	private String type;

	public String getType() {
		return type;
	}

	private ExceptionType(String type) {
		this.type = type;
	}
}
