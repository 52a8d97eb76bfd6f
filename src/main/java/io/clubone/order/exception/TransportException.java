package io.clubone.order.exception;

import lombok.Getter;
import lombok.Setter;

/**
 * Any failure talking to the order backend: connection problems and non-2xx
 * answers. {@code action} is filled in by the lifecycle service when the call
 * was made on behalf of a named action.
 */
@Getter
public class TransportException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final String operation;

	private final Integer upstreamStatus;

	@Setter
	private String action;

	public TransportException(String operation, Integer upstreamStatus, String message, Throwable cause) {
		super(message, cause);
		this.operation = operation;
		this.upstreamStatus = upstreamStatus;
	}

	@Override
	public String getMessage() {
		String base = super.getMessage();
		return action == null ? base : action + " failed: " + base;
	}
}
