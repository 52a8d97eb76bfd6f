package io.clubone.order.exception;

/**
 * The backend rejected a write because the record changed underneath it
 * (HTTP 409 or 412).
 */
public class StaleWriteException extends TransportException {

	private static final long serialVersionUID = 1L;

	public StaleWriteException(String operation, Integer upstreamStatus, String message, Throwable cause) {
		super(operation, upstreamStatus, message, cause);
	}
}
