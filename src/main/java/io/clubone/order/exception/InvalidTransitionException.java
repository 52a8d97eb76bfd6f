package io.clubone.order.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import io.clubone.order.util.LifecycleAction;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * An action was requested on a record whose current status does not allow it.
 * Raised before anything is submitted to the backend.
 */
@ResponseStatus(value = HttpStatus.CONFLICT)
@Data
@EqualsAndHashCode(callSuper = false)
public class InvalidTransitionException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final LifecycleAction action;

	private final String currentStatus;

	public InvalidTransitionException(LifecycleAction action, String recordId, String currentStatus, String reason) {
		super(String.format("Invalid lifecycle transition %s for %s in status %s: %s", action.getActionName(),
				recordId, currentStatus, reason));
		this.action = action;
		this.currentStatus = currentStatus;
	}
}
