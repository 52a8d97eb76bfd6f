package io.clubone.order.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import io.clubone.order.util.ConstantUtility;
import io.clubone.order.util.LifecycleAction;
import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * The backend accepted an action but returned no record, and the record could
 * not be found again by id or display number afterwards.
 */
@ResponseStatus(value = HttpStatus.NOT_FOUND)
@Data
@EqualsAndHashCode(callSuper = false)
public class LookupNotFoundException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final LifecycleAction action;

	private final String lookupKey;

	public LookupNotFoundException(LifecycleAction action, String lookupKey) {
		super(String.format("%s: %s (%s)", action.getActionName(), ConstantUtility.LOOKUP_FAILED, lookupKey));
		this.action = action;
		this.lookupKey = lookupKey;
	}
}
