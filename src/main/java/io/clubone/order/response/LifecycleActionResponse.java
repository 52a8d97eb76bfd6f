package io.clubone.order.response;

import io.clubone.order.util.LifecycleAction;
import io.clubone.order.vo.UnifiedOrderDTO;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a lifecycle action. {@code order} is the freshly normalized record
 * and replaces any copy the caller held before the action.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LifecycleActionResponse {

	public enum Confirmation {
		// backend echoed the updated record
		RESPONSE,
		// backend returned nothing, record re-read from the list
		REFETCH
	}

	private LifecycleAction action;
	private String submittedStatus;
	private Confirmation confirmedBy;
	private UnifiedOrderDTO order;
}
