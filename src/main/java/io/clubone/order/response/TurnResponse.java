package io.clubone.order.response;

import java.util.List;

import io.clubone.order.util.LifecycleAction;
import io.clubone.order.util.SourceKind;
import io.clubone.order.util.Turn;

public record TurnResponse(
		String id,
		SourceKind sourceKind,
		String status,
		Turn turn,
		boolean terminal,
		List<LifecycleAction> availableActions
) {}
