package io.clubone.order.response;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.clubone.order.util.StageState;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressStageDTO(
		String stage,
		String label,
		StageState state,
		Instant reachedAt
) {}
