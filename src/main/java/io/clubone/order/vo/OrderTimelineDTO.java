package io.clubone.order.vo;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OrderTimelineDTO(
		String status,
		Instant timestamp,
		String note,
		String updatedBy
) {}
