package io.clubone.order.response;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderStatsResponse {
	private long total;
	private long pending;
	private long processing;
	private long shipped;
	private long completed;
	private BigDecimal totalValue;
}
