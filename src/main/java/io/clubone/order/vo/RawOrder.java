package io.clubone.order.vo;

import java.math.BigDecimal;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Order record as returned by {@code /orders/list}. {@code orderId} is already
 * human readable (ORD-2025-001).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawOrder {
	@JsonProperty("_id")
	private String id;
	private String orderId;
	private String customerId;
	private List<RawOrderProduct> products;
	private BigDecimal totalAmount;
	private String currency;
	private String status;
	private RawShippingAddress shippingAddress;
	private String notes;
	private BigDecimal shippingCost;
	private BigDecimal discount;
	private String createdAt;
	private String updatedAt;
	private List<RawTimelineEntry> timeline;
}
