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
 * Quotation record as returned by {@code /orders/quotation/list}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawQuotation {
	@JsonProperty("_id")
	private String id;
	private String quotationId;
	private String customerId;
	private List<RawQuotationProduct> products;
	private BigDecimal totalAmount;
	private BigDecimal quotedTotal;
	private String status;
	private RawShippingAddress shippingAddress;
	private String notes;
	private String createdAt;
	private String updatedAt;
	private List<RawTimelineEntry> timeline;
}
