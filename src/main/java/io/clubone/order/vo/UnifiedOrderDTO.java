package io.clubone.order.vo;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.clubone.order.util.SourceKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One order or quotation in the unified shape. Instances are rebuilt from the
 * backend payload on every read and are never patched after an action.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UnifiedOrderDTO {
	private String id;
	private String displayNumber;
	// orderId / quotationId as stored by the backend; null when displayNumber is derived
	private String backendNumber;
	private SourceKind sourceKind;
	private String customerId;
	private CustomerSummaryDTO customer;
	private List<OrderLineItemDTO> lineItems;
	private BigDecimal totalAmount;
	private BigDecimal quotedTotal;
	private String status;
	private String currency;
	private String notes;
	private RawShippingAddress shippingAddress;
	private BigDecimal shippingCost;
	private BigDecimal discount;
	private Instant createdAt;
	private Instant updatedAt;
	private List<OrderTimelineDTO> timeline;

	public boolean isQuotation() {
		return sourceKind == SourceKind.QUOTATION;
	}

	public boolean matches(String idOrNumber) {
		return idOrNumber != null && (idOrNumber.equals(id) || idOrNumber.equals(displayNumber));
	}
}
