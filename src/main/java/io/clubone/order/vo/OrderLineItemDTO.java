package io.clubone.order.vo;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OrderLineItemDTO {
	private String productId;
	private int quantity;
	private BigDecimal unitPrice;
	private BigDecimal targetPrice;
	private BigDecimal quotedPrice;
	private BigDecimal lineTotal;

	/**
	 * quotedPrice, else targetPrice, else unitPrice.
	 */
	public BigDecimal effectivePrice() {
		if (quotedPrice != null)
			return quotedPrice;
		if (targetPrice != null)
			return targetPrice;
		return unitPrice == null ? BigDecimal.ZERO : unitPrice;
	}
}
