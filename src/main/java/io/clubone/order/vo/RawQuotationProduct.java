package io.clubone.order.vo;

import java.math.BigDecimal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Quotation line as stored by the backend. {@code targetPrice} is the
 * customer's requested price, {@code quotedPrice} the admin's answer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RawQuotationProduct {
	private String productId;
	private Integer quantity;
	private BigDecimal targetPrice;
	private BigDecimal quotedPrice;
	@JsonProperty("_id")
	private String id;
}
