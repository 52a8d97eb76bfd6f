package io.clubone.order.request;

import java.math.BigDecimal;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class QuotedLineRequest {
	@NotBlank
	private String productId;
	@NotNull
	@DecimalMin("0.0")
	private BigDecimal quotedPrice;
}
