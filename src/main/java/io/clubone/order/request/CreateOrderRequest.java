package io.clubone.order.request;

import java.math.BigDecimal;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CreateOrderRequest {
	private String orderId;
	private String customerId;
	@NotEmpty
	@Valid
	private List<Product> products;
	private BigDecimal totalAmount;
	private String status;
	private String notes;

	@Data
	@NoArgsConstructor
	@AllArgsConstructor
	@JsonInclude(JsonInclude.Include.NON_NULL)
	public static class Product {
		@NotBlank
		private String productId;
		@Min(1)
		private int quantity;
		private BigDecimal price;
	}
}
