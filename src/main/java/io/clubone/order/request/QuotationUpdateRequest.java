package io.clubone.order.request;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import io.clubone.order.vo.RawQuotationProduct;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * {@code values} block of {@code PATCH /orders/quotation/update}. Absent fields
 * are left untouched by the backend.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QuotationUpdateRequest {
	private String status;
	private List<RawQuotationProduct> products;
	private String notes;
}
