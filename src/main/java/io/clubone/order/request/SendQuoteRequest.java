package io.clubone.order.request;

import java.util.List;

import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Admin's quoted prices. Lines that are not listed keep their current
 * effective price.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SendQuoteRequest {
	@Valid
	private List<QuotedLineRequest> lines;
	private String notes;
}
