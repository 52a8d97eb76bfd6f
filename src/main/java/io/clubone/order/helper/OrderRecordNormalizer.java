package io.clubone.order.helper;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import io.clubone.order.util.ConstantUtility;
import io.clubone.order.util.SourceKind;
import io.clubone.order.util.StatusTranslator;
import io.clubone.order.vo.CustomerSummaryDTO;
import io.clubone.order.vo.OrderLineItemDTO;
import io.clubone.order.vo.OrderTimelineDTO;
import io.clubone.order.vo.RawOrder;
import io.clubone.order.vo.RawOrderProduct;
import io.clubone.order.vo.RawQuotation;
import io.clubone.order.vo.RawQuotationProduct;
import io.clubone.order.vo.RawTimelineEntry;
import io.clubone.order.vo.UnifiedOrderDTO;
import lombok.extern.slf4j.Slf4j;

/**
 * Converts backend order and quotation records into {@link UnifiedOrderDTO}.
 *
 * The backend payload is not guaranteed field by field, so both mappings are
 * total: missing lists, quantities and prices read as empty or zero and
 * unparsable timestamps read as null.
 */
@Component
@Slf4j
public class OrderRecordNormalizer {

	public UnifiedOrderDTO normalizeOrder(RawOrder raw) {
		List<OrderLineItemDTO> lines = new ArrayList<>();
		for (RawOrderProduct p : nz(raw.getProducts())) {
			if (p == null)
				continue;
			BigDecimal price = zeroIfNull(p.getPrice());
			int quantity = quantity(p.getQuantity());
			lines.add(OrderLineItemDTO.builder()
					.productId(p.getProductId())
					.quantity(quantity)
					.unitPrice(price)
					.lineTotal(price.multiply(BigDecimal.valueOf(quantity)))
					.build());
		}

		String status = StatusTranslator.toUnifiedStatus(raw.getStatus(), SourceKind.ORDER);
		Instant createdAt = parseInstant(raw.getCreatedAt());

		return UnifiedOrderDTO.builder()
				.id(raw.getId())
				.displayNumber(StringUtils.isNotBlank(raw.getOrderId()) ? raw.getOrderId()
						: derivedNumber(ConstantUtility.ORDER_NUMBER_PREFIX, raw.getId()))
				.backendNumber(StringUtils.trimToNull(raw.getOrderId()))
				.sourceKind(SourceKind.ORDER)
				.customerId(raw.getCustomerId())
				.customer(customerPlaceholder(raw.getCustomerId()))
				.lineItems(lines)
				.totalAmount(raw.getTotalAmount() != null ? raw.getTotalAmount() : sumLineTotals(lines))
				.status(status)
				.currency(StringUtils.defaultIfBlank(raw.getCurrency(), ConstantUtility.DEFAULT_CURRENCY))
				.notes(raw.getNotes())
				.shippingAddress(raw.getShippingAddress())
				.shippingCost(raw.getShippingCost())
				.discount(raw.getDiscount())
				.createdAt(createdAt)
				.updatedAt(parseInstant(raw.getUpdatedAt()))
				.timeline(timeline(raw.getTimeline(), SourceKind.ORDER, status, createdAt))
				.build();
	}

	public UnifiedOrderDTO normalizeQuotation(RawQuotation raw) {
		List<OrderLineItemDTO> lines = new ArrayList<>();
		BigDecimal targetTotal = BigDecimal.ZERO;
		BigDecimal quotedTotal = BigDecimal.ZERO;
		for (RawQuotationProduct p : nz(raw.getProducts())) {
			if (p == null)
				continue;
			BigDecimal qty = BigDecimal.valueOf(quantity(p.getQuantity()));
			BigDecimal target = zeroIfNull(p.getTargetPrice());
			BigDecimal quoted = p.getQuotedPrice() != null ? p.getQuotedPrice() : target;
			targetTotal = targetTotal.add(qty.multiply(target));
			quotedTotal = quotedTotal.add(qty.multiply(quoted));

			OrderLineItemDTO line = OrderLineItemDTO.builder()
					.productId(p.getProductId())
					.quantity(quantity(p.getQuantity()))
					.targetPrice(p.getTargetPrice())
					.quotedPrice(p.getQuotedPrice())
					.build();
			line.setUnitPrice(line.effectivePrice());
			line.setLineTotal(line.effectivePrice().multiply(qty));
			lines.add(line);
		}

		BigDecimal totalAmount = raw.getTotalAmount() != null && raw.getTotalAmount().signum() != 0
				? raw.getTotalAmount()
				: targetTotal;
		String status = StatusTranslator.toUnifiedStatus(raw.getStatus(), SourceKind.QUOTATION);
		Instant createdAt = parseInstant(raw.getCreatedAt());

		return UnifiedOrderDTO.builder()
				.id(raw.getId())
				.displayNumber(StringUtils.isNotBlank(raw.getQuotationId()) ? raw.getQuotationId()
						: derivedNumber(ConstantUtility.QUOTATION_NUMBER_PREFIX, raw.getId()))
				.backendNumber(StringUtils.trimToNull(raw.getQuotationId()))
				.sourceKind(SourceKind.QUOTATION)
				.customerId(raw.getCustomerId())
				.customer(customerPlaceholder(raw.getCustomerId()))
				.lineItems(lines)
				.totalAmount(totalAmount)
				.quotedTotal(quotedTotal.compareTo(targetTotal) != 0 ? quotedTotal : null)
				.status(status)
				.currency(ConstantUtility.DEFAULT_CURRENCY)
				.notes(raw.getNotes())
				.shippingAddress(raw.getShippingAddress())
				.shippingCost(BigDecimal.ZERO)
				.discount(BigDecimal.ZERO)
				.createdAt(createdAt)
				.updatedAt(parseInstant(raw.getUpdatedAt()))
				.timeline(timeline(raw.getTimeline(), SourceKind.QUOTATION, status, createdAt))
				.build();
	}

	static String derivedNumber(String prefix, String id) {
		String safeId = StringUtils.defaultString(id);
		return prefix + StringUtils.right(safeId, ConstantUtility.DERIVED_NUMBER_LENGTH).toUpperCase(Locale.ROOT);
	}

	static Instant parseInstant(String value) {
		if (StringUtils.isBlank(value))
			return null;
		try {
			return OffsetDateTime.parse(value).toInstant();
		} catch (DateTimeParseException ex) {
			log.debug("Unparsable backend timestamp '{}', treating as absent", value);
			return null;
		}
	}

	private static List<OrderTimelineDTO> timeline(List<RawTimelineEntry> entries, SourceKind kind,
			String currentStatus, Instant createdAt) {
		List<OrderTimelineDTO> out = new ArrayList<>();
		for (RawTimelineEntry e : nz(entries)) {
			if (e == null)
				continue;
			out.add(new OrderTimelineDTO(StatusTranslator.timelineStatus(e.getStatus(), kind),
					parseInstant(e.getTimestamp()), e.getNote(), e.getUpdatedBy()));
		}
		if (out.isEmpty()) {
			out.add(new OrderTimelineDTO(currentStatus, createdAt, null, null));
		}
		return out;
	}

	private static CustomerSummaryDTO customerPlaceholder(String customerId) {
		return new CustomerSummaryDTO(StringUtils.defaultString(customerId),
				StringUtils.isNotBlank(customerId) ? ConstantUtility.CUSTOMER_LOADING : ConstantUtility.GUEST_CUSTOMER);
	}

	private static BigDecimal sumLineTotals(List<OrderLineItemDTO> lines) {
		return lines.stream().map(OrderLineItemDTO::getLineTotal).reduce(BigDecimal.ZERO, BigDecimal::add);
	}

	private static int quantity(Integer quantity) {
		return quantity == null ? 0 : quantity;
	}

	private static BigDecimal zeroIfNull(BigDecimal value) {
		return value == null ? BigDecimal.ZERO : value;
	}

	private static <T> List<T> nz(List<T> list) {
		return list == null ? List.of() : list;
	}
}
