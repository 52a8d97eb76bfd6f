package io.clubone.order.service.impl;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;

import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import io.clubone.order.dao.OrderBackendDAO;
import io.clubone.order.exception.InvalidTransitionException;
import io.clubone.order.exception.LookupNotFoundException;
import io.clubone.order.exception.NotValidException;
import io.clubone.order.exception.TransportException;
import io.clubone.order.helper.OrderRecordNormalizer;
import io.clubone.order.request.QuotationUpdateRequest;
import io.clubone.order.request.QuotedLineRequest;
import io.clubone.order.request.RejectQuotationRequest;
import io.clubone.order.request.SendQuoteRequest;
import io.clubone.order.request.UpdateOrderStatusRequest;
import io.clubone.order.response.LifecycleActionResponse;
import io.clubone.order.response.LifecycleActionResponse.Confirmation;
import io.clubone.order.service.OrderFeedService;
import io.clubone.order.service.OrderLifecycleService;
import io.clubone.order.util.LifecycleAction;
import io.clubone.order.util.OrderStatus;
import io.clubone.order.util.StatusTranslator;
import io.clubone.order.util.Turn;
import io.clubone.order.vo.OrderLineItemDTO;
import io.clubone.order.vo.RawQuotationProduct;
import io.clubone.order.vo.UnifiedOrderDTO;
import lombok.extern.slf4j.Slf4j;

@Service
@Slf4j
public class OrderLifecycleServiceImpl implements OrderLifecycleService {

	private static final Set<OrderStatus> TERMINAL = Set.of(OrderStatus.REJECTED, OrderStatus.CANCELLED,
			OrderStatus.DELIVERED);

	@Autowired
	private OrderBackendDAO orderBackendDAO;

	@Autowired
	private OrderFeedService orderFeedService;

	@Autowired
	private OrderRecordNormalizer normalizer;

	@Override
	public Turn turnOf(UnifiedOrderDTO order) {
		if (!order.isQuotation())
			return Turn.NONE;
		OrderStatus status = OrderStatus.fromCode(order.getStatus());
		if (status == OrderStatus.QUOTE_REQUESTED || status == OrderStatus.NEGOTIATION)
			return Turn.ADMIN;
		if (status == OrderStatus.QUOTE_SENT)
			return Turn.CUSTOMER;
		return Turn.NONE;
	}

	@Override
	public List<LifecycleAction> availableActions(UnifiedOrderDTO order) {
		OrderStatus status = OrderStatus.fromCode(order.getStatus());
		if (order.isQuotation()) {
			if (status == OrderStatus.QUOTE_REQUESTED)
				return List.of(LifecycleAction.SEND_QUOTE, LifecycleAction.ACCEPT_QUOTE_REQUEST,
						LifecycleAction.REJECT_QUOTE_REQUEST);
			if (status == OrderStatus.NEGOTIATION)
				return List.of(LifecycleAction.SEND_QUOTE, LifecycleAction.ACCEPT_COUNTER,
						LifecycleAction.REJECT_COUNTER);
			return List.of();
		}
		return isTerminal(order.getStatus()) ? List.of() : List.of(LifecycleAction.UPDATE_ORDER_STATUS);
	}

	@Override
	public boolean isTerminal(String status) {
		OrderStatus parsed = OrderStatus.fromCode(status);
		return parsed != null && TERMINAL.contains(parsed);
	}

	@Override
	public LifecycleActionResponse sendQuote(String idOrNumber, SendQuoteRequest request) {
		LifecycleAction action = LifecycleAction.SEND_QUOTE;
		UnifiedOrderDTO quotation = loadQuotation(action, idOrNumber, OrderStatus.QUOTE_REQUESTED,
				OrderStatus.NEGOTIATION);

		Map<String, BigDecimal> quoted = quotedPrices(quotation, request);
		QuotationUpdateRequest values = QuotationUpdateRequest.builder()
				.status(StatusTranslator.toBackendQuotationStatus(OrderStatus.QUOTE_SENT))
				.products(lines(quotation, line -> quoted.getOrDefault(line.getProductId(), line.effectivePrice())))
				.notes(request == null ? null : StringUtils.trimToNull(request.getNotes()))
				.build();
		return submitQuotation(action, quotation, values);
	}

	@Override
	public LifecycleActionResponse acceptCounter(String idOrNumber) {
		LifecycleAction action = LifecycleAction.ACCEPT_COUNTER;
		return accept(action, loadQuotation(action, idOrNumber, OrderStatus.NEGOTIATION));
	}

	@Override
	public LifecycleActionResponse rejectCounter(String idOrNumber, RejectQuotationRequest request) {
		LifecycleAction action = LifecycleAction.REJECT_COUNTER;
		return reject(action, loadQuotation(action, idOrNumber, OrderStatus.NEGOTIATION), request);
	}

	@Override
	public LifecycleActionResponse acceptQuoteRequest(String idOrNumber) {
		LifecycleAction action = LifecycleAction.ACCEPT_QUOTE_REQUEST;
		return accept(action, loadQuotation(action, idOrNumber, OrderStatus.QUOTE_REQUESTED));
	}

	@Override
	public LifecycleActionResponse rejectQuoteRequest(String idOrNumber, RejectQuotationRequest request) {
		LifecycleAction action = LifecycleAction.REJECT_QUOTE_REQUEST;
		return reject(action, loadQuotation(action, idOrNumber, OrderStatus.QUOTE_REQUESTED), request);
	}

	@Override
	public LifecycleActionResponse updateOrderStatus(String idOrNumber, UpdateOrderStatusRequest request) {
		LifecycleAction action = LifecycleAction.UPDATE_ORDER_STATUS;
		if (request == null || StringUtils.isBlank(request.getStatus())) {
			throw new NotValidException("Order status is required");
		}
		UnifiedOrderDTO order = orderFeedService.getOrder(idOrNumber);
		if (order.isQuotation()) {
			throw new InvalidTransitionException(action, order.getId(), order.getStatus(),
					"record is a quotation, not an order");
		}
		if (isTerminal(order.getStatus())) {
			throw new InvalidTransitionException(action, order.getId(), order.getStatus(), "order is already closed");
		}

		String backendStatus = StatusTranslator.toBackendOrderStatus(request.getStatus().trim());
		String orderId = StringUtils.defaultIfBlank(order.getBackendNumber(), order.getId());
		log.info("{}: order {} -> {}", action.getActionName(), orderId, backendStatus);

		return submit(action, backendStatus, order,
				() -> Optional.ofNullable(orderBackendDAO.submitOrderStatus(orderId, backendStatus,
						StringUtils.trimToNull(request.getNote()))).map(normalizer::normalizeOrder),
				() -> orderFeedService.listUnified());
	}

	private LifecycleActionResponse accept(LifecycleAction action, UnifiedOrderDTO quotation) {
		QuotationUpdateRequest values = QuotationUpdateRequest.builder()
				.status(StatusTranslator.toBackendQuotationStatus(OrderStatus.ORDER_BOOKED))
				.products(lines(quotation, OrderLineItemDTO::getTargetPrice))
				.build();
		return submitQuotation(action, quotation, values);
	}

	private LifecycleActionResponse reject(LifecycleAction action, UnifiedOrderDTO quotation,
			RejectQuotationRequest request) {
		QuotationUpdateRequest values = QuotationUpdateRequest.builder()
				.status(StatusTranslator.toBackendQuotationStatus(OrderStatus.REJECTED))
				.notes(request == null ? null : StringUtils.trimToNull(request.getReason()))
				.build();
		return submitQuotation(action, quotation, values);
	}

	private LifecycleActionResponse submitQuotation(LifecycleAction action, UnifiedOrderDTO quotation,
			QuotationUpdateRequest values) {
		log.info("{}: quotation {} -> {}", action.getActionName(), quotation.getId(), values.getStatus());
		return submit(action, values.getStatus(), quotation,
				() -> Optional.ofNullable(orderBackendDAO.submitQuotationUpdate(quotation.getId(), values))
						.map(normalizer::normalizeQuotation),
				() -> orderBackendDAO.fetchQuotations().stream().filter(Objects::nonNull)
						.map(normalizer::normalizeQuotation).toList());
	}

	/**
	 * Submits, then confirms from the echoed record or, when the backend echoes
	 * nothing, from a fresh read. Transport failures carry the action name.
	 */
	private LifecycleActionResponse submit(LifecycleAction action, String submittedStatus, UnifiedOrderDTO before,
			Supplier<Optional<UnifiedOrderDTO>> submission, Supplier<List<UnifiedOrderDTO>> refetch) {
		try {
			Optional<UnifiedOrderDTO> echoed = submission.get();
			if (echoed.isPresent()) {
				return new LifecycleActionResponse(action, submittedStatus, Confirmation.RESPONSE, echoed.get());
			}
			log.debug("{}: backend returned no record for {}, re-reading", action.getActionName(), before.getId());
			UnifiedOrderDTO refreshed = refetch.get().stream()
					.filter(o -> o.matches(before.getId()) || o.matches(before.getDisplayNumber()))
					.findFirst()
					.orElseThrow(() -> new LookupNotFoundException(action, before.getId()));
			return new LifecycleActionResponse(action, submittedStatus, Confirmation.REFETCH, refreshed);
		} catch (TransportException ex) {
			ex.setAction(action.getActionName());
			throw ex;
		}
	}

	private UnifiedOrderDTO loadQuotation(LifecycleAction action, String idOrNumber, OrderStatus... allowed) {
		UnifiedOrderDTO record = orderFeedService.getOrder(idOrNumber);
		if (!record.isQuotation()) {
			throw new InvalidTransitionException(action, record.getId(), record.getStatus(),
					"record is an order, not a quotation");
		}
		if (turnOf(record) != Turn.ADMIN) {
			throw new InvalidTransitionException(action, record.getId(), record.getStatus(),
					"waiting on the customer or already closed");
		}
		OrderStatus status = OrderStatus.fromCode(record.getStatus());
		for (OrderStatus candidate : allowed) {
			if (candidate == status)
				return record;
		}
		throw new InvalidTransitionException(action, record.getId(), record.getStatus(),
				"not allowed in this status");
	}

	/**
	 * Requested price per product. Every product must be on the quotation and
	 * appear at most once in the request.
	 */
	private static Map<String, BigDecimal> quotedPrices(UnifiedOrderDTO quotation, SendQuoteRequest request) {
		Map<String, BigDecimal> quoted = new HashMap<>();
		if (request == null || request.getLines() == null)
			return quoted;
		Set<String> onQuotation = new HashSet<>();
		for (OrderLineItemDTO line : quotation.getLineItems() == null ? List.<OrderLineItemDTO>of()
				: quotation.getLineItems()) {
			onQuotation.add(line.getProductId());
		}
		for (QuotedLineRequest line : request.getLines()) {
			if (line == null || !onQuotation.contains(line.getProductId())) {
				throw new NotValidException("Product " + (line == null ? null : line.getProductId())
						+ " is not on quotation " + quotation.getDisplayNumber());
			}
			if (quoted.put(line.getProductId(), line.getQuotedPrice()) != null) {
				throw new NotValidException("Product " + line.getProductId() + " is quoted more than once");
			}
		}
		return quoted;
	}

	private static List<RawQuotationProduct> lines(UnifiedOrderDTO quotation,
			Function<OrderLineItemDTO, BigDecimal> quotedPrice) {
		List<RawQuotationProduct> products = new ArrayList<>();
		for (OrderLineItemDTO line : quotation.getLineItems() == null ? List.<OrderLineItemDTO>of()
				: quotation.getLineItems()) {
			products.add(RawQuotationProduct.builder()
					.productId(line.getProductId())
					.quantity(line.getQuantity())
					.targetPrice(line.getTargetPrice())
					.quotedPrice(quotedPrice.apply(line))
					.build());
		}
		return products;
	}
}
