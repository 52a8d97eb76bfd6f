package io.clubone.order.service.impl;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import io.clubone.order.dao.CustomerDAO;
import io.clubone.order.dao.OrderBackendDAO;
import io.clubone.order.exception.NotValidException;
import io.clubone.order.exception.ResourceNotFoundException;
import io.clubone.order.exception.TransportException;
import io.clubone.order.helper.OrderRecordNormalizer;
import io.clubone.order.helper.OrderStatsHelper;
import io.clubone.order.request.CreateOrderRequest;
import io.clubone.order.response.OrderStatsResponse;
import io.clubone.order.service.OrderFeedService;
import io.clubone.order.util.ConstantUtility;
import io.clubone.order.vo.CustomerSummaryDTO;
import io.clubone.order.vo.RawCustomer;
import io.clubone.order.vo.UnifiedOrderDTO;
import lombok.extern.slf4j.Slf4j;

@Service
@Slf4j
public class OrderFeedServiceImpl implements OrderFeedService {

	static final Comparator<UnifiedOrderDTO> MOST_RECENT_FIRST = Comparator.comparing(UnifiedOrderDTO::getUpdatedAt,
			Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

	@Autowired
	private OrderBackendDAO orderBackendDAO;

	@Autowired
	private CustomerDAO customerDAO;

	@Autowired
	private OrderRecordNormalizer normalizer;

	@Autowired
	private OrderStatsHelper statsHelper;

	@Autowired
	@Qualifier("orderFeedExecutor")
	private Executor orderFeedExecutor;

	@Value("${order.customer.resolve-names:false}")
	private boolean resolveCustomerNames;

	@Override
	public List<UnifiedOrderDTO> listUnified() {
		CompletableFuture<List<UnifiedOrderDTO>> orders = CompletableFuture.supplyAsync(this::fetchOrders,
				orderFeedExecutor);
		CompletableFuture<List<UnifiedOrderDTO>> quotations = CompletableFuture.supplyAsync(this::fetchQuotations,
				orderFeedExecutor);

		List<UnifiedOrderDTO> merged = new ArrayList<>();
		try {
			merged.addAll(orders.join());
			merged.addAll(quotations.join());
		} catch (CompletionException ex) {
			if (ex.getCause() instanceof RuntimeException cause) {
				throw cause;
			}
			throw ex;
		}
		// List.sort is stable, so equal timestamps keep orders ahead of quotations
		merged.sort(MOST_RECENT_FIRST);
		resolveCustomers(merged);
		log.info("Merged feed holds {} records", merged.size());
		return merged;
	}

	@Override
	public List<UnifiedOrderDTO> listOrders() {
		try {
			List<UnifiedOrderDTO> orders = fetchOrders();
			resolveCustomers(orders);
			return orders;
		} catch (TransportException ex) {
			log.warn("Could not read orders, returning an empty list: {}", ex.getMessage());
			return new ArrayList<>();
		}
	}

	@Override
	public List<UnifiedOrderDTO> listQuotations() {
		try {
			List<UnifiedOrderDTO> quotations = fetchQuotations();
			resolveCustomers(quotations);
			return quotations;
		} catch (TransportException ex) {
			log.warn("Could not read quotations, returning an empty list: {}", ex.getMessage());
			return new ArrayList<>();
		}
	}

	@Override
	public UnifiedOrderDTO getOrder(String idOrNumber) {
		return listUnified().stream()
				.filter(o -> o.matches(idOrNumber))
				.findFirst()
				.orElseThrow(() -> new ResourceNotFoundException("Order", "idOrNumber", idOrNumber));
	}

	@Override
	public UnifiedOrderDTO createOrder(CreateOrderRequest request) {
		if (request == null || request.getProducts() == null || request.getProducts().isEmpty()) {
			throw new NotValidException(ConstantUtility.INVALID_INPUT);
		}
		UnifiedOrderDTO created = normalizer.normalizeOrder(orderBackendDAO.createOrder(request));
		log.info("Created order {} ({})", created.getDisplayNumber(), created.getId());
		return created;
	}

	@Override
	public void deleteOrder(String id) {
		if (StringUtils.isBlank(id)) {
			throw new NotValidException("Order id is required");
		}
		orderBackendDAO.deleteOrder(id);
		log.info("Deleted order {}", id);
	}

	@Override
	public OrderStatsResponse stats() {
		return statsHelper.compute(listUnified());
	}

	private List<UnifiedOrderDTO> fetchOrders() {
		return orderBackendDAO.fetchOrders().stream().filter(Objects::nonNull).map(normalizer::normalizeOrder)
				.collect(Collectors.toCollection(ArrayList::new));
	}

	private List<UnifiedOrderDTO> fetchQuotations() {
		return orderBackendDAO.fetchQuotations().stream().filter(Objects::nonNull)
				.map(normalizer::normalizeQuotation)
				.collect(Collectors.toCollection(ArrayList::new));
	}

	/**
	 * Replaces placeholder customer names with the backend's full names. Records
	 * whose customer is unknown keep the placeholder.
	 */
	private void resolveCustomers(List<UnifiedOrderDTO> records) {
		if (!resolveCustomerNames || records.isEmpty())
			return;
		Map<String, String> names;
		try {
			names = customerDAO.fetchCustomers().stream()
					.filter(c -> c.getId() != null && StringUtils.isNotBlank(c.getFullName()))
					.collect(Collectors.toMap(RawCustomer::getId, RawCustomer::getFullName, (a, b) -> a));
		} catch (TransportException ex) {
			log.warn("Could not read customers, keeping placeholder names: {}", ex.getMessage());
			return;
		}
		for (UnifiedOrderDTO record : records) {
			String name = names.get(record.getCustomerId());
			if (name != null) {
				record.setCustomer(new CustomerSummaryDTO(record.getCustomerId(), name));
			}
		}
	}
}
