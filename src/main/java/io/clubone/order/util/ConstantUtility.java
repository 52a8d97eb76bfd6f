package io.clubone.order.util;

public class ConstantUtility {

	public static final String DEFAULT_CURRENCY = "INR";

	public static final String GUEST_CUSTOMER = "Guest";

	public static final String CUSTOMER_LOADING = "Loading…";

	public static final String ORDER_NUMBER_PREFIX = "ORD-";

	public static final String QUOTATION_NUMBER_PREFIX = "QUO-";

	public static final int DERIVED_NUMBER_LENGTH = 8;

	public static final String LOOKUP_FAILED = "state changed but could not confirm";

	public static final String INVALID_INPUT = "Invalid input: Please check your data.";

}
