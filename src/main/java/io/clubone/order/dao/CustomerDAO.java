package io.clubone.order.dao;

import java.util.List;

import io.clubone.order.vo.RawCustomer;

public interface CustomerDAO {

	List<RawCustomer> fetchCustomers();
}
