package io.clubone.order.vo;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RawShippingAddress {
	private String streetAddress;
	private String city;
	private String state;
	private String pinCode;
	private String label;
	private String contactPerson;
	private String contactPhone;
}
