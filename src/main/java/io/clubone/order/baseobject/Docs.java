package io.clubone.order.baseobject;

import lombok.Data;

@Data
public class Docs {
	private String status;
	private String url;
}
