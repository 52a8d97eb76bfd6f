package io.clubone.order.baseobject;

import lombok.Data;

@Data
public class Version {
	private String version;
	private Docs docs;
}
