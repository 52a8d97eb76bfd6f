package io.clubone.order.dao.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * The backend answers list calls either with a bare array or with an envelope
 * ({@code {"orders": [...]}}, {@code {"data": [...]}}), and update calls with
 * the record itself, an envelope ({@code {"order": {...}}}) or just a message.
 */
public final class BackendPayloadUtils {

	private static final String DATA = "data";

	private static final String ID = "_id";

	private BackendPayloadUtils() {
	}

	public static JsonNode unwrapList(JsonNode body, String envelopeKey) {
		if (body == null || body.isNull() || body.isMissingNode())
			return JsonNodeFactory.instance.arrayNode();
		if (body.isArray())
			return body;
		if (body.isObject()) {
			if (body.path(envelopeKey).isArray())
				return body.get(envelopeKey);
			if (body.path(DATA).isArray())
				return body.get(DATA);
		}
		return JsonNodeFactory.instance.arrayNode();
	}

	/**
	 * @return the record node, or null when the body carries no record
	 */
	public static JsonNode unwrapRecord(JsonNode body, String envelopeKey) {
		if (body == null || !body.isObject())
			return null;
		if (body.path(envelopeKey).isObject())
			return body.get(envelopeKey);
		if (body.hasNonNull(ID))
			return body;
		return null;
	}
}
