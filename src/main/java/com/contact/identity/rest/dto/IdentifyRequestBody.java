package com.contact.identity.rest.dto;

import com.contact.identity.api.IdentifyRequest;
import com.contact.identity.api.InvalidRequestException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Parses the {@code POST /identify} body. Each field may be missing, null or a
 * string; any other JSON type is rejected rather than coerced.
 */
public final class IdentifyRequestBody {

    private IdentifyRequestBody() {
    }

    /**
     * @throws InvalidRequestException if the body is not an object, a field has the
     *                                 wrong type, or no identifier is supplied
     */
    public static IdentifyRequest from(JsonNode body) {
        if (body == null || body.isNull() || body.isMissingNode()) {
            throw new InvalidRequestException("Request body is required");
        }
        if (!body.isObject()) {
            throw new InvalidRequestException("Request body must be a JSON object");
        }
        return IdentifyRequest.of(text(body, "email"), text(body, "phoneNumber")).validate();
    }

    private static String text(JsonNode body, String field) {
        JsonNode value = body.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new InvalidRequestException(field + " must be a string");
        }
        return value.asText();
    }
}
