package io.blockchain.mining.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import io.blockchain.mining.error.ErrorCode;
import io.blockchain.mining.error.MiningException;

import java.util.Iterator;
import java.util.List;

/**
 * Arguments of one call, given either positionally (JSON array) or by name (JSON object).
 */
final class RpcParams {
    private final JsonNode raw;
    private final List<String> names;

    RpcParams(JsonNode raw, List<String> names) {
        this.raw = raw;
        this.names = names;
        if (raw != null && raw.isArray() && raw.size() > names.size()) {
            throw new MiningException(ErrorCode.INVALID_PARAMS,
                    "Too many arguments: expected at most " + names.size() + ", got " + raw.size());
        }
        if (raw != null && raw.isObject()) {
            Iterator<String> it = raw.fieldNames();
            while (it.hasNext()) {
                String name = it.next();
                if (!names.contains(name)) {
                    throw new MiningException(ErrorCode.INVALID_PARAMETER, "Unknown named parameter " + name);
                }
            }
        }
        if (raw != null && !raw.isNull() && !raw.isArray() && !raw.isObject()) {
            throw new MiningException(ErrorCode.INVALID_REQUEST, "Params must be an array or object");
        }
    }

    /** The raw argument, or null when absent or JSON null. */
    JsonNode get(int index) {
        if (raw == null || raw.isNull()) {
            return null;
        }
        JsonNode value = raw.isArray() ? raw.get(index) : raw.get(names.get(index));
        return value == null || value.isNull() ? null : value;
    }

    boolean has(int index) {
        return get(index) != null;
    }

    String requireString(int index) {
        JsonNode v = require(index);
        if (!v.isTextual()) {
            throw typeError(index, "string", v);
        }
        return v.asText();
    }

    long requireLong(int index) {
        JsonNode v = require(index);
        if (!v.isIntegralNumber() || !v.canConvertToLong()) {
            throw typeError(index, "number", v);
        }
        return v.asLong();
    }

    int requireInt(int index) {
        JsonNode v = require(index);
        if (!v.isIntegralNumber() || !v.canConvertToInt()) {
            throw typeError(index, "number", v);
        }
        return v.asInt();
    }

    long optionalLong(int index, long fallback) {
        return has(index) ? requireLong(index) : fallback;
    }

    JsonNode optionalObject(int index) {
        JsonNode v = get(index);
        if (v != null && !v.isObject()) {
            throw typeError(index, "object", v);
        }
        return v;
    }

    private JsonNode require(int index) {
        JsonNode v = get(index);
        if (v == null) {
            throw new MiningException(ErrorCode.INVALID_PARAMS, "Missing required argument '" + names.get(index) + "'");
        }
        return v;
    }

    private MiningException typeError(int index, String expected, JsonNode actual) {
        return new MiningException(ErrorCode.TYPE_ERROR, "Expected type " + expected + " for "
                + names.get(index) + ", got " + actual.getNodeType().name().toLowerCase());
    }
}
