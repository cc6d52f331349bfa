package com.botscript.session.socket;

import com.botscript.runtime.error.ValidationError;

import java.util.Map;

/**
 * Target of a stream socket connection.
 */
public record SocketParams(String host, int port) {

    public SocketParams {
        if (host == null || host.isBlank()) {
            throw new ValidationError("socket host is required");
        }
        if (port < 1 || port > 65535) {
            throw new ValidationError("socket port must be between 1 and 65535, got " + port);
        }
    }

    /**
     * Read {@code host} and {@code port} from script-supplied parameters.
     *
     * @throws ValidationError if either is missing or malformed
     */
    public static SocketParams from(Map<String, ?> params) {
        if (params == null) {
            throw new ValidationError("socket parameters are required");
        }
        Object host = params.get("host");
        if (!(host instanceof String hostName)) {
            throw new ValidationError("socket host is required");
        }
        return new SocketParams(hostName, portOf(params.get("port")));
    }

    static int portOf(Object port) {
        if (port instanceof Integer || port instanceof Long || port instanceof Short) {
            long value = ((Number) port).longValue();
            return value < 1 || value > 65535 ? -1 : (int) value;
        }
        if (port instanceof String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                throw new ValidationError("socket port is not a number: " + text);
            }
        }
        throw new ValidationError("socket port is required");
    }
}
