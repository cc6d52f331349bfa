package com.botscript.session.modules;

import com.botscript.runtime.error.ValidationError;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;

/**
 * Conversion of script-supplied write payloads to bytes.
 */
final class Payloads {

    private Payloads() {
    }

    /**
     * {@code format} is {@code hex}, {@code base64} or null for UTF-8 text.
     *
     * @throws ValidationError on an unknown format or undecodable input
     */
    static byte[] decode(String data, String format) {
        if (data == null) {
            throw new ValidationError("write data is required");
        }
        if (format == null || format.isEmpty()) {
            return data.getBytes(StandardCharsets.UTF_8);
        }
        try {
            return switch (format.toLowerCase(Locale.ROOT)) {
                case "hex" -> HexFormat.of().parseHex(data);
                case "base64" -> Base64.getDecoder().decode(data);
                default -> throw new ValidationError("unknown write format: " + format);
            };
        } catch (IllegalArgumentException e) {
            throw new ValidationError("invalid " + format + " data: " + e.getMessage());
        }
    }

    /** Byte values 0..255 (or -128..127) as bytes. */
    static byte[] fromNumbers(List<? extends Number> values) {
        byte[] bytes = new byte[values.size()];
        for (int i = 0; i < bytes.length; i++) {
            Number n = values.get(i);
            if (n == null || n.intValue() < -128 || n.intValue() > 255) {
                throw new ValidationError("byte value out of range", "$[" + i + "]");
            }
            bytes[i] = (byte) n.intValue();
        }
        return bytes;
    }
}
