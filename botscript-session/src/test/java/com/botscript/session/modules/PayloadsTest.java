package com.botscript.session.modules;

import com.botscript.runtime.error.ValidationError;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PayloadsTest {

    @Test
    void hex_isDecoded() {
        assertArrayEquals(new byte[]{0x70, 0x69, (byte) 0xff}, Payloads.decode("7069ff", "hex"));
        assertArrayEquals(new byte[]{0x0a}, Payloads.decode("0A", "HEX"));
    }

    @Test
    void base64_isDecoded() {
        assertArrayEquals("ping".getBytes(StandardCharsets.UTF_8), Payloads.decode("cGluZw==", "base64"));
    }

    @Test
    void noFormat_meansUtf8() {
        assertArrayEquals("héllo".getBytes(StandardCharsets.UTF_8), Payloads.decode("héllo", null));
    }

    @Test
    void malformedInput_isAValidationError() {
        assertThrows(ValidationError.class, () -> Payloads.decode("abc", "hex"));
        assertThrows(ValidationError.class, () -> Payloads.decode("!!", "base64"));
        assertThrows(ValidationError.class, () -> Payloads.decode("x", "rot13"));
        assertThrows(ValidationError.class, () -> Payloads.decode(null, "hex"));
    }

    @Test
    void numbers_becomeBytes() {
        assertArrayEquals(new byte[]{1, (byte) 200, -1}, Payloads.fromNumbers(List.of(1, 200, -1)));
        var e = assertThrows(ValidationError.class, () -> Payloads.fromNumbers(List.of(1, 256)));
        assertEquals("$[1]", e.getPath());
    }
}
