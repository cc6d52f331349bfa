package com.botscript.session.database;

import com.botscript.runtime.error.ValidationError;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseParamsTest {

    @ParameterizedTest
    @CsvSource({
            "sqlite3, , , , jdbc:h2:mem:",
            "h2, , , mem:bot, jdbc:h2:mem:bot",
            "postgres, db.local, , bot, jdbc:postgresql://db.local:5432/bot",
            "postgres, db.local, 6543, bot, jdbc:postgresql://db.local:6543/bot",
            "mysql, db.local, , bot, jdbc:mysql://db.local:3306/bot",
            "MySQL, db.local, 3307, bot, jdbc:mysql://db.local:3307/bot"
    })
    void jdbcUrl(String driver, String host, Integer port, String database, String expected) {
        var params = new DatabaseParams(driver, host, port, null, null, database);
        assertEquals(expected, params.jdbcUrl());
    }

    @Test
    void missingDriver_isRejected() {
        assertThrows(ValidationError.class, () -> DatabaseParams.from(Map.of("host", "db.local")));
    }

    @Test
    void nonStringField_isRejected() {
        assertThrows(ValidationError.class, () -> DatabaseParams.from(Map.of("driver", "mysql", "host", 42)));
    }

    @Test
    void portFromText() {
        var params = DatabaseParams.from(Map.of("driver", "postgres", "host", "db", "port", "5433"));
        assertEquals(5433, params.port());
    }

    @Test
    void credentials_andConnectTimeout_areDriverProperties() {
        var params = DatabaseParams.from(Map.of("driver", "postgres", "host", "db",
                "username", "bot", "password", "secret"));
        var props = params.jdbcProperties(10_000);

        assertEquals("bot", props.getProperty("user"));
        assertEquals("secret", props.getProperty("password"));
        assertEquals("10", props.getProperty("connectTimeout"));
    }

    @Test
    void toString_hidesThePassword() {
        var params = DatabaseParams.from(Map.of("driver", "mysql", "host", "db", "password", "secret"));
        assertFalse(params.toString().contains("secret"));
    }
}
