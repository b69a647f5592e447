package io.marketlens.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

public class EnvTest {

    private static final String KEY = "MARKETLENS_ENV_TEST_VALUE";

    @AfterEach
    public void tearDown() {
        System.clearProperty(KEY);
    }

    @Test
    public void testSystemPropertyFallback() {
        assertEquals("fallback", Env.get(KEY, "fallback"));

        System.setProperty(KEY, "4200");
        assertEquals("4200", Env.get(KEY, "fallback"));
        assertEquals(4200, Env.getInt(KEY, 1));
        assertEquals(4200L, Env.getLong(KEY, 1L));
        assertEquals(Duration.ofMillis(4200), Env.getMillis(KEY, 1L));
    }

    @Test
    public void testMalformedNumbersUseDefault() {
        System.setProperty(KEY, "five seconds");

        assertEquals(9190, Env.getInt(KEY, 9190));
        assertEquals(Duration.ofMillis(5000), Env.getMillis(KEY, 5000L));
    }

    @Test
    public void testNonPositiveMillisUseDefault() {
        System.setProperty(KEY, "0");

        assertEquals(Duration.ofMillis(5000), Env.getMillis(KEY, 5000L));
    }

    @Test
    public void testBooleans() {
        System.setProperty(KEY, "1");
        assertTrue(Env.getBool(KEY, false));

        System.setProperty(KEY, "no");
        assertFalse(Env.getBool(KEY, true));
    }
}
