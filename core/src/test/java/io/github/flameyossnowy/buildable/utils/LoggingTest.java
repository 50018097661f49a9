package io.github.flameyossnowy.buildable.utils;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Core has no SLF4J binding on its test classpath, so these run through the java.util.logging fallback.
 */
class LoggingTest {
    private final List<LogRecord> records = new CopyOnWriteArrayList<>();
    private final Handler handler = new Handler() {
        @Override
        public void publish(LogRecord record) {
            records.add(record);
        }

        @Override
        public void flush() {}

        @Override
        public void close() {}
    };

    private Logger logger;

    @BeforeEach
    void setUp() {
        logger = Logger.getLogger("buildable");
        logger.addHandler(handler);
        Logging.ENABLED = false;
        Logging.DEEP = false;
    }

    @AfterEach
    void tearDown() {
        logger.removeHandler(handler);
        Logging.ENABLED = false;
        Logging.DEEP = false;
    }

    @Test
    void infoIsSilentUntilEnabled() {
        Logging.info("hidden");
        assertTrue(records.isEmpty());

        Logging.ENABLED = true;
        Logging.info("shown");

        assertEquals(1, records.size());
        assertEquals(Level.INFO, records.get(0).getLevel());
        assertEquals("shown", records.get(0).getMessage());
    }

    @Test
    void deepInfoNeedsDeepFlag() {
        Logging.ENABLED = true;
        Logging.deepInfo("U32", 31);
        assertTrue(records.isEmpty());

        Logging.DEEP = true;
        Logging.deepInfo("U32", 31);

        assertEquals(1, records.size());
        assertEquals("Produced U32 = 31", records.get(0).getMessage());
    }

    @Test
    void errorIsLoggedEvenWhenDisabled() {
        IllegalStateException cause = new IllegalStateException("boom");

        Logging.error("Failed to produce a value", cause);

        assertEquals(1, records.size());
        assertEquals(Level.SEVERE, records.get(0).getLevel());
        assertSame(cause, records.get(0).getThrown());
    }
}
