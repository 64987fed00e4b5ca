package io.conveyor.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link QueueConfig}.
 * <p>
 * Coverage:
 * - Global configuration (conveyor.properties)
 * - Queue-specific configuration with fallback to global
 * - System property overrides
 * - Type-safe getters and default handling
 * - Error handling (missing keys, invalid formats, bad queue names)
 */
class QueueConfigTest {

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("queue.lock.fair");
        System.clearProperty("pump.join-timeout-ms");
        System.clearProperty("test.property");
    }

    // =========================================================================
    // Global Configuration Tests
    // =========================================================================

    @Test
    void testGlobal_ReturnsGlobalConfig() {
        QueueConfig config = QueueConfig.global();

        assertThat(config.context()).isEqualTo("global");
        assertThat(config.toString()).contains("global");
    }

    @Test
    void testGlobal_ReadsDefaults() {
        QueueConfig config = QueueConfig.global();

        assertThat(config.getBoolean(QueueConfig.LOCK_FAIR)).isFalse();
        assertThat(config.getBoolean(QueueConfig.PUMP_DAEMON)).isTrue();
        assertThat(config.getLong(QueueConfig.PUMP_JOIN_TIMEOUT_MS)).isEqualTo(1000L);
        assertThat(config.getInt(QueueConfig.PUMP_JOIN_TIMEOUT_MS)).isEqualTo(1000);
    }

    @Test
    void testGlobal_KeysListsShippedSettings() {
        assertThat(QueueConfig.global().keys())
            .contains(QueueConfig.LOCK_FAIR, QueueConfig.PUMP_DAEMON, QueueConfig.PUMP_JOIN_TIMEOUT_MS);
    }

    // =========================================================================
    // Queue-specific Configuration Tests
    // =========================================================================

    @Test
    void testForQueue_OverridesGlobal() {
        QueueConfig config = QueueConfig.forQueue("orders");

        assertThat(config.context()).isEqualTo("queue:orders");
        assertThat(config.getBoolean(QueueConfig.LOCK_FAIR)).isTrue();
        assertThat(config.getLong(QueueConfig.PUMP_JOIN_TIMEOUT_MS)).isEqualTo(2500L);
    }

    @Test
    void testForQueue_FallsBackToGlobalForMissingKeys() {
        QueueConfig config = QueueConfig.forQueue("orders");

        assertThat(config.getBoolean(QueueConfig.PUMP_DAEMON)).isTrue();
    }

    @Test
    void testForQueue_WithoutOwnFileUsesGlobal() {
        QueueConfig config = QueueConfig.forQueue("no-such-queue");

        assertThat(config.getBoolean(QueueConfig.LOCK_FAIR)).isFalse();
        assertThat(config.getLong(QueueConfig.PUMP_JOIN_TIMEOUT_MS)).isEqualTo(1000L);
    }

    @Test
    void testForQueue_RejectsBadNames() {
        assertThatThrownBy(() -> QueueConfig.forQueue(null))
            .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> QueueConfig.forQueue("  "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("blank");
    }

    // =========================================================================
    // System Property Override Tests
    // =========================================================================

    @Test
    void testSystemProperty_OverridesQueueFile() {
        System.setProperty("pump.join-timeout-ms", "42");

        assertThat(QueueConfig.forQueue("orders").getLong(QueueConfig.PUMP_JOIN_TIMEOUT_MS)).isEqualTo(42L);
        assertThat(QueueConfig.global().getLong(QueueConfig.PUMP_JOIN_TIMEOUT_MS)).isEqualTo(42L);
    }

    @Test
    void testSystemProperty_MakesUnknownKeyVisible() {
        QueueConfig config = QueueConfig.global();
        assertThat(config.contains("test.property")).isFalse();

        System.setProperty("test.property", "value");

        assertThat(config.contains("test.property")).isTrue();
        assertThat(config.getString("test.property")).isEqualTo("value");
    }

    // =========================================================================
    // Defaults and Error Handling
    // =========================================================================

    @Test
    void testMissingKey_ThrowsConfigurationException() {
        QueueConfig config = QueueConfig.forQueue("orders");

        assertThatThrownBy(() -> config.getString("does.not.exist"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("does.not.exist")
            .hasMessageContaining("queue:orders");
    }

    @Test
    void testMissingKey_ReturnsDefaults() {
        QueueConfig config = QueueConfig.global();

        assertThat(config.getString("does.not.exist", "fallback")).isEqualTo("fallback");
        assertThat(config.getInt("does.not.exist", 7)).isEqualTo(7);
        assertThat(config.getLong("does.not.exist", 9L)).isEqualTo(9L);
        assertThat(config.getBoolean("does.not.exist", true)).isTrue();
    }

    @Test
    void testInvalidFormat_ThrowsConfigurationException() {
        QueueConfig config = QueueConfig.forQueue("broken");

        assertThatThrownBy(() -> config.getLong(QueueConfig.PUMP_JOIN_TIMEOUT_MS))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("soon")
            .hasCauseInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> config.getInt(QueueConfig.PUMP_JOIN_TIMEOUT_MS))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void testInvalidFormat_ReturnsDefaultWhenGiven() {
        QueueConfig config = QueueConfig.forQueue("broken");

        assertThat(config.getLong(QueueConfig.PUMP_JOIN_TIMEOUT_MS, 300L)).isEqualTo(300L);
        assertThat(config.getInt(QueueConfig.PUMP_JOIN_TIMEOUT_MS, 300)).isEqualTo(300);
    }
}
