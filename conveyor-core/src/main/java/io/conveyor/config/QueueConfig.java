package io.conveyor.config;

import java.util.*;

/**
 * Hierarchical queue configuration using ResourceBundle (zero dependencies).
 *
 * <p>Lookup order for every key:
 * <ol>
 *   <li>System property ({@code -Dqueue.lock.fair=true})</li>
 *   <li>conveyor_{queue}.properties (queue-specific, optional)</li>
 *   <li>conveyor.properties (global defaults, shipped with the library)</li>
 * </ol>
 *
 * <p><strong>Example Property Files:</strong>
 * <pre>
 * # conveyor.properties (global defaults)
 * queue.lock.fair=false
 * pump.join-timeout-ms=1000
 *
 * # conveyor_orders.properties (override for the "orders" queue)
 * queue.lock.fair=true
 * </pre>
 *
 * <p><strong>Usage:</strong>
 * <pre>
 * QueueConfig orders = QueueConfig.forQueue("orders");
 * boolean fair = orders.getBoolean("queue.lock.fair");
 * // → true (from conveyor_orders.properties)
 * </pre>
 */
public class QueueConfig {

  /** Fairness of the queue lock. */
  public static final String LOCK_FAIR = "queue.lock.fair";
  /** Whether pump worker threads are daemon threads. */
  public static final String PUMP_DAEMON = "pump.thread.daemon";
  /** How long closing a pump waits for its worker thread, in milliseconds. */
  public static final String PUMP_JOIN_TIMEOUT_MS = "pump.join-timeout-ms";

  static final String BASE_NAME = "conveyor";

  private static final ResourceBundle.Control NO_FALLBACK =
    ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES);

  private final ResourceBundle specific;  // null when the queue has no own file
  private final ResourceBundle global;
  private final String context;

  private QueueConfig(ResourceBundle specific, ResourceBundle global, String context) {
    this.specific = specific;
    this.global = global;
    this.context = context;
  }

  /**
   * Get global configuration (conveyor.properties).
   *
   * @return Global configuration
   * @throws ConfigurationException if conveyor.properties is not on the classpath
   */
  public static QueueConfig global() {
    return new QueueConfig(null, loadGlobal(), "global");
  }

  /**
   * Get queue-specific configuration.
   *
   * <p>Falls back to the global configuration for every key the queue file does not define, and
   * entirely when there is no conveyor_{queueName}.properties.
   *
   * @param queueName Queue name (e.g., "orders", "audit")
   * @return Queue-specific configuration
   */
  public static QueueConfig forQueue(String queueName) {
    Objects.requireNonNull(queueName, "queueName cannot be null");
    if (queueName.isBlank()) {
      throw new IllegalArgumentException("queueName cannot be blank");
    }

    ResourceBundle specific;
    try {
      specific = ResourceBundle.getBundle(BASE_NAME + "_" + queueName, Locale.ROOT, NO_FALLBACK);
    } catch (MissingResourceException e) {
      specific = null;
    }
    return new QueueConfig(specific, loadGlobal(), "queue:" + queueName);
  }

  private static ResourceBundle loadGlobal() {
    try {
      return ResourceBundle.getBundle(BASE_NAME, Locale.ROOT, NO_FALLBACK);
    } catch (MissingResourceException e) {
      throw new ConfigurationException("Missing " + BASE_NAME + ".properties on the classpath", e);
    }
  }

  // =========================================================================
  // Type-safe getters with system property override support
  // =========================================================================

  /**
   * Get string value.
   *
   * @param key Property key
   * @return Property value
   * @throws ConfigurationException if key not found
   */
  public String getString(String key) {
    String value = lookup(key);
    if (value == null) {
      throw new ConfigurationException("Missing config key '" + key + "' in context: " + context);
    }
    return value;
  }

  /**
   * Get string value with default.
   *
   * @param key Property key
   * @param defaultValue Default if not found
   * @return Property value or default
   */
  public String getString(String key, String defaultValue) {
    String value = lookup(key);
    return value != null ? value : defaultValue;
  }

  /**
   * Get int value.
   *
   * @param key Property key
   * @return Property value as int
   * @throws ConfigurationException if key not found or invalid format
   */
  public int getInt(String key) {
    String value = getString(key);
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException(
        "Invalid int value for key '" + key + "': " + value, e
      );
    }
  }

  /**
   * Get int value with default.
   *
   * @param key Property key
   * @param defaultValue Default if not found or malformed
   * @return Property value as int or default
   */
  public int getInt(String key, int defaultValue) {
    String value = lookup(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }

  /**
   * Get long value.
   *
   * @param key Property key
   * @return Property value as long
   * @throws ConfigurationException if key not found or invalid format
   */
  public long getLong(String key) {
    String value = getString(key);
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new ConfigurationException(
        "Invalid long value for key '" + key + "': " + value, e
      );
    }
  }

  /**
   * Get long value with default.
   *
   * @param key Property key
   * @param defaultValue Default if not found or malformed
   * @return Property value as long or default
   */
  public long getLong(String key, long defaultValue) {
    String value = lookup(key);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      return defaultValue;
    }
  }

  /**
   * Get boolean value.
   *
   * @param key Property key
   * @return Property value as boolean
   * @throws ConfigurationException if key not found
   */
  public boolean getBoolean(String key) {
    return Boolean.parseBoolean(getString(key).trim());
  }

  /**
   * Get boolean value with default.
   *
   * @param key Property key
   * @param defaultValue Default if not found
   * @return Property value as boolean or default
   */
  public boolean getBoolean(String key, boolean defaultValue) {
    String value = lookup(key);
    return value != null ? Boolean.parseBoolean(value.trim()) : defaultValue;
  }

  /**
   * Check if key exists at any level.
   *
   * @param key Property key
   * @return true if key exists
   */
  public boolean contains(String key) {
    return lookup(key) != null;
  }

  /**
   * Get all keys defined by the property files (system properties excluded).
   *
   * @return Set of all keys
   */
  public Set<String> keys() {
    Set<String> keys = new TreeSet<>(global.keySet());
    if (specific != null) {
      keys.addAll(specific.keySet());
    }
    return keys;
  }

  /**
   * Get configuration context (for debugging).
   *
   * @return Context description (e.g., "global", "queue:orders")
   */
  public String context() {
    return context;
  }

  private String lookup(String key) {
    Objects.requireNonNull(key, "key cannot be null");
    String sysProp = System.getProperty(key);
    if (sysProp != null) {
      return sysProp;
    }
    if (specific != null && specific.containsKey(key)) {
      return specific.getString(key);
    }
    if (global.containsKey(key)) {
      return global.getString(key);
    }
    return null;
  }

  @Override
  public String toString() {
    return "QueueConfig[context=" + context + "]";
  }
}
