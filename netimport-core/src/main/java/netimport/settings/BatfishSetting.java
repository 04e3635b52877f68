package netimport.settings;

import java.util.Objects;

/**
 * Batfish service endpoint. Every field except {@code name} is optional; the import
 * library falls back to its own defaults for unset values.
 *
 * @param name    lookup key
 * @param address host or URL, or {@code null}
 * @param portV1  legacy API port, or {@code null}
 * @param portV2  v2 API port, or {@code null}
 * @param useSsl  whether to use TLS, or {@code null}
 */
public record BatfishSetting(String name, String address, Integer portV1, Integer portV2, Boolean useSsl) {

  static final int MIN_PORT = 1024;
  static final int MAX_PORT = 65535;

  public BatfishSetting {
    Objects.requireNonNull(name, "name");
    checkPort("portV1", portV1);
    checkPort("portV2", portV2);
    if (portV1 != null && portV1.equals(portV2)) {
      throw new IllegalArgumentException("portV1 and portV2 must differ");
    }
  }

  private static void checkPort(String field, Integer port) {
    if (port != null && (port < MIN_PORT || port > MAX_PORT)) {
      throw new IllegalArgumentException(
          field + " must be between " + MIN_PORT + " and " + MAX_PORT + ": " + port);
    }
  }
}
