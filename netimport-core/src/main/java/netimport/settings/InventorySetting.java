package netimport.settings;

import java.util.Objects;

/**
 * Connection details for a source-of-truth inventory (e.g. a Nautobot instance).
 *
 * @param name      lookup key
 * @param address   base URL
 * @param token     API token, may be {@code null} when the inventory needs none
 * @param verifySsl whether TLS certificates are verified
 */
public record InventorySetting(String name, String address, String token, boolean verifySsl) {

  public InventorySetting {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(address, "address");
  }

  @Override
  public String toString() {
    return "InventorySetting[name=" + name + ", address=" + address
        + ", token=" + (token == null ? "null" : ImportConfigGenerator.MASK)
        + ", verifySsl=" + verifySsl + "]";
  }
}
