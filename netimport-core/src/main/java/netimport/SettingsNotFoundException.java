package netimport;

/**
 * Thrown by a {@link netimport.spi.SettingsResolver} when a named inventory,
 * credential or Batfish setting is not registered.
 */
public final class SettingsNotFoundException extends RuntimeException {
  private final String kind;
  private final String name;

  public SettingsNotFoundException(String kind, String name) {
    super("No " + kind + " setting named '" + name + "'");
    this.kind = kind;
    this.name = name;
  }

  public String kind() {
    return kind;
  }

  public String name() {
    return name;
  }
}
