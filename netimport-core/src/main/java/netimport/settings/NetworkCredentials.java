package netimport.settings;

import java.util.Objects;

/**
 * Login used to reach network devices.
 */
public record NetworkCredentials(String name, String login, String password) {

  public NetworkCredentials {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(login, "login");
    Objects.requireNonNull(password, "password");
  }

  @Override
  public String toString() {
    return "NetworkCredentials[name=" + name + ", login=" + login
        + ", password=" + ImportConfigGenerator.MASK + "]";
  }
}
