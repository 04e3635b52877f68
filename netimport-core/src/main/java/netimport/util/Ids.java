package netimport.util;

import com.github.f4b6a3.ulid.UlidCreator;

/**
 * Identifier generation.
 */
public final class Ids {

  private Ids() {}

  /** Time-ordered, lexicographically sortable job id. */
  public static String newJobId() {
    return UlidCreator.getMonotonicUlid().toString();
  }

  /** Opaque transport task id. */
  public static String newTaskId() {
    return UlidCreator.getUlid().toString();
  }
}
