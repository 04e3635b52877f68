package netimport.jdbc;

import org.junit.jupiter.api.Test;

import java.sql.Connection;

import static org.junit.jupiter.api.Assertions.*;

class DataSourceConnectionProviderTest {

  @Test
  void delegatesToDataSource() throws Exception {
    DataSourceConnectionProvider provider = new DataSourceConnectionProvider(Schemas.h2());
    try (Connection conn = provider.getConnection()) {
      assertTrue(conn.isValid(1));
    }
  }

  @Test
  void rejectsNullDataSource() {
    assertThrows(NullPointerException.class, () -> new DataSourceConnectionProvider(null));
  }
}
