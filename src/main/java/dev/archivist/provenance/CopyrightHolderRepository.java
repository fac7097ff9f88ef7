package dev.archivist.provenance;

import java.util.Optional;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

/** JDBC access to {@code copyright_holders}, keyed by the unique holder name. */
@Repository
public class CopyrightHolderRepository {

  private final JdbcClient jdbcClient;

  public CopyrightHolderRepository(JdbcClient jdbcClient) {
    this.jdbcClient = jdbcClient;
  }

  public Optional<Long> findIdByName(String name) {
    return jdbcClient
        .sql("SELECT id FROM copyright_holders WHERE name = :name")
        .param("name", name)
        .query(Long.class)
        .optional();
  }

  /**
   * Inserts a new holder.
   *
   * @return the generated id
   * @throws org.springframework.dao.DuplicateKeyException if the name already exists
   */
  public long insert(String name) {
    return jdbcClient
        .sql("INSERT INTO copyright_holders (name) VALUES (:name) RETURNING id")
        .param("name", name)
        .query(Long.class)
        .single();
  }

  public long count() {
    return jdbcClient.sql("SELECT COUNT(*) FROM copyright_holders").query(Long.class).single();
  }
}
