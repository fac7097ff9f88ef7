package dev.archivist.provenance;

import java.util.Optional;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

/** JDBC access to {@code sources}, keyed by the unique source URL. */
@Repository
public class SourceRepository {

  private final JdbcClient jdbcClient;

  public SourceRepository(JdbcClient jdbcClient) {
    this.jdbcClient = jdbcClient;
  }

  public Optional<Long> findIdByUrl(String url) {
    return jdbcClient
        .sql("SELECT id FROM sources WHERE url = :url")
        .param("url", url)
        .query(Long.class)
        .optional();
  }

  /**
   * Inserts a new source owned by the given copyright holder.
   *
   * @return the generated id
   * @throws org.springframework.dao.DuplicateKeyException if the URL already exists
   */
  public long insert(long copyrightHolderId, String url) {
    return jdbcClient
        .sql(
            """
            INSERT INTO sources (copyright_holder_id, url)
            VALUES (:holderId, :url)
            RETURNING id
            """)
        .param("holderId", copyrightHolderId)
        .param("url", url)
        .query(Long.class)
        .single();
  }

  public long count() {
    return jdbcClient.sql("SELECT COUNT(*) FROM sources").query(Long.class).single();
  }
}
