package dev.archivist.chunk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgvector.PGvector;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

/**
 * JDBC access to the {@code chunks} table.
 *
 * <p>Inserts run on the connection bound to the caller's transaction, so chunks staged by a row
 * become durable only when the surrounding batch commits.
 */
@Repository
public class ChunkRepository {

  private static final String INSERT_SQL =
      """
      INSERT INTO chunks (source_id, content, embedding, metadata)
      VALUES (?, ?, ?, CAST(? AS jsonb))
      """;

  private final JdbcTemplate jdbcTemplate;
  private final JdbcClient jdbcClient;
  private final ObjectMapper objectMapper;

  public ChunkRepository(
      JdbcTemplate jdbcTemplate, JdbcClient jdbcClient, ObjectMapper objectMapper) {
    this.jdbcTemplate = jdbcTemplate;
    this.jdbcClient = jdbcClient;
    this.objectMapper = objectMapper;
  }

  /**
   * Inserts all chunks of one source in a single JDBC batch.
   *
   * @param sourceId the owning source
   * @param chunks the chunks to insert, in order
   */
  public void insertAll(long sourceId, List<EmbeddedChunk> chunks) {
    if (chunks.isEmpty()) {
      return;
    }
    jdbcTemplate.batchUpdate(
        INSERT_SQL,
        new BatchPreparedStatementSetter() {
          @Override
          public void setValues(PreparedStatement ps, int i) throws SQLException {
            EmbeddedChunk chunk = chunks.get(i);
            ps.setLong(1, sourceId);
            ps.setString(2, chunk.content());
            ps.setObject(3, new PGvector(chunk.embedding()));
            ps.setString(4, toJson(chunk.metadata()));
          }

          @Override
          public int getBatchSize() {
            return chunks.size();
          }
        });
  }

  public long countBySourceId(long sourceId) {
    return jdbcClient
        .sql("SELECT COUNT(*) FROM chunks WHERE source_id = :sourceId")
        .param("sourceId", sourceId)
        .query(Long.class)
        .single();
  }

  /** Counts rows in each provenance table. */
  public StoreStatistics statistics() {
    return jdbcClient
        .sql(
            """
            SELECT (SELECT COUNT(*) FROM copyright_holders) AS holders,
                   (SELECT COUNT(*) FROM sources) AS sources,
                   (SELECT COUNT(*) FROM chunks) AS chunks
            """)
        .query(
            (rs, rowNum) ->
                new StoreStatistics(rs.getLong("holders"), rs.getLong("sources"), rs.getLong("chunks")))
        .single();
  }

  /**
   * Returns the stored dimension and a content preview of one chunk.
   *
   * @return a sample, or empty if no chunk has been stored
   */
  public Optional<EmbeddingSample> sampleEmbedding() {
    return jdbcClient
        .sql(
            """
            SELECT vector_dims(embedding) AS dims, content
            FROM chunks
            WHERE embedding IS NOT NULL
            ORDER BY id
            LIMIT 1
            """)
        .query(
            (rs, rowNum) -> new EmbeddingSample(rs.getInt("dims"), preview(rs.getString("content"))))
        .optional();
  }

  /**
   * Reads the declared dimension of {@code chunks.embedding}.
   *
   * @return the dimension, or empty if the table is missing or the column has no fixed dimension
   */
  public OptionalInt embeddingColumnDimensions() {
    return jdbcClient
        .sql(
            """
            SELECT atttypmod
            FROM pg_attribute
            WHERE attrelid = to_regclass('chunks')
              AND attname = 'embedding'
              AND NOT attisdropped
            """)
        .query(Integer.class)
        .optional()
        .filter(dimensions -> dimensions > 0)
        .map(OptionalInt::of)
        .orElse(OptionalInt.empty());
  }

  private String toJson(ChunkMetadata metadata) {
    try {
      return objectMapper.writeValueAsString(metadata);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize chunk metadata", e);
    }
  }

  static String preview(String content) {
    int codePoints = content.codePointCount(0, content.length());
    return content.substring(0, content.offsetByCodePoints(0, Math.min(100, codePoints))) + "...";
  }
}
