package dev.archivist.chunk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.archivist.BaseIntegrationTest;
import dev.archivist.provenance.CopyrightHolderRepository;
import dev.archivist.provenance.SourceRepository;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;

class ChunkSchemaIT extends BaseIntegrationTest {

  @Autowired private ChunkRepository chunkRepository;

  @Autowired private CopyrightHolderRepository copyrightHolderRepository;

  @Autowired private SourceRepository sourceRepository;

  private long storeOneSource(int chunkCount) {
    long holder = copyrightHolderRepository.insert("Acme");
    long source = sourceRepository.insert(holder, "https://acme.example/faq");
    float[] vector = new float[embeddingClient.dimensions()];
    vector[0] = 1f;
    List<EmbeddedChunk> chunks =
        IntStream.range(0, chunkCount)
            .mapToObj(
                i ->
                    new EmbeddedChunk(
                        "chunk " + i,
                        vector,
                        ChunkMetadata.forAnswer("Q", "A", "chunk " + i, "token", i + 1, chunkCount)))
            .toList();
    chunkRepository.insertAll(source, chunks);
    return source;
  }

  @Test
  void embeddingColumnDimensionMatchesConfiguration() {
    assertThat(chunkRepository.embeddingColumnDimensions()).hasValue(1536);
  }

  @Test
  void storesVectorsAndMetadata() {
    long source = storeOneSource(3);

    assertThat(chunkRepository.countBySourceId(source)).isEqualTo(3);
    assertThat(chunkRepository.statistics()).isEqualTo(new StoreStatistics(1, 1, 3));
    assertThat(chunkRepository.sampleEmbedding())
        .hasValueSatisfying(
            sample -> {
              assertThat(sample.dimension()).isEqualTo(1536);
              assertThat(sample.sampleText()).isEqualTo("chunk 0...");
            });
    String method =
        jdbcTemplate.queryForObject(
            "SELECT metadata->'chunk_info'->>'chunk_method' FROM chunks ORDER BY id LIMIT 1",
            String.class);
    assertThat(method).isEqualTo("token");
  }

  @Test
  void deletingHolderCascadesToSourcesAndChunks() {
    storeOneSource(2);

    jdbcTemplate.update("DELETE FROM copyright_holders WHERE name = ?", "Acme");

    assertThat(chunkRepository.statistics()).isEqualTo(new StoreStatistics(0, 0, 0));
  }

  @Test
  void uniqueKeysSurfaceAsDuplicateKeyException() {
    copyrightHolderRepository.insert("Acme");

    assertThatThrownBy(() -> copyrightHolderRepository.insert("Acme"))
        .isInstanceOf(DuplicateKeyException.class);
  }

  @Test
  void emptyStoreHasNoEmbeddingSample() {
    assertThat(chunkRepository.sampleEmbedding()).isEmpty();
  }
}
