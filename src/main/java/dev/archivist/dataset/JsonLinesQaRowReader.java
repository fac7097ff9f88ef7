package dev.archivist.dataset;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

/** Reads a JSON-lines dataset (one {@link QaRow} object per line) with Jackson. */
@Component
public class JsonLinesQaRowReader implements QaRowReader {

  private static final Logger log = LoggerFactory.getLogger(JsonLinesQaRowReader.class);

  private final ObjectReader rowReader;

  public JsonLinesQaRowReader(ObjectMapper objectMapper) {
    this.rowReader = objectMapper.readerFor(QaRow.class);
  }

  @Override
  public List<QaRow> read(Resource location) {
    log.info("Reading dataset from {}", location.getDescription());
    List<QaRow> rows = new ArrayList<>();
    try (InputStream in = location.getInputStream();
        MappingIterator<QaRow> iterator = rowReader.readValues(in)) {
      while (iterator.hasNextValue()) {
        rows.add(iterator.nextValue());
      }
    } catch (IOException e) {
      throw new DatasetReadException(
          "Failed to read dataset " + location.getDescription() + " at row " + (rows.size() + 1),
          e);
    }
    log.info("Dataset loaded: {} rows", rows.size());
    return rows;
  }
}
