package dev.archivist.dataset;

import java.util.List;
import org.springframework.core.io.Resource;

/** Produces the ordered row sequence the ingestion pipeline consumes. */
public interface QaRowReader {

  /**
   * Reads every row of a dataset.
   *
   * @param location the dataset resource
   * @return rows in dataset order
   * @throws DatasetReadException if the resource cannot be read or parsed
   */
  List<QaRow> read(Resource location);
}
