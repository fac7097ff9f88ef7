package dev.archivist.dataset;

/** The dataset could not be opened or one of its records could not be parsed. */
public class DatasetReadException extends RuntimeException {

  public DatasetReadException(String message, Throwable cause) {
    super(message, cause);
  }
}
