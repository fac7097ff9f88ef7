package dev.archivist.dataset;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * One question/answer record of the source dataset.
 *
 * <p>The published dataset capitalizes {@code Question} and {@code Answer}; both spellings are
 * accepted.
 *
 * @param copyright name of the copyright holder
 * @param url page the record was taken from
 * @param question the question text, embedded whole
 * @param answer the answer text, chunked before embedding (may be empty)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QaRow(
    @NotBlank String copyright,
    @NotBlank String url,
    @NotBlank @JsonProperty("question") @JsonAlias("Question") String question,
    @NotNull @JsonProperty("answer") @JsonAlias("Answer") String answer) {}
