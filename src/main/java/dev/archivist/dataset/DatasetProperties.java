package dev.archivist.dataset;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.io.Resource;
import org.springframework.validation.annotation.Validated;

/**
 * Dataset settings bound from {@code archivist.dataset.*}.
 *
 * @param location JSON-lines resource; {@code file:}, {@code classpath:} and {@code https:}
 *     locations are supported
 */
@Validated
@ConfigurationProperties(prefix = "archivist.dataset")
public record DatasetProperties(@NotNull Resource location) {}
