package io.cronkeeper.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A backup source (app, website or database) known to this instance, addressed by jobs through its id.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SourceConfig(String type, long id, String name, String detailName) {
}
