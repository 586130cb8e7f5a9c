package io.fhirrules.core.engine;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A value selected from a record together with its concrete path, e.g.
 * {@code Bundle.entry[0].resource.name[1].family}.
 */
public record PathValue(String path, JsonNode value) {}
