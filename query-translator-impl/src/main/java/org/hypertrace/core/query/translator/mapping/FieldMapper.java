package org.hypertrace.core.query.translator.mapping;

import java.util.Optional;
import javax.inject.Inject;
import org.hypertrace.core.query.translator.ConversionContext;

/**
 * Maps NRQL attribute names to DQL field names. Unknown attributes are usually custom ones, so
 * they pass through unchanged and without a warning.
 */
public class FieldMapper {
  private final MappingTables mappingTables;

  @Inject
  public FieldMapper(MappingTables mappingTables) {
    this.mappingTables = mappingTables;
  }

  public String mapField(String field, ConversionContext context) {
    String trimmed = field.trim();
    Optional<String> target = mappingTables.findFieldMapping(trimmed);
    target.ifPresent(targetField -> context.recordFieldMapping(trimmed, targetField));
    return target.orElse(trimmed);
  }
}
