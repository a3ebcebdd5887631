package org.hypertrace.core.query.translator;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigValue;
import com.typesafe.config.ConfigValueType;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import lombok.Value;
import lombok.experimental.NonFinal;
import org.hypertrace.core.query.translator.api.QueryType;
import org.hypertrace.core.query.translator.mapping.EventTypeMapping;
import org.hypertrace.core.query.translator.mapping.MappingTables;

@Value
@NonFinal
public class QueryTranslatorConfig {

  private static final String CONFIG_PATH_FIELD_MAPPINGS = "mappings.fields";
  private static final String CONFIG_PATH_AGGREGATION_FUNCTIONS = "mappings.aggregationFunctions";
  private static final String CONFIG_PATH_EVENT_TYPES = "mappings.eventTypes";
  private static final String CONFIG_PATH_TIME_PHRASES = "mappings.timePhrases";
  private static final String CONFIG_PATH_LIMIT_VALIDATION = "validation.limit";
  private static final String CONFIG_PATH_BATCH_MAX_CONCURRENCY = "batch.maxConcurrency";

  private static final String CONFIG_PATH_EVENT_TYPE_DOMAIN = "domain";
  private static final String CONFIG_PATH_EVENT_TYPE_METRIC_KEY = "metricKey";

  MappingTables mappingTables;
  LimitValidationConfig limitValidationConfig;
  int batchMaxConcurrency;

  QueryTranslatorConfig(Config config) {
    Config resolved = config.resolve();
    this.mappingTables = buildMappingTables(resolved);
    this.limitValidationConfig =
        new LimitValidationConfig(resolved.getConfig(CONFIG_PATH_LIMIT_VALIDATION));
    this.batchMaxConcurrency = resolved.getInt(CONFIG_PATH_BATCH_MAX_CONCURRENCY);
  }

  private static MappingTables buildMappingTables(Config config) {
    MappingTables.MappingTablesBuilder builder = MappingTables.builder();

    readTable(config, CONFIG_PATH_FIELD_MAPPINGS)
        .forEach((field, value) -> builder.fieldMapping(field, readString(value, field)));

    // a null entry marks a function without DQL equivalent
    readTable(config, CONFIG_PATH_AGGREGATION_FUNCTIONS)
        .forEach(
            (function, value) -> {
              if (value.valueType() == ConfigValueType.NULL) {
                builder.unsupportedAggregationFunction(function);
              } else {
                builder.aggregationFunction(function, readString(value, function));
              }
            });

    readTable(config, CONFIG_PATH_EVENT_TYPES)
        .forEach(
            (eventType, value) -> builder.eventType(eventType, readEventType(eventType, value)));

    Map<String, String> timePhrases = new TreeMap<>();
    readTable(config, CONFIG_PATH_TIME_PHRASES)
        .forEach(
            (phrase, value) ->
                timePhrases.putIfAbsent(
                    phrase.toLowerCase(Locale.ROOT), readString(value, phrase)));
    builder.timePhrases(timePhrases);

    return builder.build();
  }

  /**
   * Reads a table through its object view, which keeps keys unquoted and retains null entries.
   * Keys come back sorted so that lookups are deterministic.
   */
  private static Map<String, ConfigValue> readTable(Config config, String path) {
    ConfigObject table = config.getConfig(path).root();
    return new TreeMap<>(table);
  }

  private static String readString(ConfigValue value, String key) {
    if (value.valueType() != ConfigValueType.STRING) {
      throw new ConfigException.WrongType(
          value.origin(), key, ConfigValueType.STRING.name(), value.valueType().name());
    }
    return (String) value.unwrapped();
  }

  private static EventTypeMapping readEventType(String eventType, ConfigValue value) {
    if (value.valueType() != ConfigValueType.OBJECT) {
      throw new ConfigException.WrongType(
          value.origin(), eventType, ConfigValueType.OBJECT.name(), value.valueType().name());
    }
    Config mapping = ((ConfigObject) value).toConfig();
    QueryType domain = mapping.getEnum(QueryType.class, CONFIG_PATH_EVENT_TYPE_DOMAIN);
    return mapping.hasPath(CONFIG_PATH_EVENT_TYPE_METRIC_KEY)
        ? EventTypeMapping.of(domain, mapping.getString(CONFIG_PATH_EVENT_TYPE_METRIC_KEY))
        : EventTypeMapping.of(domain);
  }

  @Value
  @NonFinal
  public static class LimitValidationConfig {
    private static final String CONFIG_PATH_MIN = "min";
    private static final String CONFIG_PATH_MAX = "max";
    private static final String CONFIG_PATH_MODE = "mode";
    int min;
    int max;
    LimitValidationMode mode;

    private LimitValidationConfig(Config config) {
      this.min = config.getInt(CONFIG_PATH_MIN);
      this.max = config.getInt(CONFIG_PATH_MAX);
      this.mode = config.getEnum(LimitValidationMode.class, CONFIG_PATH_MODE);
    }

    public enum LimitValidationMode {
      DISABLED,
      WARN
    }
  }
}
