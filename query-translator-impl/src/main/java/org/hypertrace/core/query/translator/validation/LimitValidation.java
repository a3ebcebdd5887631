package org.hypertrace.core.query.translator.validation;

import javax.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.query.translator.ConversionContext;
import org.hypertrace.core.query.translator.QueryTranslatorConfig;
import org.hypertrace.core.query.translator.QueryTranslatorConfig.LimitValidationConfig;

@Slf4j
class LimitValidation implements QueryValidation {

  LimitValidationConfig config;

  @Inject
  LimitValidation(QueryTranslatorConfig queryTranslatorConfig) {
    this.config = queryTranslatorConfig.getLimitValidationConfig();
  }

  @Override
  public void validate(ConversionContext context) {
    switch (config.getMode()) {
      case WARN:
        context
            .getParsedQuery()
            .getLimit()
            .filter(this::isInvalidLimit)
            .ifPresent(
                limit -> {
                  String message = generateWarningForLimit(limit);
                  log.debug("{}. Translating anyway due to warn mode.", message);
                  context.addWarning(message);
                });
        break;
      case DISABLED:
      default:
        break;
    }
  }

  private String generateWarningForLimit(int limit) {
    return String.format(
        "Received query limit of %s outside supported range [%s, %s]",
        limit, config.getMin(), config.getMax());
  }

  private boolean isInvalidLimit(int limit) {
    return limit < config.getMin() || limit > config.getMax();
  }
}
