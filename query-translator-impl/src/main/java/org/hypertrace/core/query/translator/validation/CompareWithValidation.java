package org.hypertrace.core.query.translator.validation;

import org.hypertrace.core.query.translator.ConversionContext;

/** DQL has no period-over-period comparison, so a COMPARE WITH clause is never rendered. */
class CompareWithValidation implements QueryValidation {

  @Override
  public void validate(ConversionContext context) {
    context
        .getParsedQuery()
        .getCompareWith()
        .ifPresent(
            compareWith ->
                context.addManualReviewItem(
                    String.format(
                        "COMPARE WITH %s requires manual implementation in DQL", compareWith)));
  }
}
