package org.hypertrace.core.query.translator.validation;

import org.hypertrace.core.query.translator.ConversionContext;

class SelectClauseValidation implements QueryValidation {
  static final String MISSING_SELECT_WARNING = "No SELECT clause found";

  @Override
  public void validate(ConversionContext context) {
    if (context.getParsedQuery().getSelect().isEmpty()) {
      context.addWarning(MISSING_SELECT_WARNING);
    }
  }
}
