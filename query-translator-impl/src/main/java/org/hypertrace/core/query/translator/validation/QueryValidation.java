package org.hypertrace.core.query.translator.validation;

import org.hypertrace.core.query.translator.ConversionContext;

public interface QueryValidation {
  void validate(ConversionContext context);
}
