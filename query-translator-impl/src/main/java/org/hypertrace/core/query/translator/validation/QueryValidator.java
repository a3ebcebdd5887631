package org.hypertrace.core.query.translator.validation;

import java.util.Set;
import javax.inject.Inject;
import org.hypertrace.core.query.translator.ConversionContext;

/**
 * Query validator invokes each registered validation against a parsed query. Validations may run
 * in any order. None of them rejects a query: each records its findings as warnings or manual
 * review items on the context.
 */
public class QueryValidator {
  private final Set<QueryValidation> validations;

  @Inject
  QueryValidator(Set<QueryValidation> validations) {
    this.validations = validations;
  }

  public void validate(ConversionContext context) {
    validations.forEach(validation -> validation.validate(context));
  }
}
