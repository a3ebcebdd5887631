package org.hypertrace.core.query.translator;

import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.query.translator.api.ConversionResult;
import org.hypertrace.core.query.translator.api.ParsedQuery;
import org.hypertrace.core.query.translator.api.QueryTranslator;
import org.hypertrace.core.query.translator.classification.QueryTypeClassifier;
import org.hypertrace.core.query.translator.dql.DqlQueryAssembler;
import org.hypertrace.core.query.translator.parse.ClauseExtractor;
import org.hypertrace.core.query.translator.parse.QueryNormalizer;
import org.hypertrace.core.query.translator.validation.QueryValidator;

@Singleton
@Slf4j
class QueryTranslatorImpl implements QueryTranslator {

  private final ClauseExtractor clauseExtractor;
  private final QueryTypeClassifier queryTypeClassifier;
  private final QueryValidator queryValidator;
  private final DqlQueryAssembler dqlQueryAssembler;

  @Inject
  QueryTranslatorImpl(
      ClauseExtractor clauseExtractor,
      QueryTypeClassifier queryTypeClassifier,
      QueryValidator queryValidator,
      DqlQueryAssembler dqlQueryAssembler) {
    this.clauseExtractor = clauseExtractor;
    this.queryTypeClassifier = queryTypeClassifier;
    this.queryValidator = queryValidator;
    this.dqlQueryAssembler = dqlQueryAssembler;
  }

  @Override
  public ConversionResult convert(String query) {
    String normalizedQuery = QueryNormalizer.normalize(query);
    ParsedQuery parsedQuery = clauseExtractor.extract(normalizedQuery);
    if (log.isDebugEnabled()) {
      log.debug("Parsed query: {}", parsedQuery);
    }

    ConversionContext context = new ConversionContext(parsedQuery);
    queryTypeClassifier.classify(context);
    queryValidator.validate(context);
    String convertedQuery = dqlQueryAssembler.assemble(context);

    ConversionResult result =
        ConversionResult.builder()
            .originalQuery(normalizedQuery)
            .convertedQuery(convertedQuery)
            .queryType(context.getQueryType())
            .confidence(
                ConfidenceCalculator.calculate(
                    context.getWarnings().size(), context.getManualReviewItems().size()))
            .warnings(context.getWarnings())
            .manualReviewItems(context.getManualReviewItems())
            .fieldMappingsApplied(context.getFieldMappingsApplied())
            .build();
    if (log.isDebugEnabled()) {
      log.debug("Converted query [{}] to [{}]", normalizedQuery, convertedQuery);
    }
    return result;
  }
}
