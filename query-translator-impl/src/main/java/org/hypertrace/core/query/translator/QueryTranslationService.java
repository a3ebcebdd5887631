package org.hypertrace.core.query.translator;

import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import lombok.extern.slf4j.Slf4j;
import org.hypertrace.core.query.translator.api.ConversionResult;
import org.hypertrace.core.query.translator.api.QueryTranslator;

/**
 * Asynchronous front of the {@link QueryTranslator}. Batches are translated concurrently on the
 * given scheduler while results keep the order of the submitted queries.
 */
@Singleton
@Slf4j
public class QueryTranslationService {
  private static final int PREFETCH = 1;

  private final QueryTranslator queryTranslator;
  private final Scheduler scheduler;
  private final int maxConcurrency;

  @Inject
  QueryTranslationService(QueryTranslator queryTranslator, QueryTranslatorConfig config) {
    this(queryTranslator, Schedulers.computation(), config.getBatchMaxConcurrency());
  }

  QueryTranslationService(
      QueryTranslator queryTranslator, Scheduler scheduler, int maxConcurrency) {
    this.queryTranslator = queryTranslator;
    this.scheduler = scheduler;
    this.maxConcurrency = maxConcurrency;
  }

  public Single<ConversionResult> translate(String query) {
    return Single.fromCallable(() -> queryTranslator.convert(query))
        .subscribeOn(scheduler)
        .doOnError(error -> log.error("Query translation failed: {}", query, error));
  }

  public Single<List<ConversionResult>> translateAll(List<String> queries) {
    return Observable.fromIterable(queries)
        .concatMapEager(query -> translate(query).toObservable(), maxConcurrency, PREFETCH)
        .toList();
  }
}
