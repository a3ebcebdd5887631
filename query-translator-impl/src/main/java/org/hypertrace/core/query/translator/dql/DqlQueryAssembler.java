package org.hypertrace.core.query.translator.dql;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import javax.inject.Inject;
import org.hypertrace.core.query.translator.ConversionContext;

/**
 * Joins the fragments of every registered {@link DqlClauseBuilder} into a DQL pipeline: fetch,
 * filter, summarize, sort and limit, in that order, one stage per line.
 */
public class DqlQueryAssembler {
  static final String PIPE_SEPARATOR = "\n| ";

  private final List<DqlClauseBuilder> clauseBuilders;

  @Inject
  DqlQueryAssembler(Set<DqlClauseBuilder> clauseBuilders) {
    this.clauseBuilders = clauseBuilders.stream().sorted().collect(Collectors.toUnmodifiableList());
  }

  public String assemble(ConversionContext context) {
    return clauseBuilders.stream()
        .map(clauseBuilder -> clauseBuilder.build(context))
        .flatMap(Optional::stream)
        .collect(Collectors.joining(PIPE_SEPARATOR));
  }
}
