package org.hypertrace.core.query.translator.dql;

import java.util.Optional;
import org.hypertrace.core.query.translator.ConversionContext;
import org.jetbrains.annotations.NotNull;

/**
 * Renders one stage of a DQL pipeline. Stages are assembled in ascending priority order and a
 * stage with nothing to render is left out.
 */
public interface DqlClauseBuilder extends Comparable<DqlClauseBuilder> {

  /** The fragment for this stage, without the leading pipe separator. */
  Optional<String> build(ConversionContext context);

  int getPriority();

  @Override
  default int compareTo(@NotNull DqlClauseBuilder other) {
    return Integer.compare(this.getPriority(), other.getPriority());
  }
}
