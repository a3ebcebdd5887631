package org.hypertrace.core.query.translator.dql;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Optional;
import java.util.Set;
import org.hypertrace.core.query.translator.ConversionContext;
import org.hypertrace.core.query.translator.TranslatorTestUtils;
import org.junit.jupiter.api.Test;

class DqlQueryAssemblerTest {

  @Test
  void joinsFragmentsInPriorityOrder() {
    DqlQueryAssembler assembler =
        new DqlQueryAssembler(
            Set.of(
                new FixedClauseBuilder(40, Optional.of("limit 10")),
                new FixedClauseBuilder(0, Optional.of("fetch logs")),
                new FixedClauseBuilder(20, Optional.empty()),
                new FixedClauseBuilder(10, Optional.of("filter loglevel == 'ERROR'"))));

    assertEquals(
        "fetch logs\n| filter loglevel == 'ERROR'\n| limit 10",
        assembler.assemble(TranslatorTestUtils.parsedContext("SELECT * FROM Log")));
  }

  @Test
  void limitBuilderRendersParsedLimit() {
    LimitClauseBuilder limitClauseBuilder = new LimitClauseBuilder();

    assertEquals(
        Optional.of("limit 25"),
        limitClauseBuilder.build(TranslatorTestUtils.parsedContext("SELECT * FROM Log LIMIT 25")));
    assertEquals(
        Optional.empty(),
        limitClauseBuilder.build(TranslatorTestUtils.parsedContext("SELECT * FROM Log")));
  }

  private static class FixedClauseBuilder implements DqlClauseBuilder {
    private final int priority;
    private final Optional<String> fragment;

    FixedClauseBuilder(int priority, Optional<String> fragment) {
      this.priority = priority;
      this.fragment = fragment;
    }

    @Override
    public Optional<String> build(ConversionContext context) {
      return fragment;
    }

    @Override
    public int getPriority() {
      return priority;
    }
  }
}
