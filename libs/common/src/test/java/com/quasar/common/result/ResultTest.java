package com.quasar.common.result;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ResultTest {

  private enum Kind {
    NOT_FOUND
  }

  @Test
  void okExposesValueAndMaps() {
    final Result<Integer, Kind> result = Result.ok(2);

    assertThat(result.isOk()).isTrue();
    assertThat(result.isErr()).isFalse();
    assertThat(result.map(v -> v * 10).value()).isEqualTo(20);
    assertThat(result.flatMap(v -> Result.<String, Kind>ok("v" + v)).value()).isEqualTo("v2");
  }

  @Test
  void errCarriesKindAndMessageThroughMap() {
    final Result<Integer, Kind> result = Result.err(Kind.NOT_FOUND, "Match not found");

    final Result<String, Kind> mapped = result.map(String::valueOf);

    assertThat(mapped.isErr()).isTrue();
    assertThat(mapped.kind()).isEqualTo(Kind.NOT_FOUND);
    assertThat(mapped.message()).isEqualTo("Match not found");
  }

  @Test
  void valueOnErrThrows() {
    final Result<Integer, Kind> result = Result.err(Kind.NOT_FOUND, "Match not found");

    assertThatThrownBy(result::value)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Match not found");
  }

  @Test
  void kindOnOkThrows() {
    final Result<Integer, Kind> result = Result.ok(1);

    assertThatThrownBy(result::kind).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void orElseThrowUsesFactoryForErr() {
    final Result<Integer, Kind> result = Result.err(Kind.NOT_FOUND, "gone");

    assertThatThrownBy(() -> result.orElseThrow(err -> new IllegalArgumentException(err.message())))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("gone");
    assertThat(Result.<Integer, Kind>ok(5).orElseThrow(err -> new IllegalStateException()))
        .isEqualTo(5);
  }
}
