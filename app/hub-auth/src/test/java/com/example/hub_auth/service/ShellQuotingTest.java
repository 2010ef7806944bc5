package com.example.hub_auth.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ShellQuotingTest {

  @ParameterizedTest(name = "[{0}] -> [{1}]")
  @CsvSource(
      delimiter = '|',
      quoteCharacter = '"',
      value = {
        "\"\"|''",
        "brics|brics",
        "\"brics \"|'brics '",
        "\" brics \"|' brics '",
        "brics; ls -l /|'brics; ls -l /'",
        "my-project|my-project",
        "my-project; ls|'my-project; ls'",
        "my_project|my_project",
        "my/project|my/project",
        "my\\ project|'my\\ project'",
        "project100|project100",
        "$project100|'$project100'",
        "user@host:1,2=3+4%|user@host:1,2=3+4%",
        "abc123_-./|abc123_-./",
        "a b|'a b'"
      })
  void defuseQuotesOnlyWhenNeeded(String input, String expected) {
    assertThat(ShellQuoting.defuse(input)).isEqualTo(expected);
  }

  @Test
  void defuseEscapesEmbeddedSingleQuote() {
    assertThat(ShellQuoting.defuse("it's")).isEqualTo("'it'\"'\"'s'");
  }

  @Test
  void defuseRejectsNull() {
    assertThatThrownBy(() -> ShellQuoting.defuse(null))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
