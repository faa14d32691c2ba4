package dev.scriptorium.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class SearchRequestTest {

  @Test
  void convenienceConstructorSearchesEveryTypeWithoutRerank() {
    SearchRequest request = new SearchRequest("garden", 5);

    assertThat(request.contentType()).isNull();
    assertThat(request.rerank()).isFalse();
  }

  @Test
  void rejectsBlankQuery() {
    assertThatThrownBy(() -> new SearchRequest("  ", 5))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsNonPositiveMaxResults() {
    assertThatThrownBy(() -> new SearchRequest("garden", 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
