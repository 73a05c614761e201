package com.acme.mailroute.classify;

import static org.assertj.core.api.Assertions.*;

import com.acme.mailroute.core.ClassifierUnavailableException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DomainKeywordClassifierTest {

  private final DomainKeywordClassifier classifier = new DomainKeywordClassifier();

  @Nested
  @DisplayName("keyword evidence")
  class KeywordTests {

    @Test
    @DisplayName("should pick the department with the most keyword evidence")
    void picksItSupport() {
      var r =
          classifier.classify(
              "URGENT: server down", "production outage, losing revenue", "ceo@x.com");

      assertThat(r.category()).isEqualTo("it_support");
      assertThat(r.stage()).isEqualTo(DomainKeywordClassifier.NAME);
      assertThat(r.keywords().get("it_support")).contains("server", "outage");
      assertThat(r.isAnswer()).isTrue();
    }

    @Test
    @DisplayName("should blend boosts into a uniform prior and renormalize")
    void blendsAndNormalizes() {
      var r =
          classifier.classify(
              "URGENT: server down", "production outage, losing revenue", "ceo@x.com");

      // it_support: 0.1 + 3 * 0.12, operations and finance: 0.1 + 0.12, seven others: 0.05
      double total = 0.46 + 0.22 + 0.22 + 7 * 0.05;
      assertThat(r.confidence()).isCloseTo(0.46 / total, within(1e-9));
      assertThat(r.probabilities().values().stream().mapToDouble(Double::doubleValue).sum())
          .isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("should answer unknown without keywords or model")
    void unknownWithoutEvidence() {
      var r = classifier.classify("50% off sale", "buy now", "deals@shop.example");

      assertThat(r.category()).isEqualTo("unknown");
      assertThat(r.confidence()).isZero();
      assertThat(r.isAnswer()).isFalse();
    }

    @Test
    @DisplayName("should only match keywords on word boundaries")
    void wordBoundaries() {
      var found = DomainKeywordClassifier.findKeywords("preset values for the taxonomy");

      assertThat(found).isEmpty();
    }
  }

  @Nested
  @DisplayName("boosts")
  class BoostTests {

    @Test
    @DisplayName("should cap the boost and penalize labels without hits")
    void capAndPenalty() {
      var boosts =
          DomainKeywordClassifier.boosts(
              Map.of("sales", List.of("quote", "pricing", "demo", "trial", "pilot")));

      assertThat(boosts.get("sales")).isEqualTo(0.4);
      assertThat(boosts.get("hr")).isEqualTo(-0.05);
    }

    @Test
    @DisplayName("should not penalize anything when nothing matched")
    void noPenaltyWithoutHits() {
      assertThat(DomainKeywordClassifier.boosts(Map.of()).values()).containsOnly(0.0);
    }
  }

  @Test
  @DisplayName("should use the scoring model when there is no keyword evidence")
  void usesModel() {
    var withModel = new DomainKeywordClassifier(text -> Map.of("finance", 0.9, "sales", 0.1));

    var r = withModel.classify("hello there", "just checking in", "a@b.c");

    assertThat(r.category()).isEqualTo("finance");
    assertThat(r.confidence()).isCloseTo(0.9, within(1e-9));
  }

  @Test
  @DisplayName("should report the stage unavailable when the scoring model fails")
  void failingModel() {
    ScoringModel broken =
        text -> {
          throw new IllegalStateException("model server unreachable");
        };
    var withModel = new DomainKeywordClassifier(broken);

    assertThatThrownBy(() -> withModel.classify("hello there", "just checking in", "a@b.c"))
        .isInstanceOf(ClassifierUnavailableException.class)
        .hasMessageContaining("model server unreachable")
        .hasCauseInstanceOf(IllegalStateException.class);
  }

  @Test
  @DisplayName("should answer unknown for empty text")
  void emptyText() {
    assertThat(classifier.classify("", " ", null).category()).isEqualTo("unknown");
  }
}
