package com.acme.mailroute.classify;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.acme.mailroute.core.ClassifierUnavailableException;
import com.acme.mailroute.domain.ClassificationResult;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class ClassificationChainTest {

  private static Classifier failing(String name) {
    Classifier c = mock(Classifier.class);
    when(c.name()).thenReturn(name);
    when(c.classify(any(), any(), any()))
        .thenThrow(new ClassifierUnavailableException(name + " is down"));
    return c;
  }

  private static Classifier answering(ClassificationResult r) {
    Classifier c = mock(Classifier.class);
    when(c.classify(any(), any(), any())).thenReturn(r);
    return c;
  }

  @Nested
  @DisplayName("fallback")
  class FallbackTests {

    @Test
    @DisplayName("should still return a well-formed result when every stage throws")
    void allStagesFail() {
      var chain =
          new ClassificationChain(
              List.of(failing("domain"), failing("general"), failing("baseline")),
              DepartmentDirectory.defaults(),
              new PriorityDetector());

      var r = chain.classify("anything", "at all", "x@y.z");

      assertThat(r.category()).isEqualTo(MailboxCategory.UPDATES);
      assertThat(r.confidence()).isBetween(0.0, 1.0);
      assertThat(r.probabilities().values().stream().mapToDouble(Double::doubleValue).sum())
          .isCloseTo(1.0, within(1e-9));
      assertThat(r.department()).isEqualTo("Support");
    }

    @Test
    @DisplayName("should leave priority and sentiment unset when the detectors fail")
    void detectorsFail() {
      PriorityDetector priorities = mock(PriorityDetector.class);
      SentimentDetector sentiments = mock(SentimentDetector.class);
      when(priorities.detect(any(), any())).thenThrow(new IllegalStateException("boom"));
      when(sentiments.detect(any(), any())).thenThrow(new IllegalStateException("boom"));
      var chain =
          new ClassificationChain(
              List.of(new StatisticalBaselineClassifier()),
              DepartmentDirectory.defaults(),
              priorities,
              sentiments);

      var r = chain.classify("Team lunch", "pizza on friday", "x@y.z");

      assertThat(r.isAnswer()).isTrue();
      assertThat(r.priority()).isNull();
      assertThat(r.sentiment()).isNull();
    }

    @Test
    @DisplayName("should skip an unknown answer and accept the next stage")
    void skipsUnknown() {
      var unknown = answering(ClassificationResult.unknown("a", "nothing"));
      var social =
          answering(
              ClassificationResult.of("social", Map.of("social", 0.7, "spam", 0.3), "general", ""));
      var chain =
          new ClassificationChain(
              List.of(unknown, social), DepartmentDirectory.defaults(), new PriorityDetector());

      var r = chain.classify("s", "b", "x");

      assertThat(r.category()).isEqualTo("social");
      assertThat(r.department()).isEqualTo("Marketing");
    }

    @Test
    @DisplayName("should treat a zero-confidence answer as no answer")
    void zeroConfidence() {
      var zero = answering(ClassificationResult.of("spam", Map.of("spam", 0.0), "a", ""));
      var chain =
          new ClassificationChain(
              List.of(zero, new StatisticalBaselineClassifier()),
              DepartmentDirectory.defaults(),
              new PriorityDetector());

      assertThat(chain.classify("zzzz", "qqqq", "x").stage())
          .isEqualTo(StatisticalBaselineClassifier.NAME);
    }
  }

  @Nested
  @DisplayName("standard chain")
  class StandardChainTests {

    private final ClassificationChain chain = ClassificationChain.standard(null);

    @Test
    @DisplayName("should answer from the domain stage with evidence")
    void domainStage() {
      var r =
          chain.classify("URGENT: server down", "production outage, losing revenue", "ceo@x.com");

      assertThat(r.stage()).isEqualTo(DomainKeywordClassifier.NAME);
      assertThat(r.department()).isEqualTo("IT");
      assertThat(r.priority()).isEqualTo(PriorityDetector.CRITICAL);
    }

    @Test
    @DisplayName("should stamp the detected sentiment on the accepted result")
    void sentiment() {
      var r =
          chain.classify(
              "Still waiting for my refund",
              "Very disappointed, this is the worst experience. No response for two weeks!!",
              "angry@customer.example");

      assertThat(r.sentiment()).isEqualTo(SentimentDetector.NEGATIVE);
    }

    @Test
    @DisplayName("should fall through to the general stage for promotional mail")
    void generalStage() {
      var r = chain.classify("50% off sale", "buy now", "deals@shop.example");

      assertThat(r.stage()).isEqualTo(GeneralPurposeClassifier.NAME);
      assertThat(r.category()).isEqualTo(MailboxCategory.PROMOTION);
      assertThat(r.department()).isEqualTo("Marketing");
    }

    @Test
    @DisplayName("a failing scoring model hands over to the general stage")
    void failingModelFallsThrough() {
      var withBrokenModel =
          ClassificationChain.standard(
              text -> {
                throw new IllegalStateException("model server unreachable");
              });

      var r = withBrokenModel.classify("50% off sale", "buy now", "deals@shop.example");

      assertThat(r.stage()).isEqualTo(GeneralPurposeClassifier.NAME);
      assertThat(r.category()).isEqualTo(MailboxCategory.PROMOTION);
    }

    @ParameterizedTest
    @CsvSource({
      "URGENT: server down, production outage",
      "50% off sale, buy now",
      "Invoice 12345, please process the payment",
      "hello, how are you",
      "zzzz, qqqq"
    })
    @DisplayName("probabilities should always sum to one")
    void sumsToOne(String subject, String body) {
      var r = chain.classify(subject, body, "someone@example.com");

      assertThat(r.probabilities().values().stream().mapToDouble(Double::doubleValue).sum())
          .isCloseTo(1.0, within(1e-6));
      assertThat(r.confidence()).isBetween(0.0, 1.0);
    }
  }
}
