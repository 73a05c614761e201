package com.acme.mailroute.classify;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class SentimentDetectorTest {

  private final SentimentDetector detector = new SentimentDetector();

  @ParameterizedTest
  @CsvSource(
      delimiter = '|',
      value = {
        "Thank you for the quick fix | Great job, the team was very helpful | positive",
        "Still waiting | This is unacceptable, worst experience ever | negative",
        "Meeting notes | Attached are the notes from today | neutral",
        "Great product | but delivery was terrible and slow, thanks though | mixed"
      })
  @DisplayName("should label the overall tone")
  void labels(String subject, String body, String expected) {
    assertThat(detector.detect(subject, body)).isEqualTo(expected);
  }

  @Test
  @DisplayName("a negator turns praise into criticism")
  void negation() {
    assertThat(detector.detect("Support", "not helpful, not friendly"))
        .isEqualTo(SentimentDetector.NEGATIVE);
  }

  @Test
  @DisplayName("repeated exclamation marks only sharpen an already negative text")
  void exclamations() {
    assertThat(detector.detect("Order", "my parcel arrived!!"))
        .isEqualTo(SentimentDetector.NEUTRAL);
    assertThat(detector.detect("Order", "broken again!!")).isEqualTo(SentimentDetector.NEGATIVE);
  }

  @Test
  @DisplayName("missing text is neutral")
  void empty() {
    assertThat(detector.detect(null, null)).isEqualTo(SentimentDetector.NEUTRAL);
  }
}
