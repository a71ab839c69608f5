package com.codeheadsystems.compliance.common.alert;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AlerterTest {

  @Mock private AlertSink alertSink;
  @Captor private ArgumentCaptor<Map<String, Object>> detailsCaptor;

  private Alerter alerter;

  @BeforeEach
  void setup() {
    alerter = new Alerter(alertSink);
  }

  @Test
  void raise_passesThrough() {
    alerter.raise("SOMETHING", Severity.LOW, Alerter.details("a", 1));
    verify(alertSink).raiseAlert(eq("SOMETHING"), eq(Severity.LOW), detailsCaptor.capture());
    assertThat(detailsCaptor.getValue()).containsEntry("a", 1);
  }

  @Test
  void raise_sinkFailureDoesNotEscape() {
    doThrow(new IllegalStateException("sink down"))
        .when(alertSink).raiseAlert(any(), any(), anyMap());
    assertThatCode(() -> alerter.raise("SOMETHING", Severity.HIGH, Map.of()))
        .doesNotThrowAnyException();
  }

  @Test
  void alerted_returnsSameExceptionAndRecordsMessage() {
    final IllegalStateException exception = new IllegalStateException("boom");
    final IllegalStateException result = alerter.alerted("FAILED", Severity.HIGH, exception, Alerter.details("k", "v"));

    assertThat(result).isSameAs(exception);
    verify(alertSink).raiseAlert(eq("FAILED"), eq(Severity.HIGH), detailsCaptor.capture());
    assertThat(detailsCaptor.getValue())
        .containsEntry("k", "v")
        .containsEntry("error", "boom");
  }

  @Test
  void details_nullValuesAreStringified() {
    assertThat(Alerter.details("k", null)).containsEntry("k", "null");
  }

  @Test
  void details_oddArguments() {
    assertThatExceptionOfType(IllegalArgumentException.class)
        .isThrownBy(() -> Alerter.details("lonely"));
  }

}
