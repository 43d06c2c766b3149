package com.thermo.pipeline;

import com.thermo.model.Device;
import com.thermo.security.CredentialVerifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class CredentialGateTest {

  private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

  @Mock
  private CredentialVerifier verifier;

  private CredentialGate gate;

  @BeforeEach
  void setUp() {
    MockitoAnnotations.openMocks(this);
    gate = new CredentialGate(verifier);
  }

  @Test
  @DisplayName("Заголовок Device serial:secret → устройство в контексте")
  void shouldAttachDevice() {
    Device device = new Device("TH-1", 1L, null, NOW, null, null);
    when(verifier.verify("TH-1:secret")).thenReturn(Optional.of(device));
    IngestionContext context = new IngestionContext("Device TH-1:secret", "{}", "127.0.0.1", NOW);

    assertThat(gate.check(context).isAdmitted()).isTrue();
    assertThat(context.getDevice()).isSameAs(device);
  }

  @Test
  @DisplayName("Нет заголовка или другая схема → 401 без проверки секрета")
  void shouldRejectMissingOrForeignScheme() {
    GateResult missing = gate.check(new IngestionContext(null, "{}", "127.0.0.1", NOW));
    GateResult bearer = gate.check(new IngestionContext("Bearer abc", "{}", "127.0.0.1", NOW));

    assertThat(missing.getError()).isEqualTo(IngestionError.AUTHENTICATION_FAILURE);
    assertThat(bearer.getError()).isEqualTo(IngestionError.AUTHENTICATION_FAILURE);
    verify(verifier, never()).verify(anyString());
  }

  @Test
  @DisplayName("Неверные учётные данные → 401")
  void shouldRejectInvalidCredentials() {
    when(verifier.verify(anyString())).thenReturn(Optional.empty());
    IngestionContext context = new IngestionContext("Device TH-1:bad", "{}", "127.0.0.1", NOW);

    GateResult result = gate.check(context);

    assertThat(result.getError()).isEqualTo(IngestionError.AUTHENTICATION_FAILURE);
    assertThat(context.getDevice()).isNull();
  }
}
