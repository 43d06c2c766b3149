package com.thermo.pipeline;

import com.thermo.model.Device;
import com.thermo.security.CredentialVerifier;

import java.util.Optional;

/**
 * Проверяет заголовок {@code Authorization: Device <serial>:<secret>}.
 */
public class CredentialGate implements IngestionGate {

  static final String SCHEME = "Device ";

  private final CredentialVerifier verifier;

  public CredentialGate(CredentialVerifier verifier) {
    this.verifier = verifier;
  }

  @Override
  public GateResult check(IngestionContext context) {
    String header = context.getAuthorization() == null ? "" : context.getAuthorization().trim();
    if (!header.startsWith(SCHEME)) {
      return GateResult.reject(IngestionError.AUTHENTICATION_FAILURE, "Missing or invalid Authorization header");
    }
    Optional<Device> device = verifier.verify(header.substring(SCHEME.length()));
    if (device.isEmpty()) {
      return GateResult.reject(IngestionError.AUTHENTICATION_FAILURE, "Invalid device credentials");
    }
    context.setDevice(device.get());
    return GateResult.admit();
  }
}
