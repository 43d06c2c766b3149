package com.thermo.pipeline;

/**
 * Решение одного шлюза: пропустить или отказать с причиной.
 */
public final class GateResult {

  private static final GateResult ADMIT = new GateResult(null, null);

  private final IngestionError error;
  private final String detail;

  private GateResult(IngestionError error, String detail) {
    this.error = error;
    this.detail = detail;
  }

  public static GateResult admit() {
    return ADMIT;
  }

  public static GateResult reject(IngestionError error, String detail) {
    return new GateResult(error, detail);
  }

  public boolean isAdmitted() {
    return error == null;
  }

  /**
   * @return Причина отказа или {@code null}, если запрос пропущен.
   */
  public IngestionError getError() {
    return error;
  }

  public String getDetail() {
    return detail;
  }
}
