package com.thermo.pipeline;

import java.util.List;

/**
 * Упорядоченная цепочка шлюзов. Первый отказ прерывает проверку.
 */
public class IngestionPipeline {

  private final List<IngestionGate> gates;

  public IngestionPipeline(List<IngestionGate> gates) {
    this.gates = List.copyOf(gates);
  }

  public GateResult run(IngestionContext context) {
    for (IngestionGate gate : gates) {
      GateResult result = gate.check(context);
      if (!result.isAdmitted()) {
        return result;
      }
    }
    return GateResult.admit();
  }
}
