package com.fxledger.settlement;

import com.fxledger.domain.enums.DiagnosticType;
import com.fxledger.domain.model.SettlementDiagnostic;
import java.util.ArrayList;
import java.util.List;

/**
 * Collects the recovered problems of a single settlement run. One instance per run, owned by the
 * pipeline and passed down to each stage; never shared between runs.
 */
public class SettlementDiagnostics {

    private final List<SettlementDiagnostic> entries = new ArrayList<>();

    public void record(DiagnosticType type, String ticker, String message) {
        entries.add(SettlementDiagnostic.builder()
                .type(type)
                .ticker(ticker)
                .message(message)
                .build());
    }

    public long count(DiagnosticType type) {
        return entries.stream().filter(e -> e.getType() == type).count();
    }

    public List<SettlementDiagnostic> snapshot() {
        return List.copyOf(entries);
    }
}
