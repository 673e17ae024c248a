package com.fxledger.domain.model;

import com.fxledger.domain.enums.DiagnosticType;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SettlementDiagnostic {

    DiagnosticType type;
    String ticker;
    String message;
}
