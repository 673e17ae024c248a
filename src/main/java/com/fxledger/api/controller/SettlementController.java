package com.fxledger.api.controller;

import com.fxledger.api.dto.request.SettlementRunRequest;
import com.fxledger.domain.model.SettlementReport;
import com.fxledger.settlement.SettlementPipeline;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for settlement runs.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/settlements/run} -- settle a trade ledger against a rate table</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/settlements")
public class SettlementController {

    private final SettlementPipeline settlementPipeline;

    public SettlementController(SettlementPipeline settlementPipeline) {
        this.settlementPipeline = settlementPipeline;
    }

    @PostMapping("/run")
    public SettlementReport run(@RequestBody @Valid SettlementRunRequest request) {
        return settlementPipeline.run(request.toSettlementRequest());
    }
}
