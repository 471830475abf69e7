package com.stabilityengine.api.controller;

import com.stabilityengine.api.dto.EngineOperationRequest;
import com.stabilityengine.engine.EngineState;
import com.stabilityengine.engine.HolderBalances;
import com.stabilityengine.engine.OperationReceipt;
import com.stabilityengine.engine.StabilityEngine;
import com.stabilityengine.ledger.LedgerEntry;
import com.stabilityengine.ledger.LedgerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for the stability engine.
 */
@RestController
@RequestMapping("/api/v1/engine")
@RequiredArgsConstructor
@Tag(name = "Engine", description = "Stable and buffer unit issuance API")
public class StabilityEngineController {

    private final StabilityEngine stabilityEngine;
    private final LedgerService ledgerService;

    @PostMapping("/stable/mint")
    @Operation(summary = "Mint stable units against attached native value")
    public ResponseEntity<OperationReceipt> mintStable(@Valid @RequestBody EngineOperationRequest request) {
        return ResponseEntity.ok(stabilityEngine.mintStable(request.getCaller(), request.getAmount()));
    }

    @PostMapping("/stable/burn")
    @Operation(summary = "Burn stable units and redeem native value")
    public ResponseEntity<OperationReceipt> burnStable(@Valid @RequestBody EngineOperationRequest request) {
        return ResponseEntity.ok(stabilityEngine.burnStable(request.getCaller(), request.getAmount()));
    }

    @PostMapping("/buffer/deposit")
    @Operation(summary = "Deposit into the collateral buffer and mint buffer units")
    public ResponseEntity<OperationReceipt> depositBuffer(@Valid @RequestBody EngineOperationRequest request) {
        return ResponseEntity.ok(stabilityEngine.depositBuffer(request.getCaller(), request.getAmount()));
    }

    @PostMapping("/buffer/withdraw")
    @Operation(summary = "Burn buffer units and redeem a share of the surplus")
    public ResponseEntity<OperationReceipt> withdrawBuffer(@Valid @RequestBody EngineOperationRequest request) {
        return ResponseEntity.ok(stabilityEngine.withdrawBuffer(request.getCaller(), request.getAmount()));
    }

    @GetMapping("/state")
    @Operation(summary = "Get collateral, supplies and surplus")
    public ResponseEntity<EngineState> getState() {
        return ResponseEntity.ok(stabilityEngine.getState());
    }

    @GetMapping("/balances/{holder}")
    @Operation(summary = "Get stable and buffer balances of a holder")
    public ResponseEntity<HolderBalances> getBalances(@PathVariable String holder) {
        return ResponseEntity.ok(stabilityEngine.balancesOf(holder));
    }

    @GetMapping("/journal/{holder}")
    @Operation(summary = "Get ledger entries for a holder")
    public ResponseEntity<List<LedgerEntry>> getJournal(@PathVariable String holder) {
        return ResponseEntity.ok(ledgerService.getHolderJournal(holder));
    }
}
