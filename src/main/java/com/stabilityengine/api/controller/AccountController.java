package com.stabilityengine.api.controller;

import com.stabilityengine.accounts.NativeAccount;
import com.stabilityengine.accounts.NativeAccountService;
import com.stabilityengine.api.dto.OpenAccountRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigInteger;

/**
 * REST API for native accounts.
 */
@RestController
@RequestMapping("/api/v1/accounts")
@RequiredArgsConstructor
@Tag(name = "Accounts", description = "Native account management API")
public class AccountController {

    private final NativeAccountService accountService;

    @PostMapping
    @Operation(summary = "Open a native account")
    public ResponseEntity<NativeAccount> openAccount(@Valid @RequestBody OpenAccountRequest request) {
        NativeAccount account = accountService.openAccount(
            request.getAddress(), request.getInitialBalance(), request.isAcceptsTransfers());
        return ResponseEntity.status(HttpStatus.CREATED).body(account);
    }

    @GetMapping("/{address}")
    @Operation(summary = "Get native account details")
    public ResponseEntity<NativeAccount> getAccount(@PathVariable String address) {
        return ResponseEntity.ok(accountService.getAccount(address));
    }

    @PostMapping("/{address}/fund")
    @Operation(summary = "Fund a native account")
    public ResponseEntity<NativeAccount> fund(@PathVariable String address, @RequestParam BigInteger amount) {
        return ResponseEntity.ok(accountService.fund(address, amount));
    }

    @PutMapping("/{address}/accepts-transfers")
    @Operation(summary = "Accept or refuse inbound transfers")
    public ResponseEntity<NativeAccount> setAcceptsTransfers(@PathVariable String address,
                                                             @RequestParam boolean value) {
        return ResponseEntity.ok(accountService.setAcceptsTransfers(address, value));
    }
}
