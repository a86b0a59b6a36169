package com.tokentracker.backend.modules.auth.presentation;

import java.util.List;

import com.tokentracker.backend.global.web.MessageResponse;
import com.tokentracker.backend.modules.auth.application.AccountService;
import com.tokentracker.backend.modules.auth.presentation.dto.AccountResponse;
import com.tokentracker.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.tokentracker.backend.modules.auth.presentation.dto.CreateAccountRequest;
import com.tokentracker.backend.modules.auth.presentation.dto.ResetPasswordRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AccountController {

    private final AccountService accountService;

    public AccountController(AccountService accountService) {
        this.accountService = accountService;
    }

    @Operation(summary = "List accounts")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Accounts ordered by id"),
            @ApiResponse(responseCode = "403", description = "Admin role required")
    })
    @GetMapping("/api/users")
    public ResponseEntity<List<AccountResponse>> listAccounts() {
        return ResponseEntity.ok(accountService.listAccounts());
    }

    @Operation(summary = "Create account")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "400", description = "Missing field or unknown role"),
            @ApiResponse(responseCode = "409", description = "Username already exists")
    })
    @PostMapping("/api/users")
    public ResponseEntity<AccountResponse> createAccount(@Valid @RequestBody CreateAccountRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(accountService.createAccount(request));
    }

    @Operation(summary = "Delete account")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Deleted"),
            @ApiResponse(responseCode = "404", description = "User not found")
    })
    @DeleteMapping("/api/users/{id}")
    public ResponseEntity<MessageResponse> deleteAccount(@PathVariable("id") Long id) {
        accountService.deleteAccount(id);
        return ResponseEntity.ok(new MessageResponse("User deleted successfully"));
    }

    @Operation(summary = "Reset account password", description = "Admin sets a new password; role is preserved.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Password replaced"),
            @ApiResponse(responseCode = "404", description = "User not found")
    })
    @PutMapping("/api/users/{id}/password")
    public ResponseEntity<AccountResponse> resetPassword(
            @PathVariable("id") Long id,
            @Valid @RequestBody ResetPasswordRequest request
    ) {
        return ResponseEntity.ok(accountService.resetPassword(id, request));
    }

    @Operation(summary = "Change own password")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Password changed"),
            @ApiResponse(responseCode = "401", description = "Current password is incorrect")
    })
    @PutMapping("/api/account/password")
    public ResponseEntity<Void> changeOwnPassword(@Valid @RequestBody ChangePasswordRequest request) {
        accountService.changeOwnPassword(request);
        return ResponseEntity.noContent().build();
    }
}
