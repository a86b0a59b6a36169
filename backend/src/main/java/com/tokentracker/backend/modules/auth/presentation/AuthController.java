package com.tokentracker.backend.modules.auth.presentation;

import java.util.concurrent.CompletableFuture;

import com.tokentracker.backend.modules.auth.application.LoginService;
import com.tokentracker.backend.modules.auth.presentation.dto.LoginRequest;
import com.tokentracker.backend.modules.auth.presentation.dto.LoginResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AuthController {

    private final LoginService loginService;

    public AuthController(LoginService loginService) {
        this.loginService = loginService;
    }

    @Operation(summary = "Log in", description = "Verifies the credential, upgrading a legacy stored value on success.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Authenticated"),
            @ApiResponse(responseCode = "400", description = "Missing username or password"),
            @ApiResponse(responseCode = "401", description = "Invalid username or password"),
            @ApiResponse(responseCode = "503", description = "Hashing pool saturated")
    })
    @PostMapping("/api/login")
    public CompletableFuture<ResponseEntity<LoginResponse>> login(@Valid @RequestBody LoginRequest request) {
        return loginService.login(request).thenApply(ResponseEntity::ok);
    }
}
