package com.tokentracker.backend.modules.token.presentation;

import java.time.LocalDate;
import java.util.List;

import com.tokentracker.backend.global.web.MessageResponse;
import com.tokentracker.backend.modules.token.application.TokenRecordService;
import com.tokentracker.backend.modules.token.infrastructure.persistence.TokenSearchCondition;
import com.tokentracker.backend.modules.token.presentation.dto.BulkOperationRequest;
import com.tokentracker.backend.modules.token.presentation.dto.BulkOperationResponse;
import com.tokentracker.backend.modules.token.presentation.dto.TokenRequest;
import com.tokentracker.backend.modules.token.presentation.dto.TokenResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.validation.Valid;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TokenController {

    private final TokenRecordService tokenRecordService;

    public TokenController(TokenRecordService tokenRecordService) {
        this.tokenRecordService = tokenRecordService;
    }

    @Operation(summary = "List tokens", description = "Filters are optional; \"All\" disables a filter.")
    @GetMapping("/api/tokens")
    public ResponseEntity<List<TokenResponse>> listTokens(
            @RequestParam(name = "location", required = false) String location,
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "agent", required = false) String agent,
            @RequestParam(name = "executive", required = false) String executive,
            @RequestParam(name = "fromDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate fromDate,
            @RequestParam(name = "toDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate toDate
    ) {
        TokenSearchCondition condition = new TokenSearchCondition(
                location, status, search, agent, executive, fromDate, toDate);
        return ResponseEntity.ok(tokenRecordService.searchTokens(condition));
    }

    @Operation(summary = "Get token")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Found"),
            @ApiResponse(responseCode = "404", description = "Token not found")
    })
    @GetMapping("/api/tokens/{id}")
    public ResponseEntity<TokenResponse> getToken(@PathVariable("id") Long id) {
        return ResponseEntity.ok(tokenRecordService.getToken(id));
    }

    @Operation(summary = "Create token")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "409", description = "Token already exists")
    })
    @PostMapping("/api/tokens")
    public ResponseEntity<TokenResponse> createToken(@Valid @RequestBody TokenRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(tokenRecordService.createToken(request));
    }

    @Operation(summary = "Update token")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Updated"),
            @ApiResponse(responseCode = "404", description = "Token not found"),
            @ApiResponse(responseCode = "409", description = "Token already exists")
    })
    @PutMapping("/api/tokens/{id}")
    public ResponseEntity<TokenResponse> updateToken(
            @PathVariable("id") Long id,
            @Valid @RequestBody TokenRequest request
    ) {
        return ResponseEntity.ok(tokenRecordService.updateToken(id, request));
    }

    @Operation(summary = "Delete token")
    @DeleteMapping("/api/tokens/{id}")
    public ResponseEntity<MessageResponse> deleteToken(@PathVariable("id") Long id) {
        tokenRecordService.deleteToken(id);
        return ResponseEntity.ok(new MessageResponse("Token deleted successfully"));
    }

    @Operation(summary = "Apply a bulk operation",
            description = "apply_agent_payment, apply_executive_payment or mark_completed over the given ids.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Applied"),
            @ApiResponse(responseCode = "400", description = "Missing or unknown operation, or no ids")
    })
    @PostMapping("/api/bulk-operations")
    public ResponseEntity<BulkOperationResponse> applyBulkOperation(@RequestBody BulkOperationRequest request) {
        return ResponseEntity.ok(tokenRecordService.applyBulkOperation(request));
    }
}
