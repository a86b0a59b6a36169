package com.tokentracker.backend.modules.token.presentation;

import java.nio.charset.StandardCharsets;
import java.util.List;

import com.tokentracker.backend.modules.token.application.TokenExportService;
import com.tokentracker.backend.modules.token.application.TokenReportService;
import com.tokentracker.backend.modules.token.presentation.dto.TokenResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TokenReportController {

    private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final TokenReportService tokenReportService;
    private final TokenExportService tokenExportService;

    public TokenReportController(TokenReportService tokenReportService, TokenExportService tokenExportService) {
        this.tokenReportService = tokenReportService;
        this.tokenExportService = tokenExportService;
    }

    @Operation(summary = "Distinct agent names")
    @GetMapping("/api/agents")
    public ResponseEntity<List<String>> listAgents() {
        return ResponseEntity.ok(tokenReportService.listAgents());
    }

    @Operation(summary = "Distinct executive names")
    @GetMapping("/api/executives")
    public ResponseEntity<List<String>> listExecutives() {
        return ResponseEntity.ok(tokenReportService.listExecutives());
    }

    @Operation(summary = "Completed tokens for an agent")
    @GetMapping("/api/reports/agent")
    public ResponseEntity<List<TokenResponse>> agentReport(@RequestParam(name = "agent") String agent) {
        return ResponseEntity.ok(tokenReportService.agentReport(agent));
    }

    @Operation(summary = "Completed tokens for an executive")
    @GetMapping("/api/reports/executive")
    public ResponseEntity<List<TokenResponse>> executiveReport(@RequestParam(name = "executive") String executive) {
        return ResponseEntity.ok(tokenReportService.executiveReport(executive));
    }

    @Operation(summary = "Export all tokens as CSV")
    @GetMapping("/api/export")
    public ResponseEntity<byte[]> exportCsv() {
        byte[] body = tokenExportService.exportCsv();
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(tokenExportService.exportFileName())
                .build();
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .contentType(TEXT_CSV)
                .body(body);
    }
}
