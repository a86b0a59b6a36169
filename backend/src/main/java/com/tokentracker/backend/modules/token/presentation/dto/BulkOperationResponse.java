package com.tokentracker.backend.modules.token.presentation.dto;

public record BulkOperationResponse(boolean success, int processed) {
}
