package com.tokentracker.backend.modules.token.presentation.dto;

import java.util.List;

public record BulkOperationRequest(String operation, List<Long> ids) {
}
