package com.tokentracker.backend.global.web;

public record MessageResponse(String message) {
}
