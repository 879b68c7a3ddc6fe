package com.scaffold.backend.modules.auth.presentation.dto;

public record MessageResponse(String message) {
}
