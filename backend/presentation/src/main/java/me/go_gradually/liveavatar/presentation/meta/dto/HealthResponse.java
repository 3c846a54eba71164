package me.go_gradually.liveavatar.presentation.meta.dto;

public record HealthResponse(String status,
                             String service,
                             int activeSessions) {
}
