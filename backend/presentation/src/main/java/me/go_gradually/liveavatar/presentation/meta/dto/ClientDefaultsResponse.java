package me.go_gradually.liveavatar.presentation.meta.dto;

public record ClientDefaultsResponse(String model,
                                     String voice,
                                     String endpoint,
                                     boolean hasApiKey) {
}
