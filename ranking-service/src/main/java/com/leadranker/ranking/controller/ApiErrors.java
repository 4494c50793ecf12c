package com.leadranker.ranking.controller;

import com.leadranker.ranking.ai.ProviderNotConfiguredException;
import org.springframework.http.ResponseEntity;

import java.util.Map;

/** Maps handler failures to {@code {"error": message}} responses: 400 for caller errors, else 500. */
final class ApiErrors {

    private ApiErrors() {}

    static ResponseEntity<Object> toResponse(Throwable e) {
        int status = e instanceof IllegalArgumentException || e instanceof ProviderNotConfiguredException ? 400 : 500;
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}
