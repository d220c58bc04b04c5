package com.devflow.orchestrator.api.dto;

/** Body returned for 4xx responses raised by the API exception handler. */
public record ErrorResponse(String error, String message) {}
