package com.bsl.dimrank.service;

public record FallbackDecision(ExecutionMode mode, boolean degraded, String reasonCode) {}
