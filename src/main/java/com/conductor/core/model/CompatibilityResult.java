package com.conductor.core.model;

public record CompatibilityResult(boolean compatible, String reason) {}
