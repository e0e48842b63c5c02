package com.trendsentinel.core.trend;

public record TokenCount(String token, int count) {
}
