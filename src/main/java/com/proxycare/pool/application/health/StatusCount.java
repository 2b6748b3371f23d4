package com.proxycare.pool.application.health;

public record StatusCount(int statusCode, String description, long counter) {
}
