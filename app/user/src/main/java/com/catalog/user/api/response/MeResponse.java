package com.catalog.user.api.response;

public record MeResponse(String userId) {}
