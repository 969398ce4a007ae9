package com.plainer.collab.rest.dto;

// Null or blank password removes protection.
public record PasswordRequest(String password) {}
