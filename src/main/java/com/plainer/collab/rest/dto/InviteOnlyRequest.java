package com.plainer.collab.rest.dto;

public record InviteOnlyRequest(boolean enabled) {}
