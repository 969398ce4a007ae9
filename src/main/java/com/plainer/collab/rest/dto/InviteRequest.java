package com.plainer.collab.rest.dto;

import com.plainer.collab.model.Role;

public record InviteRequest(Role role, Long expiresInSeconds) {}
