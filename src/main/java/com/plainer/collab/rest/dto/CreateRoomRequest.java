package com.plainer.collab.rest.dto;

public record CreateRoomRequest(String roomId, String password, Boolean inviteOnly) {}
