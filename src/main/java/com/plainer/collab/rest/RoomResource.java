package com.plainer.collab.rest;

import com.plainer.collab.error.RoomNotFoundException;
import com.plainer.collab.rest.dto.CreateRoomRequest;
import com.plainer.collab.rest.dto.InviteOnlyRequest;
import com.plainer.collab.rest.dto.InviteRequest;
import com.plainer.collab.rest.dto.PasswordRequest;
import com.plainer.collab.room.RoomInfo;
import com.plainer.collab.room.RoomInvite;
import com.plainer.collab.room.RoomRegistry;
import com.plainer.collab.security.AuthService;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import java.time.Duration;
import java.util.List;

/**
 * Room management for sharing dialogs: create rooms, inspect them, manage passwords and invites.
 * Callers are identified by their bearer token, or by {@code X-User-Id} when no token is sent.
 */
@Path("/api/rooms")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class RoomResource {

    public static final String USER_HEADER = "X-User-Id";

    @Inject
    RoomRegistry registry;

    @Inject
    AuthService authService;

    @POST
    public Response create(CreateRoomRequest req, @HeaderParam(USER_HEADER) String userId) {
        String ownerId = authService.requireRequester(userId);
        CreateRoomRequest body = req != null ? req : new CreateRoomRequest(null, null, null);
        RoomInfo room = registry.createRoom(body.roomId(), ownerId, body.password(),
            Boolean.TRUE.equals(body.inviteOnly()));
        return Response.status(Response.Status.CREATED).entity(room).build();
    }

    @GET
    public List<RoomInfo> list() {
        return registry.listRooms();
    }

    @GET
    @Path("/{id}")
    public RoomInfo get(@PathParam("id") String id) {
        return registry.roomInfo(id);
    }

    @PUT
    @Path("/{id}/password")
    public Response setPassword(@PathParam("id") String id, PasswordRequest req, @HeaderParam(USER_HEADER) String userId) {
        String actor = authService.requireRequester(userId);
        registry.setPassword(id, actor, req != null ? req.password() : null);
        return Response.noContent().build();
    }

    @PUT
    @Path("/{id}/invite-only")
    public Response setInviteOnly(@PathParam("id") String id, InviteOnlyRequest req, @HeaderParam(USER_HEADER) String userId) {
        String actor = authService.requireRequester(userId);
        registry.setInviteOnly(id, actor, req != null && req.enabled());
        return Response.noContent().build();
    }

    @POST
    @Path("/{id}/invites")
    public Response createInvite(@PathParam("id") String id, InviteRequest req, @HeaderParam(USER_HEADER) String userId) {
        String actor = authService.requireRequester(userId);
        Duration ttl = req != null && req.expiresInSeconds() != null ? Duration.ofSeconds(req.expiresInSeconds()) : null;
        RoomInvite invite = registry.issueInvite(id, actor, req != null ? req.role() : null, ttl);
        return Response.status(Response.Status.CREATED).entity(invite).build();
    }

    @DELETE
    @Path("/{id}/invites/{token}")
    public Response revokeInvite(@PathParam("id") String id, @PathParam("token") String token,
                                 @HeaderParam(USER_HEADER) String userId) {
        String actor = authService.requireRequester(userId);
        boolean revoked = registry.revokeInvite(id, actor, token);
        return revoked ? Response.noContent().build() : Response.status(Response.Status.NOT_FOUND).build();
    }

    @DELETE
    @Path("/{id}/members/{userId}")
    public Response kick(@PathParam("id") String id, @PathParam("userId") String target,
                         @HeaderParam(USER_HEADER) String userId) {
        String actor = authService.requireRequester(userId);
        registry.kick(id, actor, target);
        return Response.noContent().build();
    }

    @DELETE
    @Path("/{id}")
    public Response delete(@PathParam("id") String id, @HeaderParam(USER_HEADER) String userId) {
        String actor = authService.requireRequester(userId);
        try {
            registry.deleteRoom(id, actor);
        } catch (RoomNotFoundException e) {
            return Response.status(Response.Status.NOT_FOUND).build();
        }
        return Response.noContent().build();
    }
}
