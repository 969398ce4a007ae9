package com.plainer.collab.client;

import com.plainer.collab.rest.dto.CreateRoomRequest;
import com.plainer.collab.rest.dto.InviteOnlyRequest;
import com.plainer.collab.rest.dto.InviteRequest;
import com.plainer.collab.rest.dto.PasswordRequest;
import com.plainer.collab.room.RoomInfo;
import com.plainer.collab.room.RoomInvite;
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
import org.eclipse.microprofile.rest.client.inject.RegisterRestClient;

import java.util.List;

/** Room management API as seen from a sharing dialog or another service. */
@RegisterRestClient(configKey = "room-service")
@Path("/api/rooms")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public interface RoomServiceClient {

    @POST
    RoomInfo create(CreateRoomRequest req, @HeaderParam("X-User-Id") String userId);

    @GET
    List<RoomInfo> list();

    @GET
    @Path("/{id}")
    RoomInfo getById(@PathParam("id") String id);

    @PUT
    @Path("/{id}/password")
    void setPassword(@PathParam("id") String id, PasswordRequest req, @HeaderParam("X-User-Id") String userId);

    @PUT
    @Path("/{id}/invite-only")
    void setInviteOnly(@PathParam("id") String id, InviteOnlyRequest req, @HeaderParam("X-User-Id") String userId);

    @POST
    @Path("/{id}/invites")
    RoomInvite createInvite(@PathParam("id") String id, InviteRequest req, @HeaderParam("X-User-Id") String userId);

    @DELETE
    @Path("/{id}/invites/{token}")
    void revokeInvite(@PathParam("id") String id, @PathParam("token") String token, @HeaderParam("X-User-Id") String userId);

    @DELETE
    @Path("/{id}/members/{userId}")
    void kick(@PathParam("id") String id, @PathParam("userId") String target, @HeaderParam("X-User-Id") String userId);

    @DELETE
    @Path("/{id}")
    void delete(@PathParam("id") String id, @HeaderParam("X-User-Id") String userId);
}
