package com.plainer.collab.rest;

import com.plainer.collab.error.CollaborationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

public class ExceptionMappers {

    public record ErrorBody(String error, String code) {}

    @Provider
    public static class CollaborationExceptionMapper implements ExceptionMapper<CollaborationException> {
        @Override
        public Response toResponse(CollaborationException e) {
            String msg = e.getMessage();
            if (msg == null || msg.isBlank()) msg = e.getCode();
            return Response.status(e.getHttpStatus())
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorBody(msg, e.getCode()))
                .build();
        }
    }
}
