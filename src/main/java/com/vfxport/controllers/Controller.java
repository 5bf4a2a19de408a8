package com.vfxport.controllers;

import com.vfxport.mutations.MutationOutcome;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An HTTP surface over one slice of the editor (sessions, systems, porting,
 * effects, materials). Bodies are JSON through the shared ObjectMapper.
 */
public interface Controller {

    void registerRoutes(Javalin app);

    /** {@code {"error": message}}, falling back to the exception type when the message is empty. */
    static Map<String, Object> errorBody(Exception e) {
        String m = e.getMessage();
        if (m == null || m.isBlank()) {
            m = e.getClass().getSimpleName();
        }
        return Map.of("error", m);
    }

    /**
     * Writes a mutation outcome: 200 with the status message on success, the
     * error kind's status code otherwise.
     */
    static void respond(Context ctx, MutationOutcome outcome) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", outcome.isSuccess());
        body.put("message", outcome.getMessage());
        if (outcome.isSuccess()) {
            body.put("description", outcome.getDescription());
            body.put("version", outcome.getVersion());
            body.putAll(outcome.getDetails());
            ctx.json(body);
        } else {
            body.put("error", outcome.getMessage());
            body.put("kind", outcome.getErrorKind());
            body.put("blocking", outcome.getErrorKind().isBlocking());
            ctx.status(outcome.getErrorKind().getHttpStatus()).json(body);
        }
    }
}
