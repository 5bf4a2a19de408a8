package com.vfxport.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.vfxport.EditorContext;
import com.vfxport.session.EditSession;
import io.javalin.http.Context;

import java.util.Locale;
import java.util.Map;

final class SessionLookup {

    private SessionLookup() {
    }

    static EditSession.Role role(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Session role is required");
        }
        switch (raw.toLowerCase(Locale.ROOT)) {
            case "target":
                return EditSession.Role.TARGET;
            case "donor":
                return EditSession.Role.DONOR;
            default:
                throw new IllegalArgumentException("Unknown session role: " + raw);
        }
    }

    /** The open session for {@code role}, or null after answering 404. */
    static EditSession require(EditorContext editor, Context ctx, EditSession.Role role) {
        EditSession session = role == EditSession.Role.TARGET
            ? editor.target().orElse(null)
            : editor.donor().orElse(null);
        if (session == null) {
            ctx.status(404).json(Map.of("error", "No " + role.name().toLowerCase(Locale.ROOT) + " file loaded"));
        }
        return session;
    }

    static String text(JsonNode json, String field) {
        return json.hasNonNull(field) ? json.get(field).asText() : null;
    }
}
