package com.vfxport.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vfxport.AppLogger;
import com.vfxport.EditorContext;
import com.vfxport.mutations.MutationOutcome;
import com.vfxport.session.EditSession;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.Map;
import java.util.Optional;
import java.util.function.BiFunction;

/**
 * Structural edits on the target: systems and their emitters.
 */
public class SystemController implements Controller {

    private final EditorContext editor;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public SystemController(EditorContext editor, ObjectMapper objectMapper) {
        this.editor = editor;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/api/systems", ctx -> mutate(ctx, (session, json) ->
            editor.mutations().createSystem(session, SessionLookup.text(json, "name"))));
        app.post("/api/systems/rename", ctx -> mutate(ctx, (session, json) ->
            editor.mutations().renameSystem(session, SessionLookup.text(json, "systemKey"),
                SessionLookup.text(json, "newName"))));
        app.post("/api/systems/select", ctx -> mutate(ctx, (session, json) ->
            editor.mutations().selectSystem(session, SessionLookup.text(json, "systemKey"))));
        app.get("/api/systems/transform", this::transform);
        app.post("/api/systems/transform", ctx -> mutate(ctx, (session, json) ->
            editor.mutations().setSystemTransform(session, SessionLookup.text(json, "systemKey"), matrix(json))));
        app.post("/api/emitters/rename", ctx -> mutate(ctx, (session, json) ->
            editor.mutations().renameEmitter(session, SessionLookup.text(json, "systemKey"),
                SessionLookup.text(json, "emitterName"), SessionLookup.text(json, "newName"))));
        app.post("/api/emitters/delete", ctx -> mutate(ctx, (session, json) ->
            editor.mutations().deleteEmitter(session, SessionLookup.text(json, "systemKey"),
                SessionLookup.text(json, "emitterName"))));
        app.post("/api/emitters/delete-all", ctx -> mutate(ctx, (session, json) ->
            editor.mutations().deleteAllEmitters(session, SessionLookup.text(json, "systemKey"))));
        app.post("/api/emitters/move", ctx -> mutate(ctx, (session, json) ->
            editor.mutations().moveEmitter(session, SessionLookup.text(json, "sourceKey"),
                SessionLookup.text(json, "emitterName"), SessionLookup.text(json, "destinationKey"))));
    }

    private void transform(Context ctx) {
        EditSession session = SessionLookup.require(editor, ctx, EditSession.Role.TARGET);
        if (session == null) {
            return;
        }
        String systemKey = ctx.queryParam("system");
        Optional<double[]> matrix = editor.mutations().systemTransform(session, systemKey);
        if (matrix.isEmpty()) {
            ctx.status(404).json(Map.of("error", "System not found: " + systemKey));
            return;
        }
        ctx.json(Map.of("systemKey", systemKey, "matrix", matrix.get()));
    }

    /** Null when the body has no 16-number {@code matrix} array; the service reports it. */
    private static double[] matrix(JsonNode json) {
        JsonNode node = json == null ? null : json.get("matrix");
        if (node == null || !node.isArray()) {
            return null;
        }
        double[] values = new double[node.size()];
        for (int i = 0; i < node.size(); i++) {
            if (!node.get(i).isNumber()) {
                return null;
            }
            values[i] = node.get(i).asDouble();
        }
        return values;
    }

    private void mutate(Context ctx, BiFunction<EditSession, JsonNode, MutationOutcome> operation) {
        EditSession session = SessionLookup.require(editor, ctx, EditSession.Role.TARGET);
        if (session == null) {
            return;
        }
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            long before = session.getVersion();
            MutationOutcome outcome = operation.apply(session, json);
            if (outcome.isSuccess() && session.getVersion() != before) {
                editor.afterTargetEdit();
            }
            Controller.respond(ctx, outcome);
        } catch (Exception e) {
            logger.error("Edit failed: " + e.getMessage(), e);
            ctx.status(400).json(Controller.errorBody(e));
        }
    }
}
