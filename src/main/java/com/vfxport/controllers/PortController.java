package com.vfxport.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vfxport.AppLogger;
import com.vfxport.EditorContext;
import com.vfxport.mutations.BulkPortMonitor;
import com.vfxport.mutations.MutationOutcome;
import com.vfxport.session.EditSession;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Copies emitters and systems from the donor into the target.
 */
public class PortController implements Controller {

    private final EditorContext editor;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public PortController(EditorContext editor, ObjectMapper objectMapper) {
        this.editor = editor;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/api/port/emitter", this::portEmitter);
        app.post("/api/port/emitters", this::portAllEmitters);
        app.post("/api/port/system", this::portSystem);
        app.post("/api/port/systems", this::portAllSystems);
        app.get("/api/port/progress", this::progress);
        app.post("/api/port/cancel", this::cancel);
    }

    private void portEmitter(Context ctx) {
        try {
            EditSession target = SessionLookup.require(editor, ctx, EditSession.Role.TARGET);
            EditSession donor = target == null ? null : SessionLookup.require(editor, ctx, EditSession.Role.DONOR);
            if (donor == null) {
                return;
            }
            JsonNode json = objectMapper.readTree(ctx.body());
            MutationOutcome outcome = editor.ports().portEmitter(target, donor,
                SessionLookup.text(json, "donorSystemKey"), SessionLookup.text(json, "emitterName"),
                SessionLookup.text(json, "targetSystemKey"));
            finish(ctx, outcome);
        } catch (Exception e) {
            logger.error("Port emitter failed: " + e.getMessage(), e);
            ctx.status(400).json(Controller.errorBody(e));
        }
    }

    private void portAllEmitters(Context ctx) {
        try {
            EditSession target = SessionLookup.require(editor, ctx, EditSession.Role.TARGET);
            EditSession donor = target == null ? null : SessionLookup.require(editor, ctx, EditSession.Role.DONOR);
            if (donor == null) {
                return;
            }
            JsonNode json = objectMapper.readTree(ctx.body());
            BulkPortMonitor monitor = editor.startBulkPort();
            MutationOutcome outcome = editor.ports().portAllEmitters(target, donor,
                SessionLookup.text(json, "donorSystemKey"), SessionLookup.text(json, "targetSystemKey"), monitor);
            finish(ctx, outcome);
        } catch (Exception e) {
            logger.error("Port all emitters failed: " + e.getMessage(), e);
            ctx.status(400).json(Controller.errorBody(e));
        }
    }

    private void portSystem(Context ctx) {
        try {
            EditSession target = SessionLookup.require(editor, ctx, EditSession.Role.TARGET);
            EditSession donor = target == null ? null : SessionLookup.require(editor, ctx, EditSession.Role.DONOR);
            if (donor == null) {
                return;
            }
            JsonNode json = objectMapper.readTree(ctx.body());
            finish(ctx, editor.ports().portSystem(target, donor, SessionLookup.text(json, "donorSystemKey")));
        } catch (Exception e) {
            logger.error("Port system failed: " + e.getMessage(), e);
            ctx.status(400).json(Controller.errorBody(e));
        }
    }

    private void portAllSystems(Context ctx) {
        EditSession target = SessionLookup.require(editor, ctx, EditSession.Role.TARGET);
        EditSession donor = target == null ? null : SessionLookup.require(editor, ctx, EditSession.Role.DONOR);
        if (donor == null) {
            return;
        }
        BulkPortMonitor monitor = editor.startBulkPort();
        finish(ctx, editor.ports().portAllSystems(target, donor, monitor));
    }

    private void progress(Context ctx) {
        Optional<BulkPortMonitor> monitor = editor.currentPort();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("running", monitor.map(BulkPortMonitor::isRunning).orElse(false));
        body.put("done", monitor.map(BulkPortMonitor::getDone).orElse(0));
        body.put("total", monitor.map(BulkPortMonitor::getTotal).orElse(0));
        body.put("current", monitor.map(BulkPortMonitor::getCurrent).orElse(null));
        body.put("cancelled", monitor.map(BulkPortMonitor::isCancelled).orElse(false));
        ctx.json(body);
    }

    private void cancel(Context ctx) {
        Optional<BulkPortMonitor> monitor = editor.currentPort().filter(BulkPortMonitor::isRunning);
        if (monitor.isEmpty()) {
            ctx.status(409).json(Map.of("error", "No port in progress"));
            return;
        }
        monitor.get().cancel();
        logger.info("Bulk port cancel requested");
        ctx.json(Map.of("success", true, "message", "Cancelling after the current item"));
    }

    private void finish(Context ctx, MutationOutcome outcome) {
        if (outcome.isSuccess()) {
            editor.afterTargetEdit();
        }
        Controller.respond(ctx, outcome);
    }
}
