package com.vfxport.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vfxport.AppLogger;
import com.vfxport.EditorContext;
import com.vfxport.models.UndoSnapshot;
import com.vfxport.models.VfxEmitter;
import com.vfxport.session.EditSession;
import com.vfxport.session.LoadOutcome;
import com.vfxport.session.SaveOutcome;
import com.vfxport.tree.PropertyTreeParser;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class SessionController implements Controller {

    private final EditorContext editor;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public SessionController(EditorContext editor, ObjectMapper objectMapper) {
        this.editor = editor;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.post("/api/session/{role}/open", this::open);
        app.get("/api/session/{role}", this::summary);
        app.get("/api/session/{role}/emitter", this::emitter);
        app.post("/api/session/target/save", this::save);
        app.post("/api/session/target/undo", this::undo);
        app.get("/api/session/target/history", this::history);
        app.get("/api/session/target/diff", this::diff);
        app.get("/api/session/target/background-save", this::backgroundSaveStatus);
        app.get("/api/log", this::recentLog);
    }

    private void recentLog(Context ctx) {
        int limit = 50;
        String raw = ctx.queryParam("limit");
        if (raw != null) {
            try {
                limit = Integer.parseInt(raw.trim());
            } catch (NumberFormatException e) {
                ctx.status(400).json(Map.of("error", "limit must be a number"));
                return;
            }
        }
        ctx.json(Map.of("events", logger != null ? logger.recent(limit) : List.of()));
    }

    private void open(Context ctx) {
        try {
            EditSession.Role role = SessionLookup.role(ctx.pathParam("role"));
            JsonNode json = objectMapper.readTree(ctx.body());
            String path = SessionLookup.text(json, "path");
            if (path == null || path.isBlank()) {
                ctx.status(400).json(Map.of("error", "path is required"));
                return;
            }
            LoadOutcome outcome = editor.loader().load(editor.workspace().resolvePath(path), role);
            if (!outcome.isSuccess()) {
                ctx.status(outcome.getErrorKind().getHttpStatus()).json(Map.of(
                    "error", outcome.getMessage(),
                    "kind", outcome.getErrorKind(),
                    "blocking", outcome.getErrorKind().isBlocking()));
                return;
            }
            editor.open(outcome.getSession());
            logger.info("Opened " + role + ": " + path);
            Map<String, Object> body = describe(outcome.getSession());
            body.put("message", outcome.getMessage());
            ctx.json(body);
        } catch (IllegalArgumentException | SecurityException e) {
            ctx.status(e instanceof SecurityException ? 403 : 400).json(Controller.errorBody(e));
        } catch (Exception e) {
            logger.error("Failed to open session: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void summary(Context ctx) {
        EditSession session = SessionLookup.require(editor, ctx, SessionLookup.role(ctx.pathParam("role")));
        if (session == null) {
            return;
        }
        ctx.json(describe(session));
    }

    private void emitter(Context ctx) {
        EditSession session = SessionLookup.require(editor, ctx, SessionLookup.role(ctx.pathParam("role")));
        if (session == null) {
            return;
        }
        String systemKey = ctx.queryParam("system");
        String name = ctx.queryParam("name");
        if (systemKey == null || name == null) {
            ctx.status(400).json(Map.of("error", "system and name query parameters are required"));
            return;
        }
        Optional<VfxEmitter> emitter;
        synchronized (session) {
            emitter = PropertyTreeParser.loadEmitter(session.getTree().getSystem(systemKey), name);
        }
        if (emitter.isEmpty()) {
            ctx.status(404).json(Map.of("error", "Emitter not found: " + name));
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("emitter", emitter.get());
        body.put("content", emitter.get().getContent());
        ctx.json(body);
    }

    private void save(Context ctx) {
        EditSession session = SessionLookup.require(editor, ctx, EditSession.Role.TARGET);
        if (session == null) {
            return;
        }
        editor.backgroundSave().cancelPending();
        SaveOutcome outcome = editor.saves().save(session);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", outcome.isSuccess());
        body.put("message", outcome.getMessage());
        body.put("restoreOffered", outcome.isRestoreOffered());
        if (outcome.isSuccess()) {
            ctx.json(body);
        } else {
            body.put("error", outcome.getMessage());
            body.put("kind", outcome.getErrorKind());
            ctx.status(outcome.getErrorKind() == null ? 409 : outcome.getErrorKind().getHttpStatus()).json(body);
        }
    }

    private void undo(Context ctx) {
        EditSession session = SessionLookup.require(editor, ctx, EditSession.Role.TARGET);
        if (session == null) {
            return;
        }
        Optional<UndoSnapshot> restored = session.undo();
        if (restored.isEmpty()) {
            ctx.status(409).json(Map.of("error", "Nothing to undo"));
            return;
        }
        editor.afterTargetEdit();
        logger.info("Undo: " + restored.get().getDescription());
        ctx.json(Map.of(
            "success", true,
            "message", "Undid: " + restored.get().getDescription(),
            "version", session.getVersion(),
            "remaining", session.getHistory().size()));
    }

    private void history(Context ctx) {
        EditSession session = SessionLookup.require(editor, ctx, EditSession.Role.TARGET);
        if (session == null) {
            return;
        }
        List<Map<String, Object>> entries = new ArrayList<>();
        for (UndoSnapshot snapshot : session.getHistory().entries()) {
            entries.add(Map.of("description", snapshot.getDescription(), "timestamp", snapshot.getTimestamp()));
        }
        ctx.json(Map.of("limit", session.getHistory().getLimit(), "entries", entries));
    }

    private void diff(Context ctx) {
        EditSession session = SessionLookup.require(editor, ctx, EditSession.Role.TARGET);
        if (session == null) {
            return;
        }
        ctx.contentType("text/plain; charset=utf-8").result(editor.preview().pendingChanges(session));
    }

    private void backgroundSaveStatus(Context ctx) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("enabled", editor.config().isBackgroundSave());
        body.put("status", editor.backgroundSave().getStatus());
        ctx.json(body);
    }

    private Map<String, Object> describe(EditSession session) {
        Map<String, Object> body = new LinkedHashMap<>();
        synchronized (session) {
            body.put("role", session.getRole());
            body.put("path", editor.workspace().toRelativePath(session.getSourcePath()));
            body.put("version", session.getVersion());
            body.put("dirty", session.isDirty());
            body.put("selectedSystemKey", session.getSelectedSystemKey());
            body.put("tree", session.getTree());
            body.put("emitterCount", session.getTree().emitterCount());
            body.put("deletedEmitters", session.getDeletedEmitters());
            body.put("recentlyCreated", session.getRecentlyCreated());
            body.put("undoDepth", session.getHistory().size());
            body.put("hashedContent", session.isHashedContent());
            body.put("warnings", session.getWarnings());
            body.put("compilerConfigured", editor.compiler().isConfigured());
        }
        return body;
    }
}
