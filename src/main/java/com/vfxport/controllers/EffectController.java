package com.vfxport.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vfxport.AppLogger;
import com.vfxport.EditorContext;
import com.vfxport.effects.ChildParticleOptions;
import com.vfxport.effects.PersistentCondition;
import com.vfxport.mutations.MutationOutcome;
import com.vfxport.session.EditSession;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Idle, child and persistent particle effects on the target.
 */
public class EffectController implements Controller {

    private final EditorContext editor;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public EffectController(EditorContext editor, ObjectMapper objectMapper) {
        this.editor = editor;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/effects/idle", this::getIdle);
        app.post("/api/effects/idle", this::setIdle);
        app.get("/api/effects/child", this::getChild);
        app.post("/api/effects/child", this::addChild);
        app.put("/api/effects/child", this::updateChild);
        app.get("/api/effects/persistent", this::listPersistent);
        app.post("/api/effects/persistent", this::savePersistent);
        app.delete("/api/effects/persistent/{index}", this::removePersistent);
    }

    private void getIdle(Context ctx) {
        EditSession target = SessionLookup.require(editor, ctx, EditSession.Role.TARGET);
        if (target == null) {
            return;
        }
        String systemKey = ctx.queryParam("system");
        ctx.json(Map.of("bones", editor.effects().idleBones(target, systemKey)));
    }

    private void setIdle(Context ctx) {
        EditSession target = SessionLookup.require(editor, ctx, EditSession.Role.TARGET);
        if (target == null) {
            return;
        }
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            List<String> bones = new ArrayList<>();
            if (json.has("bones") && json.get("bones").isArray()) {
                json.get("bones").forEach(node -> bones.add(node.asText()));
            }
            finish(ctx, editor.effects().setIdleParticles(target, SessionLookup.text(json, "systemKey"), bones));
        } catch (Exception e) {
            logger.error("Idle particle edit failed: " + e.getMessage(), e);
            ctx.status(400).json(Controller.errorBody(e));
        }
    }

    private void getChild(Context ctx) {
        EditSession target = SessionLookup.require(editor, ctx, EditSession.Role.TARGET);
        if (target == null) {
            return;
        }
        String systemKey = ctx.queryParam("system");
        String emitterName = ctx.queryParam("emitter");
        if (emitterName == null) {
            ctx.json(Map.of("children", editor.effects().childParticles(target, systemKey)));
            return;
        }
        Optional<ChildParticleOptions> options = editor.effects().readChildParticle(target, systemKey, emitterName);
        if (options.isEmpty()) {
            ctx.status(404).json(Map.of("error", "No child particle emitter named " + emitterName));
            return;
        }
        ctx.json(options.get());
    }

    private void addChild(Context ctx) {
        EditSession target = SessionLookup.require(editor, ctx, EditSession.Role.TARGET);
        if (target == null) {
            return;
        }
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            ChildParticleOptions options = objectMapper.treeToValue(json.path("options"), ChildParticleOptions.class);
            finish(ctx, editor.effects().addChildParticle(target, SessionLookup.text(json, "systemKey"), options));
        } catch (Exception e) {
            logger.error("Add child particle failed: " + e.getMessage(), e);
            ctx.status(400).json(Controller.errorBody(e));
        }
    }

    private void updateChild(Context ctx) {
        EditSession target = SessionLookup.require(editor, ctx, EditSession.Role.TARGET);
        if (target == null) {
            return;
        }
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            ChildParticleOptions options = objectMapper.treeToValue(json.path("options"), ChildParticleOptions.class);
            finish(ctx, editor.effects().updateChildParticle(target, SessionLookup.text(json, "systemKey"),
                SessionLookup.text(json, "emitterName"), options));
        } catch (Exception e) {
            logger.error("Edit child particle failed: " + e.getMessage(), e);
            ctx.status(400).json(Controller.errorBody(e));
        }
    }

    private void listPersistent(Context ctx) {
        EditSession target = SessionLookup.require(editor, ctx, EditSession.Role.TARGET);
        if (target == null) {
            return;
        }
        ctx.json(Map.of("conditions", editor.effects().persistentEffects(target)));
    }

    private void savePersistent(Context ctx) {
        EditSession target = SessionLookup.require(editor, ctx, EditSession.Role.TARGET);
        if (target == null) {
            return;
        }
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            PersistentCondition condition = objectMapper.treeToValue(json.path("condition"), PersistentCondition.class);
            Integer editIndex = json.hasNonNull("editIndex") ? json.get("editIndex").asInt() : null;
            finish(ctx, editor.effects().savePersistentEffect(target, condition, editIndex));
        } catch (Exception e) {
            logger.error("Persistent effect edit failed: " + e.getMessage(), e);
            ctx.status(400).json(Controller.errorBody(e));
        }
    }

    private void removePersistent(Context ctx) {
        EditSession target = SessionLookup.require(editor, ctx, EditSession.Role.TARGET);
        if (target == null) {
            return;
        }
        int index = Integer.parseInt(ctx.pathParam("index"));
        finish(ctx, editor.effects().removePersistentEffect(target, index));
    }

    private void finish(Context ctx, MutationOutcome outcome) {
        if (outcome.isSuccess()) {
            editor.afterTargetEdit();
        }
        Controller.respond(ctx, outcome);
    }
}
