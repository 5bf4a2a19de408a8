package com.vfxport.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vfxport.AppLogger;
import com.vfxport.EditorContext;
import com.vfxport.models.Material;
import com.vfxport.mutations.MutationOutcome;
import com.vfxport.session.EditSession;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class MaterialController implements Controller {

    private final EditorContext editor;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public MaterialController(EditorContext editor, ObjectMapper objectMapper) {
        this.editor = editor;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/materials", this::listMaterials);
        app.post("/api/materials/color", this::setColor);
    }

    private void listMaterials(Context ctx) {
        EditSession target = SessionLookup.require(editor, ctx, EditSession.Role.TARGET);
        if (target == null) {
            return;
        }
        List<Material> materials;
        synchronized (target) {
            materials = new ArrayList<>(target.getTree().getMaterials().values());
        }
        ctx.json(Map.of("materials", materials));
    }

    private void setColor(Context ctx) {
        EditSession target = SessionLookup.require(editor, ctx, EditSession.Role.TARGET);
        if (target == null) {
            return;
        }
        try {
            JsonNode json = objectMapper.readTree(ctx.body());
            JsonNode rgbaNode = json.path("rgba");
            if (!rgbaNode.isArray()) {
                ctx.status(400).json(Map.of("error", "rgba must be an array of 4 numbers"));
                return;
            }
            double[] rgba = new double[rgbaNode.size()];
            for (int i = 0; i < rgba.length; i++) {
                rgba[i] = rgbaNode.get(i).asDouble(Double.NaN);
            }
            MutationOutcome outcome = editor.materials().setValue(target,
                SessionLookup.text(json, "materialKey"), SessionLookup.text(json, "param"), rgba);
            if (outcome.isSuccess()) {
                editor.afterTargetEdit();
            }
            Controller.respond(ctx, outcome);
        } catch (Exception e) {
            logger.error("Material edit failed: " + e.getMessage(), e);
            ctx.status(400).json(Controller.errorBody(e));
        }
    }
}
