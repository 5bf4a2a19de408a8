package com.vfxport;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vfxport.controllers.Controller;
import com.vfxport.controllers.EffectController;
import com.vfxport.controllers.MaterialController;
import com.vfxport.controllers.PortController;
import com.vfxport.controllers.SessionController;
import com.vfxport.controllers.SystemController;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.io.FileNotFoundException;
import java.util.List;
import java.util.Map;

public class Main {

    private static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            // Parse configuration from args and environment
            AppConfig config = new AppConfig.Builder()
                    .environment(System.getenv())
                    .parseArgs(args)
                    .build();

            // Initialize logging
            AppLogger.initialize(config.getLogPath(), config.isDevMode());
            logger = AppLogger.get();

            printBanner(config);

            EditorContext editor = new EditorContext(config, objectMapper);

            Javalin app = Javalin.create(cfg -> {
                cfg.jsonMapper(new JavalinJackson(objectMapper));
                cfg.http.defaultContentType = "application/json";
            });

            List<Controller> controllers = List.of(
                new SessionController(editor, objectMapper),
                new SystemController(editor, objectMapper),
                new PortController(editor, objectMapper),
                new EffectController(editor, objectMapper),
                new MaterialController(editor, objectMapper)
            );
            for (Controller controller : controllers) {
                controller.registerRoutes(app);
            }

            registerExceptionHandlers(app);

            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Workspace: " + config.getWorkspacePath());
            logger.console("  Log file: " + config.getLogPath());
            logger.console("  ritobin: " + (config.getRitobinPath() == null ? "not configured" : config.getRitobinPath()));
            logger.console("");
            logger.console("========================================");
            logger.console("  Press Ctrl+C to stop");
            logger.console("========================================");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                editor.shutdown();
                app.stop();
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start VFX Port: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  VFX Port v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
        if (config.isBackgroundSave()) {
            logger.console("  Background save: " + config.getSaveDelayMs() + " ms");
        }
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(FileNotFoundException.class, (e, ctx) -> {
            logger.warn("File not found: " + e.getMessage());
            ctx.status(404).json(Controller.errorBody(e));
        });

        app.exception(SecurityException.class, (e, ctx) -> {
            logger.warn("Security violation: " + e.getMessage());
            ctx.status(403).json(Controller.errorBody(e));
        });

        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            logger.warn("Bad request: " + e.getMessage());
            ctx.status(400).json(Controller.errorBody(e));
        });

        app.exception(Exception.class, (e, ctx) -> {
            logger.error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Map.of("error", String.valueOf(e.getMessage())));
        });
    }
}
