package com.vfxport;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vfxport.effects.EffectService;
import com.vfxport.external.BinCompiler;
import com.vfxport.external.ProjectAssetCopier;
import com.vfxport.external.RitobinCompiler;
import com.vfxport.materials.MaterialColorEditor;
import com.vfxport.mutations.BulkPortMonitor;
import com.vfxport.mutations.PortService;
import com.vfxport.mutations.VfxMutationService;
import com.vfxport.session.BackgroundSaveScheduler;
import com.vfxport.session.ChangePreviewService;
import com.vfxport.session.EditSession;
import com.vfxport.session.SaveService;
import com.vfxport.session.SessionLoader;

import java.util.Optional;

/**
 * Runtime holder for the editor's services and the two open sessions: the
 * target being edited and the donor effects are ported from.
 */
public class EditorContext {
    private final AppConfig config;
    private final ObjectMapper objectMapper;
    private final WorkspaceService workspaceService;
    private final BinCompiler compiler;
    private final SessionLoader loader;
    private final SaveService saveService;
    private final BackgroundSaveScheduler backgroundSave;
    private final ChangePreviewService preview;
    private final VfxMutationService mutations;
    private final PortService ports;
    private final EffectService effects;
    private final MaterialColorEditor materials;
    private volatile EditSession target;
    private volatile EditSession donor;
    private volatile BulkPortMonitor currentPort;
    private final AppLogger logger = AppLogger.get();

    public EditorContext(AppConfig config, ObjectMapper objectMapper) {
        this(config, objectMapper, new RitobinCompiler(config.getRitobinPath()));
    }

    public EditorContext(AppConfig config, ObjectMapper objectMapper, BinCompiler compiler) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.workspaceService = new WorkspaceService(config.getWorkspacePath());
        this.compiler = compiler;
        this.loader = new SessionLoader(workspaceService, compiler, config.getHistoryLimit());
        this.saveService = new SaveService(workspaceService, compiler);
        this.backgroundSave = new BackgroundSaveScheduler(saveService, config.getSaveDelayMs());
        this.preview = new ChangePreviewService();
        this.mutations = new VfxMutationService();
        this.ports = new PortService(new ProjectAssetCopier(workspaceService));
        this.effects = new EffectService();
        this.materials = new MaterialColorEditor();
        if (logger != null) {
            logger.info("Editor context ready for " + workspaceService.getWorkspaceRoot()
                + (compiler.isConfigured() ? "" : " (ritobin not configured)"));
        }
    }

    public AppConfig config() {
        return config;
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    public WorkspaceService workspace() {
        return workspaceService;
    }

    public BinCompiler compiler() {
        return compiler;
    }

    public SessionLoader loader() {
        return loader;
    }

    public SaveService saves() {
        return saveService;
    }

    public BackgroundSaveScheduler backgroundSave() {
        return backgroundSave;
    }

    public ChangePreviewService preview() {
        return preview;
    }

    public VfxMutationService mutations() {
        return mutations;
    }

    public PortService ports() {
        return ports;
    }

    public EffectService effects() {
        return effects;
    }

    public MaterialColorEditor materials() {
        return materials;
    }

    public Optional<EditSession> target() {
        return Optional.ofNullable(target);
    }

    public Optional<EditSession> donor() {
        return Optional.ofNullable(donor);
    }

    public void open(EditSession session) {
        if (session.getRole() == EditSession.Role.TARGET) {
            backgroundSave.cancelPending();
            target = session;
        } else {
            donor = session;
        }
    }

    /** Called after every successful edit of the target. */
    public void afterTargetEdit() {
        EditSession current = target;
        if (current != null && config.isBackgroundSave()) {
            backgroundSave.schedule(current);
        }
    }

    public BulkPortMonitor startBulkPort() {
        BulkPortMonitor monitor = new BulkPortMonitor();
        currentPort = monitor;
        return monitor;
    }

    public Optional<BulkPortMonitor> currentPort() {
        return Optional.ofNullable(currentPort);
    }

    public void shutdown() {
        backgroundSave.stop();
    }
}
