package com.vfxport.session;

import com.vfxport.models.DeletedEmitterRecord;
import com.vfxport.models.UndoSnapshot;
import com.vfxport.models.VfxSystem;
import com.vfxport.models.VfxTree;
import com.vfxport.tree.PropertyTreeParser;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * State of one opened file: its text, the tree derived from it, the
 * selection, deletion records and undo history.
 * <p>
 * Text and tree only change together, under this object's monitor. Every
 * change bumps {@link #getVersion()}, which asynchronous work (background
 * save) compares against before acting on text it captured earlier.
 */
public class EditSession {

    public enum Role { TARGET, DONOR }

    private final Role role;
    private final Path sourcePath;
    private final Path textPath;
    private final Path binPath;
    private final UndoHistory history;

    private String fileText;
    private VfxTree tree;
    private String selectedSystemKey;
    private final Set<DeletedEmitterRecord> deletedEmitters = new LinkedHashSet<>();
    private final Set<String> recentlyCreated = new LinkedHashSet<>();
    private final List<String> warnings = new ArrayList<>();
    private boolean hashedContent;

    private long version;
    private long savedVersion;
    private String savedText;

    public EditSession(Role role, Path sourcePath, Path textPath, Path binPath, String fileText, int historyLimit) {
        this.role = role;
        this.sourcePath = sourcePath;
        this.textPath = textPath;
        this.binPath = binPath;
        this.history = new UndoHistory(historyLimit);
        this.fileText = fileText;
        this.tree = PropertyTreeParser.parse(fileText);
        this.savedText = fileText;
    }

    public Role getRole() { return role; }
    public Path getSourcePath() { return sourcePath; }
    public Path getTextPath() { return textPath; }
    public Path getBinPath() { return binPath; }

    public synchronized String getFileText() { return fileText; }
    public synchronized VfxTree getTree() { return tree; }
    public synchronized String getSelectedSystemKey() { return selectedSystemKey; }
    public synchronized long getVersion() { return version; }
    public synchronized String getSavedText() { return savedText; }

    public synchronized boolean isDirty() {
        return version != savedVersion;
    }

    public synchronized Set<DeletedEmitterRecord> getDeletedEmitters() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(deletedEmitters));
    }

    public synchronized boolean isDeleted(String systemKey, String emitterName) {
        return deletedEmitters.contains(new DeletedEmitterRecord(systemKey, emitterName));
    }

    public synchronized Set<String> getRecentlyCreated() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(recentlyCreated));
    }

    public synchronized List<String> getWarnings() {
        return List.copyOf(warnings);
    }

    public synchronized void addWarning(String warning) {
        warnings.add(warning);
    }

    public synchronized boolean isHashedContent() { return hashedContent; }
    public synchronized void setHashedContent(boolean hashedContent) { this.hashedContent = hashedContent; }

    public UndoHistory getHistory() {
        return history;
    }

    public synchronized Optional<VfxSystem> findSystem(String key) {
        return Optional.ofNullable(key == null ? null : tree.getSystem(key));
    }

    /**
     * Selects a system. Selection alone is not an undo step.
     *
     * @return false when the key is not in the tree
     */
    public synchronized boolean select(String systemKey) {
        if (systemKey == null) {
            selectedSystemKey = null;
            return true;
        }
        if (tree.getSystem(systemKey) == null) {
            return false;
        }
        selectedSystemKey = systemKey;
        return true;
    }

    /**
     * Records a snapshot of the current state, then installs the change and
     * re-derives the tree.
     *
     * @return the new version
     */
    public synchronized long apply(SessionChange change) {
        history.push(snapshot(change.getDescription()));
        fileText = change.getFileText();
        tree = PropertyTreeParser.parse(fileText);

        for (Map.Entry<String, String> rename : change.getRenamedKeys().entrySet()) {
            rekey(rename.getKey(), rename.getValue());
        }
        deletedEmitters.removeAll(change.getRestored());
        deletedEmitters.addAll(change.getDeleted());
        if (!change.getCreatedKeys().isEmpty()) {
            recentlyCreated.clear();
            recentlyCreated.addAll(change.getCreatedKeys());
        }
        if (change.isSelects()) {
            selectedSystemKey = change.getSelectedSystemKey();
        }
        if (selectedSystemKey != null && tree.getSystem(selectedSystemKey) == null) {
            selectedSystemKey = null;
        }
        recentlyCreated.removeIf(key -> tree.getSystem(key) == null);
        version++;
        return version;
    }

    /**
     * Restores the most recent snapshot. The restore itself is not recorded.
     */
    public synchronized Optional<UndoSnapshot> undo() {
        Optional<UndoSnapshot> popped = history.pop();
        popped.ifPresent(snapshot -> {
            fileText = snapshot.getFileText();
            tree = snapshot.getTree().copy();
            selectedSystemKey = snapshot.getSelectedSystemKey();
            deletedEmitters.clear();
            deletedEmitters.addAll(snapshot.getDeletedEmitters());
            recentlyCreated.removeIf(key -> tree.getSystem(key) == null);
            version++;
        });
        return popped;
    }

    /**
     * Marks {@code text} as written to disk. The tree is re-derived from the
     * live text and deletion records are discarded, since the saved file no
     * longer contains the deleted emitters to resurrect.
     */
    public synchronized void markSaved(long savedAtVersion, String text) {
        this.savedText = text;
        this.savedVersion = savedAtVersion;
        if (savedAtVersion == version) {
            tree = PropertyTreeParser.parse(fileText);
            deletedEmitters.clear();
        }
    }

    synchronized UndoSnapshot snapshot(String description) {
        return new UndoSnapshot(tree.copy(), fileText, selectedSystemKey, deletedEmitters,
            System.currentTimeMillis(), description);
    }

    private void rekey(String oldKey, String newKey) {
        if (oldKey.equals(selectedSystemKey)) {
            selectedSystemKey = newKey;
        }
        if (recentlyCreated.remove(oldKey)) {
            recentlyCreated.add(newKey);
        }
        List<DeletedEmitterRecord> moved = new ArrayList<>();
        deletedEmitters.removeIf(record -> {
            if (oldKey.equals(record.getSystemKey())) {
                moved.add(new DeletedEmitterRecord(newKey, record.getEmitterName()));
                return true;
            }
            return false;
        });
        deletedEmitters.addAll(moved);
    }
}
