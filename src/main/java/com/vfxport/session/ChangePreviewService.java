package com.vfxport.session;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;

import java.util.Arrays;
import java.util.List;

/**
 * Unified diff of unsaved edits against the last saved text.
 */
public class ChangePreviewService {

    private static final int CONTEXT_LINES = 3;

    public String pendingChanges(EditSession session) {
        String saved;
        String live;
        synchronized (session) {
            saved = session.getSavedText();
            live = session.getFileText();
        }
        return diff(session.getTextPath().getFileName().toString(), saved, live);
    }

    public String diff(String fileName, String before, String after) {
        List<String> original = lines(before);
        List<String> revised = lines(after);
        var patch = DiffUtils.diff(original, revised);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }
        List<String> unified = UnifiedDiffUtils.generateUnifiedDiff(fileName, fileName, original, patch, CONTEXT_LINES);
        return String.join("\n", unified);
    }

    private static List<String> lines(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(text.split("\r?\n", -1));
    }
}
