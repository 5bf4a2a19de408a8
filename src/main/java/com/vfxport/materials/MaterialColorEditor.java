package com.vfxport.materials;

import com.vfxport.AppLogger;
import com.vfxport.models.ColorParam;
import com.vfxport.models.Material;
import com.vfxport.mutations.EditErrorKind;
import com.vfxport.mutations.MutationOutcome;
import com.vfxport.session.EditSession;
import com.vfxport.session.SessionChange;
import com.vfxport.tree.LineIndex;
import com.vfxport.tree.TextLines;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Edits a material parameter's {@code value: vec4} by patching the single
 * line that holds it.
 */
public class MaterialColorEditor {

    private static final Pattern VEC4_VALUE = Pattern.compile("[Vv]alue:\\s*vec4\\s*=\\s*\\{[^}]+\\}");

    private final AppLogger logger = AppLogger.get();

    public MutationOutcome setValue(EditSession session, String materialKey, String paramName, double[] rgba) {
        if (rgba == null || rgba.length != 4) {
            return MutationOutcome.failure(EditErrorKind.INVALID_INPUT, "A color needs exactly 4 components");
        }
        for (double component : rgba) {
            if (Double.isNaN(component) || Double.isInfinite(component)) {
                return MutationOutcome.failure(EditErrorKind.INVALID_INPUT, "Color components must be finite numbers");
            }
        }
        synchronized (session) {
            Material material = session.getTree().getMaterials().get(materialKey);
            if (material == null) {
                return MutationOutcome.failure(EditErrorKind.NOT_FOUND, "Material not found: " + materialKey);
            }
            ColorParam param = material.findParam(paramName);
            if (param == null) {
                return MutationOutcome.failure(EditErrorKind.NOT_FOUND, "Parameter not found: " + paramName);
            }
            String text = session.getFileText();
            LineIndex lines = new LineIndex(text);
            int start = lines.lineStart(param.getValueLine());
            int end = param.getValueLine() < lines.lineCount() ? lines.lineStart(param.getValueLine() + 1) : text.length();
            String line = text.substring(start, end);
            Matcher m = VEC4_VALUE.matcher(line);
            if (!m.find()) {
                return MutationOutcome.failure(EditErrorKind.MALFORMED, "No vec4 value on line " + param.getValueLine());
            }
            String vec4 = "value: vec4 = { " + TextLines.formatNumber(rgba[0]) + ", " + TextLines.formatNumber(rgba[1])
                + ", " + TextLines.formatNumber(rgba[2]) + ", " + TextLines.formatNumber(rgba[3]) + " }";
            String patched = line.substring(0, m.start()) + vec4 + line.substring(m.end());
            String updated = text.substring(0, start) + patched + text.substring(end);

            String description = "Edit " + material.getName() + "." + paramName;
            long version = session.apply(new SessionChange(updated, description));
            if (logger != null) {
                logger.info("[MaterialColorEditor] " + description);
            }
            return MutationOutcome.success("Updated " + paramName, description, version);
        }
    }
}
