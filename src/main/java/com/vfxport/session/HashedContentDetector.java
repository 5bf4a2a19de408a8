package com.vfxport.session;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic for text converted without a hash table: field names come out
 * as {@code 0x1234abcd:} instead of readable names. Such files still edit,
 * but names shown to the user are hashes.
 */
public final class HashedContentDetector {

    static final int MIN_HASHED_FIELDS = 10;
    static final double HASHED_RATIO = 0.3;
    static final int SPARSE_READABLE_KINDS = 3;
    static final int SPARSE_HASHED_FIELDS = 20;

    private static final Pattern HASHED_FIELD = Pattern.compile("0x[0-9a-fA-F]{8}\\s*:");

    private static final List<String> READABLE_FIELDS = List.of(
        "type:", "version:", "linked:", "entries:", "particleName:", "emitterName:",
        "texture:", "color:", "birthColor:", "fresnelColor:", "lingerColor:",
        "blendMode:", "constantValue:", "values:", "times:", "VfxSystemDefinitionData",
        "VfxEmitterDefinitionData", "ValueColor", "list[", "map[", "embed =",
        "string =", "u32 =", "f32 =", "vec4 =", "vec3 =", "vec2 =", "bool =");

    private HashedContentDetector() {
    }

    public static Result analyze(String content) {
        if (content == null || content.isEmpty()) {
            return new Result(0, 0, 0, false);
        }
        int hashed = 0;
        Matcher m = HASHED_FIELD.matcher(content);
        while (m.find()) {
            hashed++;
        }
        String lower = content.toLowerCase(Locale.ROOT);
        int kinds = 0;
        int occurrences = 0;
        for (String field : READABLE_FIELDS) {
            int count = countOccurrences(lower, field.toLowerCase(Locale.ROOT));
            if (count > 0) {
                kinds++;
                occurrences += count;
            }
        }
        boolean looksHashed = hashed >= MIN_HASHED_FIELDS
            && (hashed > occurrences * HASHED_RATIO
                || (kinds < SPARSE_READABLE_KINDS && hashed > SPARSE_HASHED_FIELDS));
        return new Result(hashed, kinds, occurrences, looksHashed);
    }

    public static boolean isHashed(String content) {
        return analyze(content).isHashed();
    }

    private static int countOccurrences(String haystack, String needle) {
        int count = 0;
        int from = 0;
        while ((from = haystack.indexOf(needle, from)) >= 0) {
            count++;
            from += needle.length();
        }
        return count;
    }

    public static final class Result {
        private final int hashedFields;
        private final int readableKinds;
        private final int readableOccurrences;
        private final boolean hashed;

        Result(int hashedFields, int readableKinds, int readableOccurrences, boolean hashed) {
            this.hashedFields = hashedFields;
            this.readableKinds = readableKinds;
            this.readableOccurrences = readableOccurrences;
            this.hashed = hashed;
        }

        public int getHashedFields() { return hashedFields; }
        public int getReadableKinds() { return readableKinds; }
        public int getReadableOccurrences() { return readableOccurrences; }
        public boolean isHashed() { return hashed; }
    }
}
