package com.vfxport.naming;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Picks names that do not collide with names already taken.
 */
public final class UniqueNameResolver {

    private UniqueNameResolver() {
    }

    /**
     * Returns {@code desired} when free, otherwise {@code desired_N} with the
     * smallest {@code N >= 1} not in {@code taken}.
     */
    public static String resolve(String desired, Collection<String> taken) {
        if (!taken.contains(desired)) {
            return desired;
        }
        int n = 1;
        while (taken.contains(desired + "_" + n)) {
            n++;
        }
        return desired + "_" + n;
    }

    /**
     * Resolves a batch in order; every returned name is also reserved for the
     * names that follow it.
     */
    public static List<String> resolveAll(List<String> desired, Collection<String> taken) {
        Set<String> reserved = new HashSet<>(taken);
        List<String> result = new ArrayList<>(desired.size());
        for (String name : desired) {
            String unique = resolve(name, reserved);
            reserved.add(unique);
            result.add(unique);
        }
        return result;
    }
}
