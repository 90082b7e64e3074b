package com.cad.dxfcleaner.rebuild;

import com.cad.dxfcleaner.model.DxfEntity;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Record handles in use in one rebuilt drawing.
 *
 * Starts with the null handle and the handles fixed by the skeleton and the
 * built-in templates. Captured entity handles, regenerated layer handles and
 * synthesized entity handles are claimed as they are decided, so no two
 * records end up sharing a handle. Comparison ignores hex digit case.
 */
public class HandleRegistry {

    /** Null handle; never a valid record handle. */
    public static final String NULL_HANDLE = "0";

    private final Set<String> taken = new HashSet<>();

    public HandleRegistry() {
        taken.add(NULL_HANDLE);
        taken.addAll(StructuralSkeleton.RESERVED_HANDLES);
    }

    /**
     * Registry seeded with the handles the given entities already carry.
     */
    public static HandleRegistry withCapturedHandles(List<DxfEntity> entities) {
        HandleRegistry registry = new HandleRegistry();
        for (DxfEntity entity : entities) {
            entity.getHandle().ifPresent(registry::claim);
        }
        return registry;
    }

    public boolean isTaken(String handle) {
        return taken.contains(normalize(handle));
    }

    /**
     * @return false when the handle was already taken
     */
    public boolean claim(String handle) {
        return taken.add(normalize(handle));
    }

    private static String normalize(String handle) {
        return handle.toUpperCase(Locale.ROOT);
    }
}
