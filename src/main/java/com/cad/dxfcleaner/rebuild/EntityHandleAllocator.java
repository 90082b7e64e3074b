package com.cad.dxfcleaner.rebuild;

import java.util.Locale;

/**
 * Hands out entity handles from a monotonically increasing counter, as
 * upper-case hex. Values already claimed in the registry are skipped, so the
 * sequence stays strictly increasing but may have gaps. One allocator serves
 * one rebuild.
 */
public class EntityHandleAllocator {

    public static final int DEFAULT_START = 50;

    private final HandleRegistry registry;
    private int next;
    private int allocated;

    public EntityHandleAllocator(int start, HandleRegistry registry) {
        if (start < 1) {
            throw new IllegalArgumentException("Entity handle counter must start at 1 or above, got " + start);
        }
        this.next = start;
        this.registry = registry;
    }

    public String next() {
        String handle = toHex(next++);
        while (!registry.claim(handle)) {
            handle = toHex(next++);
        }
        allocated++;
        return handle;
    }

    public int getAllocated() {
        return allocated;
    }

    private static String toHex(int value) {
        return Integer.toHexString(value).toUpperCase(Locale.ROOT);
    }
}
