package com.fppast;

import com.fppast.loc.LocationRegistry;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * State owned by one translation run: the location registry and the counter used for
 * nodes built locally rather than decoded from input.
 *
 * <p>Sessions share nothing, so independent runs (tests, several files at once) never
 * see each other's ids or locations.</p>
 */
public final class TranslationSession {

    private final LocationRegistry locations;
    private final AtomicInteger nextId;
    private final boolean parallelMembers;

    private TranslationSession(LocationRegistry locations, AtomicInteger nextId, boolean parallelMembers) {
        this.locations = locations;
        this.nextId = nextId;
        this.parallelMembers = parallelMembers;
    }

    /**
     * Creates a session over an already loaded registry. Fresh ids start after the largest
     * id the registry knows, so they cannot collide with decoded ones.
     */
    public static TranslationSession create(LocationRegistry locations) {
        return create(locations, locations.maxId().map(id -> id + 1).orElse(0));
    }

    public static TranslationSession create() {
        return create(new LocationRegistry());
    }

    public static TranslationSession create(LocationRegistry locations, int firstFreshId) {
        return new TranslationSession(locations, new AtomicInteger(firstFreshId), false);
    }

    /**
     * Returns a session sharing this one's registry and counter with parallel decoding of
     * sibling members switched on or off.
     */
    public TranslationSession withParallelMembers(boolean parallel) {
        return new TranslationSession(locations, nextId, parallel);
    }

    public int nextId() {
        return nextId.getAndIncrement();
    }

    public LocationRegistry locations() {
        return locations;
    }

    public boolean parallelMembers() {
        return parallelMembers;
    }
}
