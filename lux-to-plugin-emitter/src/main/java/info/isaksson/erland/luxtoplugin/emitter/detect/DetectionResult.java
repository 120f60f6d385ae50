package info.isaksson.erland.luxtoplugin.emitter.detect;

import info.isaksson.erland.luxtoplugin.emitter.Backend;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Required-support markers per backend. Immutable, so both backend pipelines may read it
 * concurrently.
 */
public final class DetectionResult {

    private final Set<SupportMarker> all;
    private final Map<Backend, Set<SupportMarker>> perBackend;

    public DetectionResult(Set<SupportMarker> detected) {
        EnumSet<SupportMarker> copy = detected == null || detected.isEmpty()
                ? EnumSet.noneOf(SupportMarker.class)
                : EnumSet.copyOf(detected);
        this.all = Collections.unmodifiableSet(copy);
        Map<Backend, Set<SupportMarker>> map = new EnumMap<>(Backend.class);
        for (Backend b : Backend.values()) {
            EnumSet<SupportMarker> forBackend = EnumSet.noneOf(SupportMarker.class);
            for (SupportMarker m : copy) {
                if (m.appliesTo(b)) forBackend.add(m);
            }
            map.put(b, Collections.unmodifiableSet(forBackend));
        }
        this.perBackend = Collections.unmodifiableMap(map);
    }

    public static DetectionResult empty() {
        return new DetectionResult(null);
    }

    public Set<SupportMarker> markers(Backend backend) {
        return perBackend.get(backend);
    }

    public boolean has(Backend backend, SupportMarker marker) {
        return perBackend.get(backend).contains(marker);
    }

    /** Every marker found, regardless of backend. */
    public Set<SupportMarker> all() {
        return all;
    }

    @Override
    public String toString() {
        return "DetectionResult" + perBackend;
    }
}
