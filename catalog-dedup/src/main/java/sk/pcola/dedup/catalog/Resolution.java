package sk.pcola.dedup.catalog;

import java.util.List;

/**
 * Výsledok rozhodnutia resolvera pre jeden riadok.
 */
public record Resolution(Action action, String fingerprint, List<SoftConflict> conflicts) {

    public enum Action {
        INSERTED,
        UPDATED,
        UNCHANGED
    }

    public Resolution {
        conflicts = List.copyOf(conflicts);
    }

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }
}
