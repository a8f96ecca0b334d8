package sk.pcola.dedup.catalog;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import sk.pcola.dedup.config.IngestConfig;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Vzájomné vylúčenie podľa fingerprintu.
 *
 * Fingerprinty sa mapujú na pevný počet zámkov (stripes). Rovnaký fingerprint vždy padne
 * na rovnaký zámok, nesúvisiace fingerprinty bežia paralelne. Pri stripes = 1 ide
 * o jeden globálny zámok.
 */
@Component
public class FingerprintLocks {

    private final ReentrantLock[] stripes;

    @Autowired
    public FingerprintLocks(IngestConfig config) {
        this(config.getLockStripes());
    }

    public FingerprintLocks(int stripeCount) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("Lock stripe count must be >= 1, got " + stripeCount);
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    /**
     * Vykoná action pod zámkom pre daný fingerprint.
     */
    public <T> T withLock(String fingerprint, Supplier<T> action) {
        ReentrantLock lock = lockFor(fingerprint);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public int stripeCount() {
        return stripes.length;
    }

    ReentrantLock lockFor(String fingerprint) {
        return stripes[Math.floorMod(fingerprint.hashCode(), stripes.length)];
    }
}
