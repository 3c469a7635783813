package gamefleet.hub.registry;

import gamefleet.core.FleetException;
import gamefleet.hub.heartbeat.HeartbeatStateMachine;
import gamefleet.hub.model.HeartbeatSample;
import gamefleet.hub.model.Spoke;
import gamefleet.hub.model.SpokeStatus;
import gamefleet.hub.model.TransitionEvent;
import gamefleet.hub.repository.SpokeRepository;
import gamefleet.security.ApiKeys;
import gamefleet.security.IdentityStore;
import gamefleet.security.SpokeIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * Authoritative table of registered spokes.
 *
 * <p>Each record has its own lock; there is no registry-wide lock. Registrations for
 * the same address are serialized on an address stripe, which is always taken before
 * a record lock. Every change is written to the {@link SpokeRepository} first and only
 * then made visible in memory, so a failed write leaves the previous state in place.
 */
public final class FleetRegistry implements IdentityStore {

    private static final Logger log = LoggerFactory.getLogger(FleetRegistry.class);

    private static final Pattern IP_LITERAL = Pattern.compile("[0-9A-Fa-f:.]+");

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        final Deque<HeartbeatSample> samples = new ArrayDeque<>();
        volatile Spoke spoke;
        boolean removed;

        Entry(Spoke spoke) {
            this.spoke = spoke;
        }
    }

    private final SpokeRepository repository;
    private final HeartbeatStateMachine stateMachine;
    private final Clock clock;
    private final int historySize;

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    // normalized address -> spoke id
    private final ConcurrentHashMap<String, String> byAddress = new ConcurrentHashMap<>();
    private final List<FleetListener> listeners = new CopyOnWriteArrayList<>();
    // serializes registrations per address; taken before any entry lock, never after
    private final ReentrantLock[] addressStripes = new ReentrantLock[32];

    public FleetRegistry(SpokeRepository repository, HeartbeatStateMachine stateMachine, Clock clock, int historySize) {
        this.repository = repository;
        this.stateMachine = stateMachine;
        this.clock = clock;
        this.historySize = historySize;
        for (int i = 0; i < addressStripes.length; i++) {
            addressStripes[i] = new ReentrantLock();
        }
    }

    /**
     * Load persisted spokes into memory. Called once at start-up.
     *
     * @return number of spokes loaded
     */
    public int loadPersisted() {
        List<Spoke> stored = repository.findAll();
        for (Spoke spoke : stored) {
            entries.put(spoke.id(), new Entry(spoke));
            byAddress.put(normalizeAddress(spoke.address()), spoke.id());
        }
        log.info("Loaded {} spokes from storage", stored.size());
        return stored.size();
    }

    public void addListener(FleetListener listener) {
        listeners.add(listener);
    }

    /**
     * Register a spoke, or update the one already registered at the same address.
     *
     * @throws FleetException INVALID_REQUEST when a field is missing or malformed
     */
    public RegistrationResult register(RegistrationRequest request) {
        validate(request);
        String name = request.name().trim();
        String address = request.address().trim();
        String keyHash = ApiKeys.hash(request.apiKey());
        String allowedIp = blankToNull(request.allowedSourceIp());
        String normalized = normalizeAddress(address);

        Spoke created = null;
        String id;
        ReentrantLock stripe = addressStripe(normalized);
        stripe.lock();
        try {
            String existingId = byAddress.get(normalized);
            Entry existing = existingId != null ? entries.get(existingId) : null;
            if (existing != null && updateRegistration(existing, name, keyHash, allowedIp)) {
                id = existingId;
            } else {
                created = Spoke.builder()
                        .id(UUID.randomUUID().toString())
                        .name(name)
                        .address(address)
                        .apiKeyHash(keyHash)
                        .allowedSourceIp(allowedIp)
                        .status(SpokeStatus.PENDING)
                        .registeredAt(clock.instant())
                        .registrationSeq(repository.nextRegistrationSeq())
                        .build();
                repository.save(created);
                entries.put(created.id(), new Entry(created));
                byAddress.put(normalized, created.id());
                id = created.id();
            }
        } finally {
            stripe.unlock();
        }

        if (created != null) {
            log.info("Registered spoke {} ({}) at {}", name, id, address);
            if (allowedIp == null) {
                log.warn("Spoke {} registered without a source IP allowlist", id);
            }
            for (FleetListener listener : listeners) {
                try {
                    listener.onRegistered(created);
                } catch (RuntimeException e) {
                    log.error("Fleet listener failed on registration of {}", id, e);
                }
            }
            return new RegistrationResult(id, true);
        }
        log.info("Re-registered spoke {} ({}) at {}", name, id, address);
        return new RegistrationResult(id, false);
    }

    /**
     * @return false when the entry was removed before its lock was acquired
     */
    private boolean updateRegistration(Entry entry, String name, String keyHash, String allowedIp) {
        entry.lock.lock();
        try {
            if (entry.removed) {
                return false;
            }
            Spoke updated = entry.spoke.toBuilder()
                    .name(name)
                    .apiKeyHash(keyHash)
                    .allowedSourceIp(allowedIp)
                    .build();
            repository.save(updated);
            entry.spoke = updated;
            return true;
        } finally {
            entry.lock.unlock();
        }
    }

    private ReentrantLock addressStripe(String normalizedAddress) {
        return addressStripes[Math.floorMod(normalizedAddress.hashCode(), addressStripes.length)];
    }

    /**
     * @throws FleetException NOT_FOUND when no spoke has this id
     */
    public Spoke get(String spokeId) {
        return find(spokeId).orElseThrow(() -> FleetException.notFound("spoke", spokeId));
    }

    public Optional<Spoke> find(String spokeId) {
        if (spokeId == null) {
            return Optional.empty();
        }
        Entry entry = entries.get(spokeId);
        return entry != null ? Optional.of(entry.spoke) : Optional.empty();
    }

    /**
     * All spokes in registration order.
     */
    public List<Spoke> list() {
        List<Spoke> result = new ArrayList<>(entries.size());
        for (Entry entry : entries.values()) {
            result.add(entry.spoke);
        }
        result.sort(Comparator.comparingLong(Spoke::registrationSeq));
        return result;
    }

    public int size() {
        return entries.size();
    }

    public Map<SpokeStatus, Integer> countByStatus() {
        Map<SpokeStatus, Integer> counts = new EnumMap<>(SpokeStatus.class);
        for (SpokeStatus status : SpokeStatus.values()) {
            counts.put(status, 0);
        }
        for (Entry entry : entries.values()) {
            counts.merge(entry.spoke.status(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Move a spoke to {@code next} if the edge is allowed.
     *
     * @return the transition, or empty when the change is redundant or not allowed
     */
    public Optional<TransitionEvent> updateStatus(String spokeId, SpokeStatus next) {
        Entry entry = entries.get(spokeId);
        if (entry == null) {
            throw FleetException.notFound("spoke", spokeId);
        }
        entry.lock.lock();
        try {
            if (entry.removed || !entry.spoke.status().canTransitionTo(next)) {
                return Optional.empty();
            }
            return Optional.of(commitStatus(entry, entry.spoke.toBuilder().status(next).build()));
        } finally {
            entry.lock.unlock();
        }
    }

    /**
     * Fold one heartbeat outcome into the spoke record.
     * A sample for a spoke that no longer exists is dropped.
     *
     * @return the transition caused by this sample, if any
     */
    public Optional<TransitionEvent> recordHeartbeat(String spokeId, HeartbeatSample sample) {
        Entry entry = entries.get(spokeId);
        if (entry == null) {
            log.debug("Dropping heartbeat for unknown spoke {}", spokeId);
            return Optional.empty();
        }
        entry.lock.lock();
        try {
            if (entry.removed) {
                return Optional.empty();
            }
            Spoke current = entry.spoke;
            HeartbeatStateMachine.Outcome outcome =
                    stateMachine.apply(current.status(), current.consecutiveFailures(), sample.reachable());

            Spoke.Builder next = current.toBuilder()
                    .status(outcome.status())
                    .consecutiveFailures(outcome.failures());
            if (sample.reachable()) {
                next.lastSeen(sample.timestamp()).lastMetrics(sample.metrics());
            }
            Spoke updated = next.build();
            repository.save(updated);
            entry.spoke = updated;

            entry.samples.addLast(sample);
            while (entry.samples.size() > historySize) {
                entry.samples.removeFirst();
            }

            if (!outcome.transitioned()) {
                return Optional.empty();
            }
            return Optional.of(transition(current, updated, sample.timestamp()));
        } finally {
            entry.lock.unlock();
        }
    }

    /**
     * Move an ONLINE spoke to DEGRADED when it has not been seen since {@code cutoff}.
     */
    public Optional<TransitionEvent> degradeIfStale(String spokeId, Instant cutoff) {
        Entry entry = entries.get(spokeId);
        if (entry == null) {
            return Optional.empty();
        }
        entry.lock.lock();
        try {
            Spoke current = entry.spoke;
            if (entry.removed || current.status() != SpokeStatus.ONLINE) {
                return Optional.empty();
            }
            if (current.lastSeen() != null && !current.lastSeen().isBefore(cutoff)) {
                return Optional.empty();
            }
            log.warn("Spoke {} not seen since {}, marking DEGRADED", spokeId, current.lastSeen());
            return Optional.of(commitStatus(entry, current.toBuilder().status(SpokeStatus.DEGRADED).build()));
        } finally {
            entry.lock.unlock();
        }
    }

    /**
     * Recent heartbeat samples, oldest first.
     */
    public List<HeartbeatSample> recentHeartbeats(String spokeId) {
        Entry entry = entries.get(spokeId);
        if (entry == null) {
            throw FleetException.notFound("spoke", spokeId);
        }
        entry.lock.lock();
        try {
            return List.copyOf(entry.samples);
        } finally {
            entry.lock.unlock();
        }
    }

    /**
     * Delete a spoke. Listeners cancel its heartbeat task, commands and log channels.
     *
     * @throws FleetException NOT_FOUND when no spoke has this id
     */
    public Spoke remove(String spokeId) {
        Entry entry = entries.get(spokeId);
        if (entry == null) {
            throw FleetException.notFound("spoke", spokeId);
        }
        Spoke removed;
        entry.lock.lock();
        try {
            if (entry.removed) {
                throw FleetException.notFound("spoke", spokeId);
            }
            repository.delete(spokeId);
            entry.removed = true;
            removed = entry.spoke;
            entries.remove(spokeId, entry);
        } finally {
            entry.lock.unlock();
        }
        // outside the entry lock: registration takes the address stripe before any entry lock
        byAddress.remove(normalizeAddress(removed.address()), spokeId);

        log.info("Removed spoke {} ({})", removed.name(), spokeId);
        for (FleetListener listener : listeners) {
            try {
                listener.onRemoved(removed);
            } catch (RuntimeException e) {
                log.error("Fleet listener failed on removal of {}", spokeId, e);
            }
        }
        return removed;
    }

    @Override
    public Optional<SpokeIdentity> findIdentity(String spokeId) {
        return find(spokeId).map(Spoke::identity);
    }

    private TransitionEvent commitStatus(Entry entry, Spoke updated) {
        Spoke previous = entry.spoke;
        repository.save(updated);
        entry.spoke = updated;
        return transition(previous, updated, clock.instant());
    }

    private static TransitionEvent transition(Spoke from, Spoke to, Instant at) {
        return new TransitionEvent(to.id(), to.name(), from.status(), to.status(), at);
    }

    /**
     * Lower-cased {@code host:port} with any {@code http://} scheme and trailing slash removed.
     */
    static String normalizeAddress(String address) {
        String value = address.trim().toLowerCase(Locale.ROOT);
        if (value.startsWith("http://")) {
            value = value.substring("http://".length());
        }
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }

    private static void validate(RegistrationRequest request) {
        if (request == null) {
            throw FleetException.invalid("registration body is required");
        }
        if (request.name() == null || request.name().isBlank()) {
            throw FleetException.invalid("name is required");
        }
        if (request.address() == null || request.address().isBlank()) {
            throw FleetException.invalid("address is required");
        }
        if (request.apiKey() == null || request.apiKey().isBlank()) {
            throw FleetException.invalid("apiKey is required");
        }
        String address = request.address().trim();
        String url = address.startsWith("http://") || address.startsWith("https://") ? address : "http://" + address;
        try {
            URI uri = URI.create(url);
            if (uri.getHost() == null) {
                throw FleetException.invalid("address must be host:port or an http(s) URL: " + address);
            }
        } catch (IllegalArgumentException e) {
            throw FleetException.invalid("address must be host:port or an http(s) URL: " + address);
        }
        String ip = blankToNull(request.allowedSourceIp());
        if (ip != null && !IP_LITERAL.matcher(ip).matches()) {
            throw FleetException.invalid("allowedSourceIp must be an IP address: " + ip);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
