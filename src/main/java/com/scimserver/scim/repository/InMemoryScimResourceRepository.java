package com.scimserver.scim.repository;

import com.scimserver.scim.schema.ScimResourceType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * {@link ScimResourceRepository} backed by a concurrent map.
 *
 * <p>{@code userName} and {@code displayName} behave like case-insensitive text columns.
 * Rows created in the same instant keep their insertion order.</p>
 */
public class InMemoryScimResourceRepository implements ScimResourceRepository {

    private static final Logger LOGGER = Logger.getLogger(InMemoryScimResourceRepository.class.getName());

    private final Map<String, Entry> rows = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public ScimResourceRecord create(ScimResourceRecord record) {
        rows.put(key(record.getEndpointId(), record.getResourceType(), record.getScimId()),
                new Entry(record, sequence.incrementAndGet()));
        LOGGER.fine("Stored " + record);
        return record;
    }

    @Override
    public Optional<ScimResourceRecord> findByScimId(String endpointId, ScimResourceType type, String scimId) {
        Entry entry = rows.get(key(endpointId, type, scimId));
        return entry != null ? Optional.of(entry.record) : Optional.empty();
    }

    @Override
    public List<ScimResourceRecord> findAll(String endpointId, ScimResourceType type,
                                            Map<String, Object> predicate) {
        List<Entry> matches = new ArrayList<>();
        for (Entry entry : rows.values()) {
            if (inScope(entry.record, endpointId, type) && matchesPredicate(entry.record, predicate)) {
                matches.add(entry);
            }
        }
        matches.sort(Comparator.comparing((Entry e) -> e.record.getCreatedAt())
                .thenComparingLong(e -> e.sequence));

        List<ScimResourceRecord> result = new ArrayList<>(matches.size());
        for (Entry entry : matches) {
            result.add(entry.record);
        }
        return result;
    }

    @Override
    public Optional<ScimResourceRecord> findConflict(String endpointId, ScimResourceType type, String uniqueName,
                                                     String externalId) {
        String lowerName = uniqueName != null ? uniqueName.toLowerCase(Locale.ROOT) : null;
        for (Entry entry : rows.values()) {
            ScimResourceRecord record = entry.record;
            if (!inScope(record, endpointId, type)) {
                continue;
            }
            String stored = type == ScimResourceType.USER ? record.getUserName() : record.getDisplayName();
            if (lowerName != null && stored != null && stored.toLowerCase(Locale.ROOT).equals(lowerName)) {
                return Optional.of(record);
            }
            if (externalId != null && externalId.equals(record.getExternalId())) {
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }

    /**
     * Remove every stored resource.
     */
    public void clear() {
        rows.clear();
    }

    private static boolean inScope(ScimResourceRecord record, String endpointId, ScimResourceType type) {
        return record.getEndpointId().equals(endpointId) && record.getResourceType() == type;
    }

    private static boolean matchesPredicate(ScimResourceRecord record, Map<String, Object> predicate) {
        if (predicate == null) {
            return true;
        }
        for (Map.Entry<String, Object> column : predicate.entrySet()) {
            if (!record.columnMatches(column.getKey(), column.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static String key(String endpointId, ScimResourceType type, String scimId) {
        return endpointId + '/' + type.name() + '/' + scimId;
    }

    private static final class Entry {
        private final ScimResourceRecord record;
        private final long sequence;

        private Entry(ScimResourceRecord record, long sequence) {
            this.record = record;
            this.sequence = sequence;
        }
    }
}
