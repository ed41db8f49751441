package com.narrateplus.playback;

import com.narrateplus.model.Segment;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Handles held by the buffer, keyed by segment index. The table owns one reference
 * per entry and drops it when the entry is replaced, evicted or cleared.
 */
@Slf4j
final class AudioHandleTable
{
    private final Map<Integer, AudioHandle> handles = new TreeMap<>();
    private final AtomicInteger revoked = new AtomicInteger();

    /**
     * Installs a handle unless the index already has one at the same or a higher tier.
     *
     * @return true when a handle was installed
     */
    boolean putIfAbsent(Segment segment)
    {
        AudioHandle old;
        synchronized (handles)
        {
            AudioHandle existing = handles.get(segment.getIndex());
            if (existing != null && existing.getQualityTier() >= segment.getQualityTier())
            {
                return false;
            }
            old = handles.put(segment.getIndex(), create(segment));
        }
        if (old != null)
        {
            old.release();
        }
        return true;
    }

    /**
     * Replaces the handle at an index with a higher-tier one and releases the old one.
     *
     * @return false when there was nothing to replace or the new tier is not higher
     */
    boolean replace(Segment segment)
    {
        AudioHandle old;
        synchronized (handles)
        {
            AudioHandle existing = handles.get(segment.getIndex());
            if (existing == null || existing.getQualityTier() >= segment.getQualityTier())
            {
                return false;
            }
            old = handles.put(segment.getIndex(), create(segment));
        }
        old.release();
        return true;
    }

    /**
     * Borrows the handle at an index. The caller must release it.
     */
    Optional<AudioHandle> acquire(int index)
    {
        synchronized (handles)
        {
            AudioHandle h = handles.get(index);
            return h != null && h.retain() ? Optional.of(h) : Optional.empty();
        }
    }

    boolean contains(int index)
    {
        synchronized (handles)
        {
            return handles.containsKey(index);
        }
    }

    /**
     * Drops every entry with an index below {@code index}.
     */
    int evictBefore(int index)
    {
        List<AudioHandle> evicted = new ArrayList<>();
        synchronized (handles)
        {
            handles.entrySet().removeIf(e ->
            {
                if (e.getKey() < index)
                {
                    evicted.add(e.getValue());
                    return true;
                }
                return false;
            });
        }
        for (AudioHandle h : evicted)
        {
            h.release();
        }
        return evicted.size();
    }

    void releaseAll()
    {
        List<AudioHandle> all;
        synchronized (handles)
        {
            all = new ArrayList<>(handles.values());
            handles.clear();
        }
        for (AudioHandle h : all)
        {
            h.release();
        }
    }

    Set<Integer> indices()
    {
        synchronized (handles)
        {
            return Collections.unmodifiableSet(new TreeSet<>(handles.keySet()));
        }
    }

    int revokedCount()
    {
        return revoked.get();
    }

    private AudioHandle create(Segment segment)
    {
        return new AudioHandle(segment, h ->
        {
            revoked.incrementAndGet();
            log.debug("Revoked audio handle for segment {} (tier {})", h.getIndex(), h.getQualityTier());
        });
    }
}
