package com.example.chronotrace.tracking;

import com.example.chronotrace.config.ChronoTraceProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.stream.Collectors;

/**
 * Correlates detections of one analysis stream into tracks.
 *
 * <p>Detections are buffered and released in timestamp order once they fall behind the
 * watermark (latest timestamp seen minus the reorder grace). A detection older than the last
 * released one is rejected as late. Not thread-safe; the owning stream serializes access.</p>
 *
 * <p>Closed tracks stay in memory until the owning stream has persisted them and they have been
 * closed for longer than its retention window; see {@link #evictClosedBefore}.</p>
 */
@Slf4j
public class TrackCorrelator {

    private static final Comparator<Pending> ORDER = Comparator
            .comparing((Pending p) -> p.detection.getTimestamp())
            .thenComparingLong(p -> p.seq);

    private final String streamId;
    private final double similarityThreshold;
    private final double maxSpeed;
    private final Duration handoffMaxDelay;
    private final Duration closeTimeout;
    private final Duration reorderGrace;

    private final PriorityQueue<Pending> buffer = new PriorityQueue<>(ORDER);
    private final Map<String, Track> tracks = new LinkedHashMap<>();
    private long seq;
    private long trackSeq;
    private Instant maxSeen;
    private Instant lastReleased;

    public TrackCorrelator(String streamId, ChronoTraceProperties.TrackingConfig cfg) {
        this(streamId, cfg, 0L);
    }

    /**
     * @param lastSequence highest track sequence already used by this stream; new tracks continue after it
     */
    public TrackCorrelator(String streamId, ChronoTraceProperties.TrackingConfig cfg, long lastSequence) {
        this.streamId = streamId;
        this.trackSeq = lastSequence;
        this.similarityThreshold = cfg.getSimilarityThreshold();
        this.maxSpeed = cfg.getMaxSpeed();
        this.handoffMaxDelay = cfg.getHandoffMaxDelay();
        this.closeTimeout = cfg.getCloseTimeout();
        this.reorderGrace = cfg.getReorderGrace();
    }

    /**
     * Buffers the detection and releases everything behind the new watermark.
     *
     * @return false if the detection arrived too late and was dropped
     */
    public boolean submit(Detection d) {
        d.validate();
        if (lastReleased != null && d.getTimestamp().isBefore(lastReleased)) {
            log.warn("Stream {}: late detection on {} at {} dropped (already released up to {})",
                    streamId, d.getCameraId(), d.getTimestamp(), lastReleased);
            return false;
        }
        buffer.add(new Pending(d, seq++));
        if (maxSeen == null || d.getTimestamp().isAfter(maxSeen)) {
            maxSeen = d.getTimestamp();
        }
        releaseUpTo(maxSeen.minus(reorderGrace));
        return true;
    }

    /**
     * Releases every buffered detection, then closes tracks idle at {@code now}.
     */
    public void flush(Instant now) {
        while (!buffer.isEmpty()) {
            process(buffer.poll().detection);
        }
        closeIdle(now);
    }

    public void closeIdle(Instant now) {
        for (Track t : tracks.values()) {
            if (t.isOpen() && Duration.between(t.latest().getTimestamp(), now).compareTo(closeTimeout) > 0) {
                t.close(now);
                log.debug("Stream {}: track {} closed at {}", streamId, t.getId(), now);
            }
        }
    }

    private void releaseUpTo(Instant watermark) {
        while (!buffer.isEmpty() && !buffer.peek().detection.getTimestamp().isAfter(watermark)) {
            process(buffer.poll().detection);
        }
    }

    private void process(Detection d) {
        closeIdle(d.getTimestamp());
        Track best = null;
        double bestSim = Double.NEGATIVE_INFINITY;
        for (Track t : tracks.values()) {
            if (!t.isOpen() || !plausible(t.latest(), d)) continue;
            double sim = d.getDescriptor().cosine(t.getLatestDescriptor());
            if (sim > bestSim) {
                bestSim = sim;
                best = t;
            }
        }
        if (best != null && bestSim >= similarityThreshold) {
            best.extend(d, bestSim);
        } else {
            String id = streamId + "-T" + (++trackSeq);
            tracks.put(id, new Track(id, streamId, d));
            log.debug("Stream {}: opened track {} on {} at {}", streamId, id, d.getCameraId(), d.getTimestamp());
        }
        lastReleased = d.getTimestamp();
    }

    boolean plausible(TrackObservation last, Detection d) {
        long gapMillis = d.getTimestamp().toEpochMilli() - last.getTimestamp().toEpochMilli();
        if (gapMillis < 0 || gapMillis > closeTimeout.toMillis()) return false;
        if (last.getCameraId().equals(d.getCameraId())) {
            // one entity is seen once per instant on a camera
            if (gapMillis == 0) return false;
            double seconds = Math.max(gapMillis / 1000.0, 1.0);
            return last.getPosition().distanceTo(d.getPosition()) <= maxSpeed * seconds;
        }
        return gapMillis <= handoffMaxDelay.toMillis();
    }

    public List<TrackSnapshot> snapshots() {
        return tracks.values().stream().map(Track::snapshot).collect(Collectors.toList());
    }

    public List<TrackSnapshot> openTracks() {
        List<TrackSnapshot> out = new ArrayList<>();
        for (Track t : tracks.values()) {
            if (t.isOpen()) out.add(t.snapshot());
        }
        return out;
    }

    /** Closed tracks not yet handed to the track store. */
    public List<TrackSnapshot> unpersistedClosed() {
        List<TrackSnapshot> out = new ArrayList<>();
        for (Track t : tracks.values()) {
            if (!t.isOpen() && !t.isPersisted()) out.add(t.snapshot());
        }
        return out;
    }

    public void markPersisted(String trackId) {
        Track t = tracks.get(trackId);
        if (t != null && !t.isOpen()) t.markPersisted();
    }

    /**
     * Drops persisted tracks closed before {@code cutoff}. Unpersisted tracks are kept whatever
     * their age.
     *
     * @return ids of the dropped tracks
     */
    public List<String> evictClosedBefore(Instant cutoff) {
        List<String> evicted = new ArrayList<>();
        Iterator<Track> it = tracks.values().iterator();
        while (it.hasNext()) {
            Track t = it.next();
            if (!t.isOpen() && t.isPersisted() && t.getClosedAt().isBefore(cutoff)) {
                evicted.add(t.getId());
                it.remove();
            }
        }
        if (!evicted.isEmpty()) {
            log.debug("Stream {}: evicted {} closed tracks older than {}", streamId, evicted.size(), cutoff);
        }
        return evicted;
    }

    public int trackCount() {
        return tracks.size();
    }

    /** Numeric suffix of a track id such as {@code lobby-T12}. */
    public static long sequenceOf(String trackId) {
        int i = trackId.lastIndexOf("-T");
        if (i < 0) return 0L;
        try {
            return Long.parseLong(trackId.substring(i + 2));
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    public int pendingCount() {
        return buffer.size();
    }

    public Instant getWatermark() {
        return maxSeen == null ? null : maxSeen.minus(reorderGrace);
    }

    public String getStreamId() {
        return streamId;
    }

    private static final class Pending {
        final Detection detection;
        final long seq;

        Pending(Detection detection, long seq) {
            this.detection = detection;
            this.seq = seq;
        }
    }
}
