package com.jasmin.trafficshield.structures;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * Per-source nodes with exponentially smoothed weight and threat score, plus an undirected
 * adjacency between sources that were suspicious at about the same time.
 * <p>
 * Two sources are linked when both score at least {@code linkMinScore} within
 * {@code coActivityWindow} of each other. Linking only looks at a bounded list of recent
 * suspicious sightings, and each node keeps at most {@code maxConnections} neighbours.
 */
public class RelationshipGraph {

    private final ConcurrentMap<String, SourceNode> nodes = new ConcurrentHashMap<>();
    private final Deque<Sighting> recentSuspects = new ArrayDeque<>();

    private final double weightRetention;
    private final double threatRetention;
    private final double linkMinScore;
    private final long coActivityMillis;
    private final int recentSuspectCapacity;
    private final int maxLinksPerUpdate;
    private final int maxConnections;

    public RelationshipGraph(double weightRetention,
                             double threatRetention,
                             double linkMinScore,
                             Duration coActivityWindow,
                             int recentSuspectCapacity,
                             int maxLinksPerUpdate,
                             int maxConnections) {
        this.weightRetention = weightRetention;
        this.threatRetention = threatRetention;
        this.linkMinScore = linkMinScore;
        this.coActivityMillis = coActivityWindow.toMillis();
        this.recentSuspectCapacity = recentSuspectCapacity;
        this.maxLinksPerUpdate = maxLinksPerUpdate;
        this.maxConnections = maxConnections;
    }

    /**
     * Creates or updates the node for {@code id}, then links it to co-active suspicious sources.
     *
     * @return the updated node
     */
    public SourceNode observe(String id, double score, Instant at) {
        SourceNode node = nodes.computeIfAbsent(id, k -> new SourceNode(k, at));
        node.observe(score, at, weightRetention, threatRetention);
        if (score >= linkMinScore) {
            for (String other : coActiveSuspects(id, at)) {
                connect(id, other);
            }
        }
        return node;
    }

    public Optional<SourceNode> get(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public void connect(String a, String b) {
        if (a.equals(b)) {
            return;
        }
        SourceNode na = nodes.get(a);
        SourceNode nb = nodes.get(b);
        if (na == null || nb == null) {
            return;
        }
        if (na.connect(b, maxConnections) && !nb.connect(a, maxConnections)) {
            // keep the adjacency symmetric when the other side is full
            if (!nb.getConnections().contains(a)) {
                na.disconnect(b);
            }
        }
    }

    /** Removes the node and every edge pointing at it. */
    public void remove(String id) {
        SourceNode gone = nodes.remove(id);
        if (gone == null) {
            return;
        }
        for (String other : gone.getConnections()) {
            SourceNode n = nodes.get(other);
            if (n != null) {
                n.disconnect(id);
            }
        }
        synchronized (recentSuspects) {
            recentSuspects.removeIf(s -> s.sourceId.equals(id));
        }
    }

    public int size() {
        return nodes.size();
    }

    public double averageConnections() {
        if (nodes.isEmpty()) {
            return 0.0;
        }
        return nodes.values().stream().mapToInt(SourceNode::getConnectionCount).average().orElse(0.0);
    }

    public List<SourceNode> topByWeight(int k) {
        return nodes.values().stream()
                .sorted(Comparator.comparingDouble(SourceNode::getWeight).reversed())
                .limit(Math.max(0, k))
                .collect(Collectors.toList());
    }

    public void clear() {
        nodes.clear();
        synchronized (recentSuspects) {
            recentSuspects.clear();
        }
    }

    private List<String> coActiveSuspects(String id, Instant at) {
        long now = at.toEpochMilli();
        List<String> partners = new ArrayList<>();
        synchronized (recentSuspects) {
            Iterator<Sighting> newestFirst = recentSuspects.descendingIterator();
            while (newestFirst.hasNext() && partners.size() < maxLinksPerUpdate) {
                Sighting s = newestFirst.next();
                if (now - s.at > coActivityMillis) {
                    break;
                }
                if (!s.sourceId.equals(id) && !partners.contains(s.sourceId)) {
                    partners.add(s.sourceId);
                }
            }
            recentSuspects.addLast(new Sighting(id, now));
            while (recentSuspects.size() > recentSuspectCapacity) {
                recentSuspects.pollFirst();
            }
        }
        return partners;
    }

    private static final class Sighting {
        private final String sourceId;
        private final long at;

        private Sighting(String sourceId, long at) {
            this.sourceId = sourceId;
            this.at = at;
        }
    }
}
