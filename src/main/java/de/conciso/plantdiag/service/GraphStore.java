package de.conciso.plantdiag.service;

import de.conciso.plantdiag.model.GraphNode;
import de.conciso.plantdiag.model.GraphRelationship;
import de.conciso.plantdiag.model.GraphSchema;
import de.conciso.plantdiag.model.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * In-memory snapshot of the knowledge graph.
 *
 * <p>All indices are built in the constructor and never change afterwards, so one
 * instance can be shared by any number of sessions without locking.</p>
 */
public final class GraphStore {

    private static final Logger log = LoggerFactory.getLogger(GraphStore.class);
    private static final GraphStore EMPTY = new GraphStore(List.of(), List.of());

    private final Map<String, GraphNode> nodesById;
    private final Map<NodeKind, List<GraphNode>> nodesByKind;
    private final Map<String, List<GraphNode>> nodesByType;
    private final Map<String, List<GraphRelationship>> relationshipsBySource;
    private final Map<String, List<GraphRelationship>> relationshipsByType;
    private final int relationshipCount;

    private GraphStore(Collection<GraphNode> nodes, Collection<GraphRelationship> relationships) {
        Map<String, GraphNode> byId = new LinkedHashMap<>();
        Map<NodeKind, List<GraphNode>> byKind = new EnumMap<>(NodeKind.class);
        Map<String, List<GraphNode>> byType = new LinkedHashMap<>();

        for (GraphNode node : nodes) {
            if (node == null) throw new GraphLoadException("Node record must not be null");
            if (node.id() == null || node.id().isBlank()) {
                log.warn("Skipping node without id: {}", node.name());
                continue;
            }
            if (byId.putIfAbsent(node.id(), node) != null) {
                log.warn("Duplicate node id '{}', keeping the first record", node.id());
                continue;
            }
            byKind.computeIfAbsent(node.kind(), k -> new ArrayList<>()).add(node);
            byType.computeIfAbsent(typeLabel(node.type()), k -> new ArrayList<>()).add(node);
        }

        Map<String, List<GraphRelationship>> bySource = new LinkedHashMap<>();
        Map<String, List<GraphRelationship>> byRelType = new LinkedHashMap<>();
        int count = 0;
        for (GraphRelationship rel : relationships) {
            if (rel == null) throw new GraphLoadException("Relationship record must not be null");
            count++;
            // Dangling endpoints stay indexed; they simply never resolve to a node.
            if (rel.source() != null) {
                bySource.computeIfAbsent(rel.source(), k -> new ArrayList<>()).add(rel);
            }
            if (rel.type() != null) {
                byRelType.computeIfAbsent(rel.type(), k -> new ArrayList<>()).add(rel);
            }
        }

        this.nodesById = Collections.unmodifiableMap(byId);
        this.nodesByKind = freeze(byKind);
        this.nodesByType = freeze(byType);
        this.relationshipsBySource = freeze(bySource);
        this.relationshipsByType = freeze(byRelType);
        this.relationshipCount = count;
    }

    public static GraphStore of(Collection<GraphNode> nodes, Collection<GraphRelationship> relationships) {
        if (nodes == null) throw new GraphLoadException("nodes must be a collection of records");
        if (relationships == null) throw new GraphLoadException("relationships must be a collection of records");
        GraphStore store = new GraphStore(nodes, relationships);
        log.debug("Graph indexed: {} node(s), {} relationship(s)", store.nodeCount(), store.relationshipCount());
        return store;
    }

    public static GraphStore empty() {
        return EMPTY;
    }

    public List<GraphNode> nodesByKind(NodeKind kind) {
        return nodesByKind.getOrDefault(kind, List.of());
    }

    public List<GraphRelationship> relationshipsFrom(String nodeId) {
        return relationshipsBySource.getOrDefault(nodeId, List.of());
    }

    public List<GraphRelationship> relationshipsOfType(String type) {
        return relationshipsByType.getOrDefault(type, List.of());
    }

    public Optional<GraphNode> nodeById(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(nodesById.get(id));
    }

    public int nodeCount() {
        return nodesById.size();
    }

    public int relationshipCount() {
        return relationshipCount;
    }

    public GraphSchema schema() {
        List<GraphSchema.TypeCount> counts = nodesByType.entrySet().stream()
                .map(e -> new GraphSchema.TypeCount(e.getKey(), e.getValue().size()))
                .sorted(Comparator.comparingInt(GraphSchema.TypeCount::count).reversed()
                        .thenComparing(GraphSchema.TypeCount::type))
                .toList();
        return new GraphSchema(
                List.copyOf(new TreeSet<>(nodesByType.keySet())),
                List.copyOf(new TreeSet<>(relationshipsByType.keySet())),
                counts);
    }

    // --- traversal helpers ---

    /** Disease nodes whose name equals {@code name} exactly. */
    public List<GraphNode> diseasesNamed(String name) {
        if (name == null) return List.of();
        return nodesByKind(NodeKind.DISEASE).stream()
                .filter(d -> d.name().equals(name))
                .toList();
    }

    /**
     * Named nodes of {@code targetKind} reachable from {@code from} over an outgoing
     * relationship whose type passes {@code relationshipFilter}.
     */
    public List<GraphNode> linkedNodes(GraphNode from, Predicate<String> relationshipFilter, NodeKind targetKind) {
        List<GraphNode> out = new ArrayList<>();
        for (GraphRelationship rel : relationshipsFrom(from.id())) {
            if (!relationshipFilter.test(rel.type())) continue;
            nodeById(rel.target())
                    .filter(target -> target.kind() == targetKind)
                    .filter(GraphNode::hasName)
                    .ifPresent(out::add);
        }
        return out;
    }

    /** Raw names of the symptoms a disease links to. */
    public List<String> symptomNamesOf(GraphNode disease) {
        return linkedNodes(disease, RelationshipKinds::isSymptomLink, NodeKind.SYMPTOM).stream()
                .map(GraphNode::name)
                .toList();
    }

    private static String typeLabel(String type) {
        return type == null || type.isBlank() ? "Unknown" : type;
    }

    private static <K, V> Map<K, List<V>> freeze(Map<K, List<V>> index) {
        Map<K, List<V>> copy = new LinkedHashMap<>(index);
        copy.replaceAll((k, v) -> List.copyOf(v));
        return Collections.unmodifiableMap(copy);
    }
}
