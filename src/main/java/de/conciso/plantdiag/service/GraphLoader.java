package de.conciso.plantdiag.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import de.conciso.plantdiag.model.GraphNode;
import de.conciso.plantdiag.model.GraphRelationship;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads a graph snapshot ({@code nodes} + {@code relationships}) from JSON or YAML.
 * A missing file is not an error: the result is an empty graph.
 */
@Service
public class GraphLoader {

    private static final Logger log = LoggerFactory.getLogger(GraphLoader.class);
    private static final Set<String> NODE_FIELDS = Set.of("id", "type", "name", "description");

    private final String graphPath;
    private final ObjectMapper json = new ObjectMapper();
    private final ObjectMapper yaml = new ObjectMapper(new YAMLFactory());

    public GraphLoader(@Value("${diagnostic.graph.path}") String graphPath) {
        this.graphPath = graphPath;
    }

    public GraphStore load() throws IOException {
        return load(Path.of(graphPath));
    }

    public GraphStore load(Path file) throws IOException {
        if (!Files.exists(file)) {
            log.warn("Graph file {} not found, using empty graph", file.toAbsolutePath());
            return GraphStore.empty();
        }
        JsonNode root;
        try {
            root = mapperFor(file).readTree(file.toFile());
        } catch (JsonProcessingException e) {
            throw new GraphLoadException("Graph file " + file + " is not parseable: " + e.getOriginalMessage(), e);
        }
        GraphStore store = parse(root);
        log.info("Graph loaded from {}: {} node(s), {} relationship(s)",
                file, store.nodeCount(), store.relationshipCount());
        return store;
    }

    /** Builds a store from an already parsed snapshot tree. */
    public GraphStore parse(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return GraphStore.empty();
        }
        if (!root.isObject()) {
            throw new GraphLoadException("Graph snapshot must be an object with 'nodes' and 'relationships'");
        }
        List<GraphNode> nodes = new ArrayList<>();
        for (JsonNode record : records(root, "nodes")) {
            nodes.add(toNode(record));
        }
        List<GraphRelationship> relationships = new ArrayList<>();
        for (JsonNode record : records(root, "relationships")) {
            relationships.add(new GraphRelationship(text(record, "source"), text(record, "target"), text(record, "type")));
        }
        return GraphStore.of(nodes, relationships);
    }

    // --- helpers ---

    private ObjectMapper mapperFor(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml") ? yaml : json;
    }

    private List<JsonNode> records(JsonNode root, String field) {
        JsonNode array = root.get(field);
        if (array == null || array.isNull()) return List.of();
        if (!array.isArray()) {
            throw new GraphLoadException("'" + field + "' must be a list of records");
        }
        List<JsonNode> out = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            if (!element.isObject()) {
                throw new GraphLoadException("'" + field + "' contains a non-record element: " + element);
            }
            out.add(element);
        }
        return out;
    }

    private GraphNode toNode(JsonNode record) {
        Map<String, String> extra = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = record.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (NODE_FIELDS.contains(field.getKey()) || field.getValue().isNull()) continue;
            JsonNode value = field.getValue();
            extra.put(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
        }
        return new GraphNode(text(record, "id"), text(record, "type"),
                text(record, "name"), text(record, "description"), extra);
    }

    private static String text(JsonNode record, String field) {
        JsonNode value = record.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
