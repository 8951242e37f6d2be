package work.lcod.assembly.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import work.lcod.assembly.index.Indexer;
import work.lcod.assembly.index.Selector;
import work.lcod.assembly.model.DefaultValue;
import work.lcod.assembly.model.InputOverride;
import work.lcod.assembly.model.ModelTree;
import work.lcod.assembly.model.PromotionRule;
import work.lcod.assembly.model.Shape;
import work.lcod.assembly.model.ShapeSpec;
import work.lcod.assembly.model.VariableDecl;

/**
 * Loads model descriptions (YAML or JSON, local path or HTTP URL) into a {@link ModelTree}.
 *
 * <p>Read failures surface as {@link IllegalStateException}; malformed content as
 * {@link IllegalArgumentException} naming the offending entry.
 */
public final class ModelLoader {
    private static final Logger LOG = LogManager.getLogger(ModelLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ModelLoader() {}

    public static ModelTree loadFromLocalFile(Path path) {
        try (var in = Files.newInputStream(path)) {
            LOG.debug("Loading model from {}", path);
            return parse(in);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read model: " + path, ex);
        }
    }

    public static ModelTree loadFromHttp(URI uri) {
        try {
            var client = HttpClient.newHttpClient();
            var request = HttpRequest.newBuilder(uri).GET().build();
            var response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
            if (response.statusCode() >= 400) {
                throw new IllegalStateException("HTTP " + response.statusCode() + " while downloading model: " + uri);
            }
            try (var body = response.body()) {
                LOG.debug("Loading model from {}", uri);
                return parse(body);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while downloading model: " + uri, ex);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to download model: " + uri, ex);
        }
    }

    public static ModelTree parse(String text) {
        try {
            return fromNode(YAML_MAPPER.readTree(text));
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Invalid model document: " + ex.getOriginalMessage(), ex);
        }
    }

    public static ModelTree parse(InputStream in) throws IOException {
        return fromNode(YAML_MAPPER.readTree(in));
    }

    private static ModelTree fromNode(JsonNode root) {
        if (root == null || !root.hasNonNull("model")) {
            throw new IllegalArgumentException("Model document must have a top-level 'model' entry");
        }
        var model = root.get("model");
        if (!model.isObject()) {
            throw new IllegalArgumentException("'model' must be an object");
        }
        var builder = ModelTree.builder();
        readGroup(model, builder, "model");
        return builder.build();
    }

    private static void readGroup(JsonNode node, ModelTree.GroupBuilder group, String where) {
        for (var child : items(node, "children", where)) {
            var name = text(child, "name", where + ".children");
            var childWhere = where + "." + name;
            if (child.has("variables")) {
                group.leaf(name, leaf -> {
                    for (var variable : items(child, "variables", childWhere)) {
                        leaf.add(readVariable(variable, childWhere));
                    }
                });
            } else {
                group.group(name, sub -> readGroup(child, sub, childWhere));
            }
        }
        for (var promote : items(node, "promotes", where)) {
            readPromotes(promote, group, where);
        }
        for (var connection : items(node, "connections", where)) {
            var indices = readIndices(connection, where + ".connections");
            group.connect(text(connection, "src", where + ".connections"), text(connection, "tgt", where + ".connections"), indices);
        }
        for (var defaults : items(node, "inputDefaults", where)) {
            group.inputDefaults(text(defaults, "name", where + ".inputDefaults"), readOverride(defaults));
        }
    }

    private static VariableDecl readVariable(JsonNode node, String where) {
        var name = text(node, "name", where + ".variables");
        var io = node.path("io").asText("input");
        var builder = switch (io.toLowerCase()) {
            case "input", "in" -> VariableDecl.input(name);
            case "output", "out" -> VariableDecl.output(name);
            default -> throw new IllegalArgumentException("Variable " + where + "." + name + " has unknown io '" + io + "'");
        };
        boolean discrete = node.path("discrete").asBoolean(false);
        builder.discrete(discrete).distributed(node.path("distributed").asBoolean(false));
        if (node.has("val")) {
            var raw = convertNode(node.get("val"));
            builder.value(discrete ? DefaultValue.discrete(raw) : raw);
        }
        if (node.hasNonNull("units")) {
            builder.units(node.get("units").asText());
        }
        if (node.hasNonNull("shape")) {
            builder.shape(ShapeSpec.of(readShape(node.get("shape"), where + "." + name)));
        } else if (node.path("shapeByConn").asBoolean(false)) {
            builder.shapeByConnection();
        } else if (node.hasNonNull("copyShape")) {
            builder.copyShape(node.get("copyShape").asText());
        }
        return builder.build();
    }

    private static void readPromotes(JsonNode node, ModelTree.GroupBuilder group, String where) {
        var child = text(node, "child", where + ".promotes");
        var filter = switch (node.path("io").asText("any").toLowerCase()) {
            case "any" -> PromotionRule.Filter.ANY;
            case "inputs" -> PromotionRule.Filter.INPUTS;
            case "outputs" -> PromotionRule.Filter.OUTPUTS;
            default -> throw new IllegalArgumentException("Promotion of " + where + "." + child + " has unknown io '"
                + node.get("io").asText() + "'");
        };
        var names = new ArrayList<String>();
        var namesNode = node.path("names");
        if (namesNode.isTextual()) {
            names.add(namesNode.asText());
        } else {
            namesNode.forEach(name -> names.add(name.asText()));
        }
        if (names.isEmpty()) {
            throw new IllegalArgumentException("Promotion of " + where + "." + child + " lists no names");
        }
        var indices = readIndices(node, where + ".promotes");
        var srcShape = node.hasNonNull("srcShape") ? readShape(node.get("srcShape"), where + ".promotes") : null;
        var override = node.hasNonNull("defaults") ? readOverride(node.get("defaults")) : null;
        for (var name : names) {
            group.promote(PromotionRule.parse(child, name).filter(filter).srcIndices(indices).srcShape(srcShape).override(override));
        }
    }

    private static InputOverride readOverride(JsonNode node) {
        DefaultValue value = null;
        if (node.has("val")) {
            var raw = convertNode(node.get("val"));
            value = isNumeric(raw) ? DefaultValue.of(raw) : DefaultValue.discrete(raw);
        }
        var units = node.hasNonNull("units") ? node.get("units").asText() : null;
        var srcShape = node.hasNonNull("srcShape") ? readShape(node.get("srcShape"), "inputDefaults") : null;
        return new InputOverride(value, units, srcShape);
    }

    private static Indexer readIndices(JsonNode node, String where) {
        if (!node.hasNonNull("srcIndices")) {
            return null;
        }
        var indices = node.get("srcIndices");
        boolean flat = node.path("flatSrcIndices").asBoolean(false);
        if (indices.isTextual()) {
            var text = indices.asText().trim();
            if (!flat) {
                return Indexer.parse(text);
            }
            if (text.startsWith("[") && text.endsWith("]")) {
                text = text.substring(1, text.length() - 1);
            }
            var parts = text.split(",");
            var positions = new int[parts.length];
            for (int i = 0; i < parts.length; i++) {
                positions[i] = Integer.parseInt(parts[i].trim());
            }
            return Indexer.flat(positions);
        }
        if (indices.isInt()) {
            return flat ? Indexer.flat(indices.asInt()) : Indexer.of(Selector.at(indices.asInt()));
        }
        if (indices.isArray()) {
            var positions = new int[indices.size()];
            for (int i = 0; i < positions.length; i++) {
                if (!indices.get(i).isInt()) {
                    throw new IllegalArgumentException("srcIndices of " + where + " must be integers or a string: " + indices);
                }
                positions[i] = indices.get(i).asInt();
            }
            return flat ? Indexer.flat(positions) : Indexer.of(Selector.array(positions));
        }
        throw new IllegalArgumentException("Unsupported srcIndices in " + where + ": " + indices);
    }

    private static Shape readShape(JsonNode node, String where) {
        if (node.isInt()) {
            return Shape.of(node.asInt());
        }
        if (!node.isArray() || node.isEmpty()) {
            throw new IllegalArgumentException("Shape of " + where + " must be an integer or a non-empty list: " + node);
        }
        var dims = new int[node.size()];
        for (int i = 0; i < dims.length; i++) {
            dims[i] = node.get(i).asInt(-1);
        }
        return Shape.of(dims);
    }

    private static List<JsonNode> items(JsonNode node, String field, String where) {
        var value = node.get(field);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw new IllegalArgumentException("'" + field + "' of " + where + " must be a list");
        }
        var items = new ArrayList<JsonNode>();
        for (var item : value) {
            if (!item.isObject()) {
                throw new IllegalArgumentException("Entries of '" + field + "' in " + where + " must be objects: " + item);
            }
            items.add(item);
        }
        return items;
    }

    private static String text(JsonNode node, String field, String where) {
        var value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new IllegalArgumentException("Missing '" + field + "' in " + where + ": " + node);
        }
        return value.asText();
    }

    private static boolean isNumeric(Object raw) {
        if (raw instanceof Number) {
            return true;
        }
        return raw instanceof List<?> list && !list.isEmpty() && list.stream().allMatch(Number.class::isInstance);
    }

    private static Object convertNode(JsonNode node) {
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        return node.asText();
    }
}
