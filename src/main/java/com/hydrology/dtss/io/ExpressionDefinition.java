package com.hydrology.dtss.io;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.Data;

/**
 * POJO form of an expression graph authored as JSON.
 *
 * <pre>{@code
 * {
 *   "name": "inflow",
 *   "nodes": [
 *     { "name": "q",     "type": "reference", "properties": { "id": "catchment/42" } },
 *     { "name": "q2",    "type": "binary_op_scalar", "inputs": { "lhs": "q" },
 *       "properties": { "op": "mul", "scalar": 2.0 } },
 *     { "name": "daily", "type": "average", "inputs": { "source": "q2" },
 *       "properties": { "axis": { "start": 0, "dt": 86400, "n": 7 } } }
 *   ],
 *   "outputs": [ "daily" ]
 * }
 * }</pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ExpressionDefinition {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private String name;
    private List<NodeDef> nodes;
    private List<String> outputs;

    /** Definition of a single named node. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NodeDef {
        private String name, type, description;
        private Map<String, String> inputs;
        private Map<String, Object> properties;
    }

    public static ExpressionDefinition parse(String json) throws IOException {
        return MAPPER.readValue(json, ExpressionDefinition.class);
    }

    public static ExpressionDefinition parseFile(Path path) throws IOException {
        return MAPPER.readValue(path.toFile(), ExpressionDefinition.class);
    }
}
