package com.hydrology.dtss.io;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.hydrology.dtss.api.CycleException;
import com.hydrology.dtss.expr.AccumulateNode;
import com.hydrology.dtss.expr.AverageNode;
import com.hydrology.dtss.expr.BinaryOpNode;
import com.hydrology.dtss.expr.BinaryOpScalarNode;
import com.hydrology.dtss.expr.ConvolveNode;
import com.hydrology.dtss.expr.ConvolvePolicy;
import com.hydrology.dtss.expr.IntegralNode;
import com.hydrology.dtss.expr.NodeKind;
import com.hydrology.dtss.expr.OpCode;
import com.hydrology.dtss.expr.PeriodicNode;
import com.hydrology.dtss.expr.PointNode;
import com.hydrology.dtss.expr.ReferenceNode;
import com.hydrology.dtss.expr.ScalarOpSeriesNode;
import com.hydrology.dtss.expr.TimeShiftNode;
import com.hydrology.dtss.expr.TsExpression;
import com.hydrology.dtss.expr.TsVector;
import com.hydrology.dtss.time.PointInterpretation;
import com.hydrology.dtss.time.PointSeries;
import com.hydrology.dtss.time.TimeAxis;

import lombok.extern.log4j.Log4j2;

/**
 * Compiles an {@link ExpressionDefinition} into an expression vector.
 *
 * <p>
 * Nodes are wired by name. Every named node is built exactly once, so a
 * node used as input by several others becomes a shared sub-expression.
 * Duplicate names, unknown inputs and missing properties are rejected with
 * {@link IllegalArgumentException}; a cycle between nodes is rejected with
 * {@link CycleException} before any node is built.
 */
@Log4j2
public final class ExpressionCompiler {

    public TsVector compile(ExpressionDefinition def) {
        List<ExpressionDefinition.NodeDef> nodeDefs = def.getNodes() != null ? def.getNodes() : List.of();
        Map<String, ExpressionDefinition.NodeDef> byName = new HashMap<>(nodeDefs.size() * 2);
        DependencyOrder order = new DependencyOrder();
        for (ExpressionDefinition.NodeDef nd : nodeDefs) {
            if (nd.getName() == null)
                throw new IllegalArgumentException("Node without a name in definition " + def.getName());
            order.addNode(nd.getName());
            byName.put(nd.getName(), nd);
        }
        for (ExpressionDefinition.NodeDef nd : nodeDefs) {
            for (Map.Entry<String, String> in : inputs(nd).entrySet()) {
                if (!byName.containsKey(in.getValue()))
                    throw new IllegalArgumentException("Node '" + nd.getName() + "' input '" + in.getKey()
                            + "' refers to unknown node '" + in.getValue() + "'");
                order.addEdge(in.getValue(), nd.getName());
            }
        }

        Map<String, TsExpression> built = new HashMap<>(nodeDefs.size() * 2);
        for (String name : order.sort()) {
            ExpressionDefinition.NodeDef nd = byName.get(name);
            built.put(name, instantiate(nd, built));
        }

        List<String> outputs = def.getOutputs();
        if (outputs == null || outputs.isEmpty())
            throw new IllegalArgumentException("Definition " + def.getName() + " declares no outputs");
        List<TsExpression> roots = new ArrayList<>(outputs.size());
        for (String out : outputs) {
            TsExpression e = built.get(out);
            if (e == null)
                throw new IllegalArgumentException("Unknown output node: " + out);
            roots.add(e);
        }
        log.debug("Compiled definition '{}': {} nodes, {} outputs", def.getName(), built.size(), roots.size());
        return TsVector.of(roots);
    }

    private static TsExpression instantiate(ExpressionDefinition.NodeDef nd, Map<String, TsExpression> built) {
        NodeKind kind = NodeKind.fromString(nd.getType());
        Map<String, Object> props = nd.getProperties() != null ? nd.getProperties() : Collections.emptyMap();
        return switch (kind) {
            case POINT -> {
                TimeAxis axis = getAxis(props, "axis", nd);
                PointInterpretation fx = "instant".equalsIgnoreCase(String.valueOf(props.get("interpretation")))
                        ? PointInterpretation.POINT_INSTANT_VALUE
                        : PointInterpretation.POINT_AVERAGE_VALUE;
                yield new PointNode(new PointSeries(axis, getDoubles(props, "values", nd), fx));
            }
            case REFERENCE -> new ReferenceNode(getString(props, "id", nd));
            case AVERAGE -> new AverageNode(input(nd, "source", built), getAxis(props, "axis", nd));
            case INTEGRAL -> new IntegralNode(input(nd, "source", built), getAxis(props, "axis", nd));
            case ACCUMULATE -> new AccumulateNode(input(nd, "source", built), getAxis(props, "axis", nd));
            case TIME_SHIFT -> new TimeShiftNode(input(nd, "source", built), getLong(props, "dt", nd));
            case PERIODIC -> new PeriodicNode(getDoubles(props, "profile", nd), getLong(props, "dt", nd),
                    getLong(props, "t0", nd), getAxis(props, "axis", nd));
            case CONVOLVE -> new ConvolveNode(input(nd, "source", built), getDoubles(props, "weights", nd),
                    props.get("policy") == null ? ConvolvePolicy.USE_ZERO
                            : ConvolvePolicy.valueOf(String.valueOf(props.get("policy")).toUpperCase()));
            case BINARY_OP -> new BinaryOpNode(input(nd, "lhs", built), getOp(props, nd), input(nd, "rhs", built));
            case BINARY_OP_SCALAR -> new BinaryOpScalarNode(input(nd, "lhs", built), getOp(props, nd),
                    getDouble(props, "scalar", nd));
            case SCALAR_OP_SERIES -> new ScalarOpSeriesNode(getDouble(props, "scalar", nd), getOp(props, nd),
                    input(nd, "rhs", built));
            case VECTOR -> throw new IllegalArgumentException(
                    "Node '" + nd.getName() + "': vectors are declared through 'outputs'");
        };
    }

    private static Map<String, String> inputs(ExpressionDefinition.NodeDef nd) {
        return nd.getInputs() != null ? nd.getInputs() : Collections.emptyMap();
    }

    private static TsExpression input(ExpressionDefinition.NodeDef nd, String key, Map<String, TsExpression> built) {
        String ref = inputs(nd).get(key);
        if (ref == null)
            throw new IllegalArgumentException("Node '" + nd.getName() + "' is missing input '" + key + "'");
        return built.get(ref);
    }

    private static Object require(Map<String, Object> props, String key, ExpressionDefinition.NodeDef nd) {
        Object v = props.get(key);
        if (v == null)
            throw new IllegalArgumentException("Node '" + nd.getName() + "' is missing property '" + key + "'");
        return v;
    }

    static String getString(Map<String, Object> props, String key, ExpressionDefinition.NodeDef nd) {
        return String.valueOf(require(props, key, nd));
    }

    static double getDouble(Map<String, Object> props, String key, ExpressionDefinition.NodeDef nd) {
        Object v = require(props, key, nd);
        if (v instanceof Number num)
            return num.doubleValue();
        return Double.parseDouble(v.toString());
    }

    static long getLong(Map<String, Object> props, String key, ExpressionDefinition.NodeDef nd) {
        Object v = require(props, key, nd);
        if (v instanceof Number num)
            return num.longValue();
        return Long.parseLong(v.toString());
    }

    static double[] getDoubles(Map<String, Object> props, String key, ExpressionDefinition.NodeDef nd) {
        Object v = require(props, key, nd);
        if (!(v instanceof List<?> list))
            throw new IllegalArgumentException("Node '" + nd.getName() + "' property '" + key + "' must be a list");
        double[] out = new double[list.size()];
        for (int i = 0; i < out.length; i++) {
            Object e = list.get(i);
            out[i] = e == null ? Double.NaN : ((Number) e).doubleValue();
        }
        return out;
    }

    static TimeAxis getAxis(Map<String, Object> props, String key, ExpressionDefinition.NodeDef nd) {
        Object v = require(props, key, nd);
        if (!(v instanceof Map<?, ?> m))
            throw new IllegalArgumentException("Node '" + nd.getName() + "' property '" + key + "' must be an object");
        @SuppressWarnings("unchecked")
        Map<String, Object> axis = (Map<String, Object>) m;
        return new TimeAxis(getLong(axis, "start", nd), getLong(axis, "dt", nd), (int) getLong(axis, "n", nd));
    }

    static OpCode getOp(Map<String, Object> props, ExpressionDefinition.NodeDef nd) {
        return OpCode.fromString(getString(props, "op", nd));
    }
}
