package com.asmblr.dag.api;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.asmblr.dag.error.NodeConstructionException;
import com.asmblr.dag.value.Value;
import com.asmblr.dag.value.Values;

/**
 * Socket layout of a node type: ordered inputs (with type hint, default value and
 * variadic flag) and ordered output names.
 *
 * <p>
 * At most one input may be variadic (the collector that accepts fan-in), and a
 * type must declare at least one output.
 */
public record NodeSchema(String typeName, List<InputSpec> inputs, List<String> outputs) {

    public NodeSchema {
        if (typeName == null || typeName.isBlank())
            throw new NodeConstructionException("Node type name must not be blank", null, typeName);
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);

        Set<String> seen = new HashSet<>();
        int variadic = 0;
        for (InputSpec in : inputs) {
            if (!seen.add(in.name()))
                throw new NodeConstructionException("Duplicate input socket '" + in.name() + "'", null, typeName);
            if (in.variadic())
                variadic++;
        }
        if (variadic > 1)
            throw new NodeConstructionException("At most one variadic input is allowed, found " + variadic, null,
                    typeName);
        if (outputs.isEmpty())
            throw new NodeConstructionException("A node type needs at least one output socket", null, typeName);
        if (new HashSet<>(outputs).size() != outputs.size())
            throw new NodeConstructionException("Duplicate output socket in " + outputs, null, typeName);
    }

    public static Builder builder(String typeName) {
        return new Builder(typeName);
    }

    public Optional<InputSpec> input(String name) {
        return inputs.stream().filter(in -> in.name().equals(name)).findFirst();
    }

    /** The collector input, if the type declares one. */
    public Optional<InputSpec> variadicInput() {
        return inputs.stream().filter(InputSpec::variadic).findFirst();
    }

    public List<String> inputNames() {
        return inputs.stream().map(InputSpec::name).toList();
    }

    /** One input socket declaration. */
    public record InputSpec(String name, String typeHint, Value defaultValue, boolean variadic) {

        public InputSpec {
            if (name == null || name.isBlank())
                throw new IllegalArgumentException("Input socket name must not be blank");
            if (defaultValue == null)
                defaultValue = Values.none();
        }
    }

    /** Fluent schema builder. */
    public static final class Builder {
        private final String typeName;
        private final List<InputSpec> inputs = new ArrayList<>();
        private final List<String> outputs = new ArrayList<>();

        private Builder(String typeName) {
            this.typeName = typeName;
        }

        public Builder input(String name) {
            return input(name, null, Values.none());
        }

        public Builder input(String name, String typeHint) {
            return input(name, typeHint, Values.none());
        }

        public Builder input(String name, String typeHint, Value defaultValue) {
            inputs.add(new InputSpec(name, typeHint, defaultValue, false));
            return this;
        }

        public Builder variadicInput(String name, String typeHint) {
            inputs.add(new InputSpec(name, typeHint, Values.none(), true));
            return this;
        }

        public Builder output(String name) {
            outputs.add(name);
            return this;
        }

        public NodeSchema build() {
            return new NodeSchema(typeName, inputs, outputs);
        }
    }
}
