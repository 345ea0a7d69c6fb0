package org.dxworks.ommltex;

import org.dxworks.ommltex.node.NodeFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps OMML local tag names to node factories. A registry is immutable once built; the default one
 * is built from {@link NodeKind} during class initialization, before any parse can run.
 */
public class NodeRegistry {

    private static final NodeRegistry DEFAULT = fromKinds(NodeKind.values());

    private final Map<String, NodeFactory> factories;

    private NodeRegistry(Map<String, NodeFactory> factories) {
        this.factories = Collections.unmodifiableMap(new LinkedHashMap<>(factories));
    }

    public static NodeRegistry defaultRegistry() {
        return DEFAULT;
    }

    public static NodeRegistry fromKinds(NodeKind... kinds) {
        Builder builder = builder();
        for (NodeKind kind : kinds) {
            builder.register(kind.getTag(), kind.getFactory());
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<NodeFactory> lookup(String localName) {
        if (localName == null) return Optional.empty();
        return Optional.ofNullable(factories.get(localName));
    }

    public boolean isRegistered(String localName) {
        return factories.containsKey(localName);
    }

    public Set<String> registeredTags() {
        return factories.keySet();
    }

    public static class Builder {
        private final Map<String, NodeFactory> factories = new LinkedHashMap<>();

        /**
         * @throws IllegalStateException when the tag already has a factory
         */
        public Builder register(String tag, NodeFactory factory) {
            if (tag == null || factory == null) {
                throw new IllegalArgumentException("Tag and factory are required");
            }
            if (factories.containsKey(tag)) {
                throw new IllegalStateException("OMML tag already registered: " + tag);
            }
            factories.put(tag, factory);
            return this;
        }

        public NodeRegistry build() {
            return new NodeRegistry(factories);
        }
    }
}
