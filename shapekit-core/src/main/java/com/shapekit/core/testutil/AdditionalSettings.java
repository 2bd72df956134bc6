package com.shapekit.core.testutil;

import com.shapekit.core.codegen.CodegenSettings;
import com.shapekit.core.util.Nodes;
import software.amazon.smithy.model.node.Node;
import software.amazon.smithy.model.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Typed fragments of a plugin settings document, mostly keys of its {@code codegen} object.
 *
 * <p>Fragments combine with {@link #merge(AdditionalSettings)}; the merged document is a deep
 * merge in order, so two fragments that both set keys under {@code codegen} keep both keys and
 * a later fragment wins a conflict on the same key.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * ObjectNode settings = new AdditionalSettings.GenerateCodegenComments(true)
 *     .merge(new AdditionalSettings.PublicConstrainedTypes(false))
 *     .toObjectNode();
 * // {"codegen": {"debugMode": true, "publicConstrainedTypes": false}}
 * }</pre>
 */
public interface AdditionalSettings {

    /**
     * Renders the fragment as a settings document.
     *
     * @return settings document
     */
    ObjectNode toObjectNode();

    /**
     * Combines this fragment with another; {@code other} wins conflicts.
     *
     * @param other fragment to apply after this one
     * @return merged fragment
     */
    default AdditionalSettings merge(AdditionalSettings other) {
        Objects.requireNonNull(other, "other must not be null");
        return Merged.of(this, other);
    }

    /**
     * Combines fragments in order.
     *
     * @param settings fragments, later ones win conflicts
     * @return merged fragment
     */
    static AdditionalSettings merge(AdditionalSettings... settings) {
        return Merged.of(settings);
    }

    /**
     * Turns provenance comments in generated code on or off.
     *
     * @param debugMode whether to emit comments
     */
    record GenerateCodegenComments(boolean debugMode) implements AdditionalSettings {
        public GenerateCodegenComments() {
            this(true);
        }

        @Override
        public ObjectNode toObjectNode() {
            return Merged.codegen("debugMode", Node.from(debugMode));
        }
    }

    /**
     * Controls whether constraint violation types are public.
     *
     * @param enabled whether the types are public
     */
    record PublicConstrainedTypes(boolean enabled) implements AdditionalSettings {
        @Override
        public ObjectNode toObjectNode() {
            return Merged.codegen("publicConstrainedTypes", Node.from(enabled));
        }
    }

    /**
     * Fragments applied in order.
     *
     * @param settings fragments, later ones win conflicts
     */
    record Merged(List<AdditionalSettings> settings) implements AdditionalSettings {
        public Merged {
            settings = List.copyOf(Objects.requireNonNull(settings, "settings must not be null"));
        }

        /**
         * Merges fragments in order, splicing in the parts of merged fragments so the result
         * is never nested.
         *
         * @param settings fragments, later ones win conflicts
         * @return flat merged fragment
         */
        public static Merged of(AdditionalSettings... settings) {
            List<AdditionalSettings> parts = new ArrayList<>();
            for (AdditionalSettings setting : settings) {
                Objects.requireNonNull(setting, "setting must not be null");
                if (setting instanceof Merged merged) {
                    parts.addAll(merged.settings());
                } else {
                    parts.add(setting);
                }
            }
            return new Merged(parts);
        }

        static ObjectNode codegen(String key, Node value) {
            return Node.objectNode().withMember(CodegenSettings.CODEGEN_KEY, Node.objectNode().withMember(key, value));
        }

        @Override
        public ObjectNode toObjectNode() {
            ObjectNode result = Node.objectNode();
            for (AdditionalSettings setting : settings) {
                result = Nodes.deepMerge(result, setting.toObjectNode());
            }
            return result;
        }
    }
}
