package com.shapekit.core.fixture;

import software.amazon.smithy.aws.traits.protocols.AwsJson1_0Trait;
import software.amazon.smithy.aws.traits.protocols.AwsJson1_1Trait;
import software.amazon.smithy.aws.traits.protocols.RestJson1Trait;
import software.amazon.smithy.aws.traits.protocols.RestXmlTrait;
import software.amazon.smithy.model.shapes.ShapeId;
import software.amazon.smithy.model.traits.Trait;
import software.amazon.smithy.protocol.traits.Rpcv2CborTrait;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Wire protocols a service can be annotated with, each bound to its protocol trait.
 */
public enum Protocol {
    AWS_JSON_1_0(AwsJson1_0Trait.builder().build()),
    AWS_JSON_1_1(AwsJson1_1Trait.builder().build()),
    REST_JSON_1(RestJson1Trait.builder().build()),
    REST_XML(RestXmlTrait.builder().build()),
    RPC_V2_CBOR(Rpcv2CborTrait.builder().build());

    private final Trait trait;

    Protocol(Trait trait) {
        this.trait = trait;
    }

    public Trait trait() {
        return trait;
    }

    public ShapeId traitId() {
        return trait.toShapeId();
    }

    /**
     * Returns the protocol's trait name, e.g. {@code restJson1}.
     *
     * @return display name
     */
    public String displayName() {
        return traitId().getName();
    }

    /**
     * Looks a protocol up by trait name ({@code restJson1}), absolute trait id
     * ({@code aws.protocols#restJson1}) or constant name ({@code REST_JSON_1}).
     *
     * @param name protocol name, case-insensitive
     * @return matching protocol
     * @throws IllegalArgumentException if no protocol matches
     */
    public static Protocol fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Protocol name must not be blank");
        }
        String trimmed = name.trim();
        for (Protocol protocol : values()) {
            if (protocol.name().equalsIgnoreCase(trimmed)
                || protocol.traitId().getName().equalsIgnoreCase(trimmed)
                || protocol.traitId().toString().equalsIgnoreCase(trimmed)) {
                return protocol;
            }
        }
        throw new IllegalArgumentException("Unknown protocol: " + name + ". Known protocols: "
            + Arrays.stream(values()).map(Protocol::displayName).collect(Collectors.joining(", ")));
    }
}
