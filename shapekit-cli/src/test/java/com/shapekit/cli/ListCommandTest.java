package com.shapekit.cli;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ListCommand}.
 */
class ListCommandTest {

    @Test
    void call_protocols_listsEveryProtocol() {
        CommandTestSupport.Result result = CommandTestSupport.run("list", "protocols");

        assertThat(result.exitCode()).isZero();
        assertThat(result.output())
            .contains("Known Protocols:")
            .contains("aws.protocols#restJson1")
            .contains("aws.protocols#awsJson1_0")
            .contains("aws.protocols#awsJson1_1")
            .contains("aws.protocols#restXml")
            .contains("smithy.protocols#rpcv2Cbor");
    }

    @Test
    void call_generators_reportsEmptyRegistry() {
        CommandTestSupport.Result result = CommandTestSupport.run("list", "generators");

        assertThat(result.exitCode()).isZero();
        assertThat(result.output())
            .contains("Available Event Stream Generators:")
            .contains("No generators found.");
    }

    @Test
    void call_unknownType_returnsError() {
        CommandTestSupport.Result result = CommandTestSupport.run("list", "renderers");

        assertThat(result.exitCode()).isEqualTo(1);
    }
}
