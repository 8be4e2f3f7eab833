package br.edu.ifba.ragflow.pipeline;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Binds a field published by an earlier stage to an input field of a later one.
 *
 * @param fromStage name of the stage that published the value
 * @param inputField name under which the value is bound in the consuming stage's input
 * @param outputField name of the field the source stage published to the state
 */
public record UpstreamRef(
        @NotNull String fromStage,
        @NotNull String inputField,
        @NotNull String outputField
) {
    public UpstreamRef {
        Objects.requireNonNull(fromStage, "fromStage must not be null");
        Objects.requireNonNull(inputField, "inputField must not be null");
        Objects.requireNonNull(outputField, "outputField must not be null");
    }

    /**
     * Creates a reference whose input field has the same name as the published field.
     */
    public static UpstreamRef of(@NotNull String fromStage, @NotNull String field) {
        return new UpstreamRef(fromStage, field, field);
    }
}
