package br.edu.ifba.ragflow.state;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when deleting a field that the stage never published.
 */
public class FieldNotFoundException extends StateException {

    private final String stageName;
    private final String fieldName;

    public FieldNotFoundException(@NotNull String stageName, @NotNull String fieldName) {
        super("Field '" + fieldName + "' not found for stage '" + stageName + "'");
        this.stageName = stageName;
        this.fieldName = fieldName;
    }

    @NotNull
    public String getStageName() {
        return stageName;
    }

    @NotNull
    public String getFieldName() {
        return fieldName;
    }
}
