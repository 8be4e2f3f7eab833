package br.edu.ifba.ragflow.state;

import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a stage is read or deleted before it published anything in the current run.
 */
public class StageNotFoundException extends StateException {

    private final String stageName;

    public StageNotFoundException(@NotNull String stageName) {
        super("Stage '" + stageName + "' not found in state");
        this.stageName = stageName;
    }

    @NotNull
    public String getStageName() {
        return stageName;
    }
}
