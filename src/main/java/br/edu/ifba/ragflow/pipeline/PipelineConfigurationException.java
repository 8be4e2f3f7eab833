package br.edu.ifba.ragflow.pipeline;

/**
 * Thrown when a pipeline is wired incorrectly.
 *
 * <p>Raised by {@link AsyncPipeline#addPipe} for duplicate stage names and references to
 * unknown stages, and on first resolution of a stage whose upstream field was never
 * published.</p>
 */
public class PipelineConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PipelineConfigurationException(String message) {
        super(message);
    }

    public PipelineConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
