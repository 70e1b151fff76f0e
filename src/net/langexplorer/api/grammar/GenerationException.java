package net.langexplorer.api.grammar;

/**
 * Exception thrown when a batch of generation workers fails as a whole.
 */
public class GenerationException extends GrammarException {

    public GenerationException() {
        super();
    }
    public GenerationException(String message) {
        super(message);
    }
    public GenerationException(Throwable cause) {
        super(cause);
    }
    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }

}
