package net.langexplorer.api.grammar;

/**
 * Exception thrown when a grammar has no context-free production for its
 * root symbol.
 */
public class NoRootProductionException extends InvalidGrammarException {

    public NoRootProductionException() {
        super();
    }
    public NoRootProductionException(String message) {
        super(message);
    }
    public NoRootProductionException(Throwable cause) {
        super(cause);
    }
    public NoRootProductionException(String message, Throwable cause) {
        super(message, cause);
    }

}
