package net.langexplorer.api.grammar;

/**
 * Exception thrown when a grammar is structurally unable to produce a
 * program.
 * Unlike NoValidExpansionException, this indicates a malformed grammar
 * rather than an unlucky derivation, and retrying will not help.
 */
public class InvalidGrammarException extends GrammarException {

    public InvalidGrammarException() {
        super();
    }
    public InvalidGrammarException(String message) {
        super(message);
    }
    public InvalidGrammarException(Throwable cause) {
        super(cause);
    }
    public InvalidGrammarException(String message, Throwable cause) {
        super(message, cause);
    }

}
