package net.langexplorer.api.grammar;

/**
 * Exception thrown when a context-sensitive derivation reaches a state in
 * which no left-hand side matches the frontier.
 * No backtracking is attempted; callers generating many programs may treat
 * this as a lost attempt and start over.
 */
public class NoValidExpansionException extends GrammarException {

    public NoValidExpansionException() {
        super();
    }
    public NoValidExpansionException(String message) {
        super(message);
    }
    public NoValidExpansionException(Throwable cause) {
        super(cause);
    }
    public NoValidExpansionException(String message, Throwable cause) {
        super(message, cause);
    }

}
