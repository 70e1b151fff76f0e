package net.langexplorer.api.grammar;

/**
 * Exception thrown when a rule references a non-terminal that has no
 * (context-free) production.
 */
public class UnknownNonterminalException extends InvalidGrammarException {

    public UnknownNonterminalException() {
        super();
    }
    public UnknownNonterminalException(String message) {
        super(message);
    }
    public UnknownNonterminalException(Throwable cause) {
        super(cause);
    }
    public UnknownNonterminalException(String message, Throwable cause) {
        super(message, cause);
    }

}
