package io.github.cyfko.truthtable.core.exception;

import io.github.cyfko.truthtable.core.eval.Evaluator;
import io.github.cyfko.truthtable.core.model.Binding;

/**
 * Exception thrown when an expression is evaluated against a {@link Binding} that has
 * no value for one of its variables.
 * <p>
 * Tables built by the generator always bind exactly the collected variables, so this
 * exception signals a caller passing a hand-made binding, or a broken invariant.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 * @see Evaluator
 */
public class UnboundVariableException extends RuntimeException {

    private final char variable;

    /**
     * @param variable the variable with no value in the binding
     */
    public UnboundVariableException(char variable) {
        super("Variable '" + variable + "' is not bound");
        this.variable = variable;
    }

    /**
     * @param variable the variable with no value in the binding
     * @param message  the message describing the cause of the exception
     */
    public UnboundVariableException(char variable, String message) {
        super(message);
        this.variable = variable;
    }

    public char getVariable() {
        return variable;
    }
}
