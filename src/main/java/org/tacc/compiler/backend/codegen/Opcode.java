package org.tacc.compiler.backend.codegen;

import java.util.Map;
import java.util.Optional;

/**
 * Instructions of the accumulator machine targeted by the {@link CodeGenerator}.
 * <p>
 * Every instruction takes exactly one operand: an integer literal, a variable or temporary
 * name, or a label.
 */
public enum Opcode {
    /** Load an integer literal into the accumulator. */
    LOADI,
    /** Load a variable into the accumulator. */
    LOAD,
    /** Store the accumulator into a variable. */
    STORE,
    ADD,
    SUB,
    MUL,
    DIV,
    /** Compare the accumulator with a variable. The comparison kind is not encoded. */
    CMP,
    /** Jump to a label if the last comparison was false. */
    JMP_FALSE,
    JMP;

    private static final Map<String, Opcode> OPERATORS = Map.of(
            "+", ADD,
            "-", SUB,
            "*", MUL,
            "/", DIV,
            "==", CMP,
            "!=", CMP,
            "<", CMP,
            ">", CMP,
            "<=", CMP,
            ">=", CMP
    );

    /**
     * Looks up the opcode implementing a binary operator. All six comparisons share {@link #CMP}.
     *
     * @param operator The operator text.
     * @return The opcode, or empty if the operator has no mapping.
     */
    public static Optional<Opcode> forOperator(String operator) {
        return Optional.ofNullable(OPERATORS.get(operator));
    }

    /**
     * Renders this opcode with its operand in the textual instruction format.
     *
     * @param operand The single operand.
     * @return e.g. {@code "LOADI 10"}.
     */
    public String format(Object operand) {
        return name() + " " + operand;
    }
}
