package org.tacc.compiler.frontend.parser.ast;

import java.math.BigInteger;
import java.util.Objects;

/**
 * An integer literal.
 * <p>
 * The value is kept at arbitrary precision; literals are emitted verbatim and never range-checked.
 *
 * @param value The literal value.
 */
public record NumberNode(BigInteger value) implements AstNode {

    public NumberNode {
        Objects.requireNonNull(value, "value");
    }

    public NumberNode(long value) {
        this(BigInteger.valueOf(value));
    }

    @Override
    public <R, E extends Exception> R accept(AstVisitor<R, E> visitor) throws E {
        return visitor.visitNumber(this);
    }
}
