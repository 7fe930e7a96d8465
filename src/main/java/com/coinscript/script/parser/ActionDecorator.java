package com.coinscript.script.parser;

import java.util.Collections;
import java.util.List;

import com.coinscript.script.parser.SourceExpression.ExprInterface;

/**
 * What an action's decorator asks for. Every action carries exactly one variant;
 * undecorated actions are {@link Plain}.
 */
public abstract class ActionDecorator {

    public interface Visitor<R> {
        R visitPlain(Plain decorator);
        R visitAccessRestricted(AccessRestricted decorator);
        R visitStateful(Stateful decorator);
    }

    private ActionDecorator() {}

    public abstract <R> R accept(Visitor<R> visitor);

    public static final class Plain extends ActionDecorator {
        static final Plain INSTANCE = new Plain();

        private Plain() {}

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitPlain(this); }
    }

    /** {@code @onlyAddress(a, b, ...)}: the spend needs a signature from one of the identities. */
    public static final class AccessRestricted extends ActionDecorator {
        public final Token token;
        public final List<ExprInterface> identities;

        AccessRestricted(Token token, List<ExprInterface> identities) {
            this.token = token;
            this.identities = Collections.unmodifiableList(identities);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitAccessRestricted(this); }
    }

    /** {@code @stateful}: the action reads and replaces the state tuple. */
    public static final class Stateful extends ActionDecorator {
        public final Token token;

        Stateful(Token token) {
            this.token = token;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) { return visitor.visitStateful(this); }
    }

    public static ActionDecorator plain() {
        return Plain.INSTANCE;
    }
}
