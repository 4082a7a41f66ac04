package com.ecgpda.server.automaton;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The stack effect of a transition. The stack is a list whose last element is
 * the top.
 */
public abstract class StackOperation {

    public enum Kind {
        POP, NOOP, PUSH, POP_THEN_PUSH
    }

    private static final StackOperation POP = new Pop();
    private static final StackOperation NOOP = new NoOp();

    private StackOperation() {
    }

    public static StackOperation pop() {
        return POP;
    }

    public static StackOperation noop() {
        return NOOP;
    }

    /**
     * Pushes the symbols in the given order, so the last one ends on top.
     */
    public static StackOperation push(String... symbols) {
        return new Push(Arrays.asList(symbols));
    }

    public static StackOperation popThenPush(String symbol) {
        return new PopThenPush(symbol);
    }

    public abstract Kind getKind();

    /**
     * Symbols this operation pushes, in push order. Empty for POP and NOOP.
     */
    public abstract List<String> getPushedSymbols();

    abstract void applyTo(List<String> stack);

    private static final class Pop extends StackOperation {
        @Override
        public Kind getKind() {
            return Kind.POP;
        }

        @Override
        public List<String> getPushedSymbols() {
            return Collections.emptyList();
        }

        @Override
        void applyTo(List<String> stack) {
            stack.remove(stack.size() - 1);
        }

        @Override
        public String toString() {
            return "pop";
        }
    }

    private static final class NoOp extends StackOperation {
        @Override
        public Kind getKind() {
            return Kind.NOOP;
        }

        @Override
        public List<String> getPushedSymbols() {
            return Collections.emptyList();
        }

        @Override
        void applyTo(List<String> stack) {
        }

        @Override
        public String toString() {
            return "noop";
        }
    }

    private static final class Push extends StackOperation {
        private final List<String> symbols;

        Push(List<String> symbols) {
            if (symbols.isEmpty()) {
                throw new IllegalArgumentException("push requires at least one symbol");
            }
            for (String s : symbols) {
                if (s == null) {
                    throw new NullPointerException("push symbol must not be null");
                }
            }
            this.symbols = List.copyOf(symbols);
        }

        @Override
        public Kind getKind() {
            return Kind.PUSH;
        }

        @Override
        public List<String> getPushedSymbols() {
            return symbols;
        }

        @Override
        void applyTo(List<String> stack) {
            stack.addAll(symbols);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            for (String s : symbols) {
                if (sb.length() > 0) {
                    sb.append(", ");
                }
                sb.append("push ").append(s);
            }
            return sb.toString();
        }
    }

    private static final class PopThenPush extends StackOperation {
        private final String symbol;

        PopThenPush(String symbol) {
            if (symbol == null) {
                throw new NullPointerException("push symbol must not be null");
            }
            this.symbol = symbol;
        }

        @Override
        public Kind getKind() {
            return Kind.POP_THEN_PUSH;
        }

        @Override
        public List<String> getPushedSymbols() {
            return List.of(symbol);
        }

        @Override
        void applyTo(List<String> stack) {
            stack.remove(stack.size() - 1);
            stack.add(symbol);
        }

        @Override
        public String toString() {
            return "pop, push " + symbol;
        }
    }
}
