package com.lokitext.utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Simple command line parser.
 *
 * <pre>
 *   Args.match()
 *       .on(options("--pattern", "-p"), patterns::add)
 *       .on("--json", () -> json = true)
 *       .rest(files::addAll)
 *       .parse(args);
 * </pre>
 *
 * Options are matched case-insensitively. An option taking a value consumes
 * the argument that follows it. Arguments no option consumed go to the
 * rest handler.
 */
public class Args {
    private final List<Matcher> matchers = new ArrayList<>();
    private Consumer<List<String>> restHandler;

    public static Args match() {
        return new Args();
    }

    public static Predicate<String> options(String... alternatives) {
        return s -> Arrays.stream(alternatives).anyMatch(alt -> alt.equalsIgnoreCase(s));
    }

    public Args on(String option, Runnable handler) {
        return on(options(option), handler);
    }

    public Args on(String option, Consumer<String> handler) {
        return on(options(option), handler);
    }

    public Args on(Predicate<String> test, Runnable handler) {
        matchers.add(args -> {
            if (!test.test(args.arg())) return false;
            handler.run();
            return true;
        });
        return this;
    }

    /**
     * The handler receives the argument after the option, or throws
     * IllegalArgumentException from parse() if there is none.
     */
    public Args on(Predicate<String> test, Consumer<String> handler) {
        matchers.add(args -> {
            if (!test.test(args.arg())) return false;
            handler.accept(args.value());
            return true;
        });
        return this;
    }

    public Args rest(Consumer<List<String>> handler) {
        this.restHandler = handler;
        return this;
    }

    public void parse(String... someArgs) {
        ArgsIterator args = new ArgsIterator(someArgs);
        while (args.hasNext()) {
            args.matchNext(matchers);
        }
        if (restHandler != null) {
            restHandler.accept(args.rest());
        }
    }

    interface Matcher {
        /** @return true if option was consumed **/
        boolean match(ArgsIterator args);
    }

    static class ArgsIterator {
        final String[] allArgs;
        final BitSet consumed;
        int current;

        ArgsIterator(String[] args) {
            this.allArgs = args;
            this.consumed = new BitSet(args.length);
        }

        String arg() {
            return allArgs[current];
        }

        String value() {
            int next = current + 1;
            if (next >= allArgs.length || consumed.get(next)) {
                throw new IllegalArgumentException("Missing value for " + arg());
            }
            consumed.set(next);
            return allArgs[next];
        }

        List<String> rest() {
            // all unconsumed arguments
            List<String> rest = new ArrayList<>();
            for (int i = consumed.nextClearBit(0); i < allArgs.length; i = consumed.nextClearBit(i + 1)) {
                consumed.set(i);
                rest.add(allArgs[i]);
            }
            return rest;
        }

        void matchNext(List<Matcher> matchers) {
            int currentOption = current;
            for (Matcher m : matchers) {
                if (m.match(this)) {
                    consumed.set(currentOption);
                    break;
                }
            }
            advance();
        }

        void advance() {
            current++;
            // find next unconsumed
            while (hasNext() && consumed.get(current)) current++;
        }

        boolean hasNext() {
            return current < allArgs.length;
        }
    }
}
