// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package scribe.util;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An operation trace message, established with try-with-resources around a step of the generation process.
 * <p>
 * Traces describe, in words a user understands, what the generator was doing when something went wrong: loading
 * which unit, evaluating which fragment, deploying which file. They are not a stack trace, and nothing is printed
 * unless a fatal condition is reported.
 * <p>
 * Traces belong to the thread that created them and must be closed in reverse order of creation.
 */
public final class Trace implements AutoCloseable {
    /**
     * Establishes a trace whose message is computed only if somebody asks for it.
     */
    public Trace(final Supplier<String> supplier) {
        this((Object) supplier);
    }

    /**
     * Establishes a trace with a fixed message.
     */
    public Trace(final String message) {
        this((Object) message);
    }

    private Trace(final Object messageOrSupplier) {
        final var chain = chain();
        next = chain.innermost;
        this.messageOrSupplier = messageOrSupplier;
        owner = chain;
        chain.innermost = this;
    }

    /**
     * Returns the messages of the calling thread's active traces, innermost first.
     */
    public static List<String> activeTraces() {
        final var messages = new ArrayList<String>();
        for (var trace = chain().innermost; trace != null; trace = trace.next) {
            messages.add(trace.message());
        }
        return messages;
    }

    /**
     * Does nothing; referencing the resource keeps compilers from warning about an unused try-with-resources
     * variable.
     */
    @SuppressWarnings("EmptyMethod")
    public void use() {
    }

    @Override
    public void close() {
        assert owner == chain() : "Trace closed by a different thread";
        assert owner.innermost == this : "Traces closed out of order";
        owner.innermost = next;
    }

    private String message() {
        if (messageOrSupplier instanceof final Supplier<?> supplier) {
            final var message = String.valueOf(supplier.get());
            messageOrSupplier = message;
            return message;
        }
        return (String) messageOrSupplier;
    }

    private static Chain chain() {
        return chains.get();
    }

    @SuppressWarnings("nullness:type.argument") // withInitial never yields null.
    private static final ThreadLocal<Chain> chains = ThreadLocal.withInitial(Chain::new);

    private final @Nullable Trace next;
    private final Chain owner;
    // Either the message itself or a supplier not called yet.
    private Object messageOrSupplier;

    private static final class Chain {
        private @Nullable Trace innermost = null;
    }
}
