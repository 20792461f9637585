/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.testrelay.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * A {@link MessageSink} that records every message it receives and fires a one-shot
 * {@link CompletionSignal} when the final message of a session arrives.
 * <p>
 * Used to block a thread until discovery or execution is complete, and as a test double.
 * <pre>
 * CompletionSink sink = CompletionSink.finishedBy(DiscoveryComplete.class);
 * discoverer.find(false, sink, options);
 * sink.waitForCompletion();
 * </pre>
 * <p>
 * Never call {@link #waitForCompletion()} from inside a delivery to the same sink.
 */
public class CompletionSink implements MessageSink, AutoCloseable {

    private final Predicate<Message> finalMessage;
    private final Predicate<Message> cancellation;
    private final List<Message> messages = Collections.synchronizedList(new ArrayList<>());
    private final CompletionSignal finished = new CompletionSignal();

    public CompletionSink(Predicate<Message> finalMessage) {
        this(finalMessage, null);
    }

    /**
     * @param finalMessage matches the message that completes the session
     * @param cancellation decides the return value of {@link #onMessage(Message)}, null means
     *                     always continue
     */
    public CompletionSink(Predicate<Message> finalMessage, Predicate<Message> cancellation) {
        if (finalMessage == null) {
            throw new IllegalArgumentException("finalMessage must not be null");
        }
        this.finalMessage = finalMessage;
        this.cancellation = cancellation == null ? message -> true : cancellation;
    }

    public static CompletionSink finishedBy(Class<? extends Message> finalType) {
        return new CompletionSink(finalType::isInstance);
    }

    public static CompletionSink finishedBy(Class<? extends Message> finalType, Predicate<Message> cancellation) {
        return new CompletionSink(finalType::isInstance, cancellation);
    }

    @Override
    public boolean onMessage(Message message) {
        messages.add(message);
        if (finalMessage.test(message)) {
            finished.set();
        }
        return cancellation.test(message);
    }

    /**
     * Returns a snapshot of the messages received so far, in delivery order.
     */
    public List<Message> getMessages() {
        synchronized (messages) {
            return new ArrayList<>(messages);
        }
    }

    public <T extends Message> List<T> getMessages(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (Message message : getMessages()) {
            if (type.isInstance(message)) {
                result.add(type.cast(message));
            }
        }
        return result;
    }

    public boolean isFinished() {
        return finished.isSet();
    }

    public CompletionSignal getFinished() {
        return finished;
    }

    /**
     * Blocks until the final message was received. Returns at once if it already was.
     *
     * @throws IllegalStateException if the sink is closed before the final message arrives
     */
    public void waitForCompletion() throws InterruptedException {
        finished.await();
    }

    public boolean waitForCompletion(long timeout, TimeUnit unit) throws InterruptedException {
        return finished.await(timeout, unit);
    }

    @Override
    public void close() {
        finished.close();
    }

}
