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

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * A {@link MessageSink} that dispatches each message to the handlers registered for its
 * concrete class, in order.
 * <p>
 * Subclasses compose behavior through the handler list: a reporter that extends another one
 * adds its own handlers with {@link #addHandlerFirst} to run before the inherited ones, or with
 * {@link #addHandler} to run after them. A message without handlers is ignored.
 */
public class TypedMessageSink implements MessageSink {

    private final Map<Class<? extends Message>, List<MessageHandler<? extends Message>>> handlers =
            new ConcurrentHashMap<>();

    public <T extends Message> void addHandler(Class<T> type, MessageHandler<T> handler) {
        handlersFor(type, handler).add(handler);
    }

    public <T extends Message> void addHandlerFirst(Class<T> type, MessageHandler<T> handler) {
        handlersFor(type, handler).add(0, handler);
    }

    private List<MessageHandler<? extends Message>> handlersFor(Class<? extends Message> type, MessageHandler<?> handler) {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        return handlers.computeIfAbsent(type, k -> new CopyOnWriteArrayList<>());
    }

    public int getHandlerCount(Class<? extends Message> type) {
        List<MessageHandler<? extends Message>> list = handlers.get(type);
        return list == null ? 0 : list.size();
    }

    @Override
    public boolean onMessage(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("message must not be null");
        }
        List<MessageHandler<? extends Message>> list = handlers.get(message.getClass());
        if (list == null || list.isEmpty()) {
            return true;
        }
        MessageHandlerArgs<Message> args = new MessageHandlerArgs<>(message);
        for (MessageHandler<? extends Message> handler : list) {
            dispatch(handler, args);
        }
        return !args.isStopped();
    }

    @SuppressWarnings("unchecked")
    private static void dispatch(MessageHandler<? extends Message> handler, MessageHandlerArgs<Message> args) {
        ((MessageHandler<Message>) handler).handle(args);
    }

}
