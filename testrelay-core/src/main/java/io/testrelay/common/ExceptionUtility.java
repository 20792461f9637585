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
package io.testrelay.common;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Flattens nested errors into {@link FailureInfo} and renders the combined message and
 * stack trace text that reporters show for a failure.
 */
public final class ExceptionUtility {

    private static final String NEW_LINE = System.lineSeparator();

    private ExceptionUtility() {
    }

    public static FailureInfo toFailureInfo(Throwable error) {
        return toFailureInfo(FailureSource.of(error));
    }

    /**
     * Pre-order traversal: a node is recorded before its causes, and every cause records
     * the index of the node it was found in. Java exceptions can point back at an exception
     * already visited (through suppressed lists), those are skipped.
     */
    public static FailureInfo toFailureInfo(FailureSource source) {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        List<String> types = new ArrayList<>();
        List<String> messages = new ArrayList<>();
        List<String> stackTraces = new ArrayList<>();
        List<Integer> parents = new ArrayList<>();
        Set<Object> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        visit(source, -1, types, messages, stackTraces, parents, seen);
        int[] parentIndices = new int[parents.size()];
        for (int i = 0; i < parentIndices.length; i++) {
            parentIndices[i] = parents.get(i);
        }
        return new FailureInfo(types.toArray(new String[0]), messages.toArray(new String[0]),
                stackTraces.toArray(new String[0]), parentIndices);
    }

    private static void visit(FailureSource source, int parentIndex, List<String> types, List<String> messages,
                              List<String> stackTraces, List<Integer> parents, Set<Object> seen) {
        Object identity = source instanceof FailureSource.ThrowableSource ts ? ts.getError() : source;
        if (!seen.add(identity)) {
            return;
        }
        int myIndex = types.size();
        types.add(source.getTypeName());
        String message = source.getMessage();
        messages.add(message == null ? "" : message);
        stackTraces.add(source.getStackTrace());
        parents.add(parentIndex);
        for (FailureSource cause : source.getCauses()) {
            visit(cause, myIndex, types, messages, stackTraces, parents, seen);
        }
    }

    public static String formatStackTrace(Throwable error) {
        StackTraceElement[] frames = error.getStackTrace();
        if (frames == null || frames.length == 0) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        for (StackTraceElement frame : frames) {
            if (sb.length() > 0) {
                sb.append(NEW_LINE);
            }
            sb.append("   at ").append(frame);
        }
        return sb.toString();
    }

    public static String combineMessages(FailureInfo failure) {
        if (failure == null || failure.isEmpty()) {
            return "";
        }
        return getMessage(failure, 0, 0);
    }

    private static String getMessage(FailureInfo failure, int index, int level) {
        StringBuilder sb = new StringBuilder();
        if (level > 0) {
            sb.append("----".repeat(level)).append(' ');
        }
        String type = failure.getExceptionType(index);
        if (type != null && !type.isEmpty()) {
            sb.append(type).append(" : ");
        }
        sb.append(failure.getMessage(index));
        for (int child : failure.getChildIndices(index)) {
            sb.append(NEW_LINE).append(getMessage(failure, child, level + 1));
        }
        return sb.toString();
    }

    public static String combineStackTraces(FailureInfo failure) {
        if (failure == null || failure.isEmpty()) {
            return null;
        }
        return getStackTrace(failure, 0);
    }

    private static String getStackTrace(FailureInfo failure, int index) {
        StringBuilder sb = new StringBuilder();
        String trace = failure.getStackTrace(index);
        if (trace != null) {
            sb.append(trace);
        }
        List<Integer> children = failure.getChildIndices(index);
        for (int i = 0; i < children.size(); i++) {
            int child = children.get(i);
            if (sb.length() > 0) {
                sb.append(NEW_LINE);
            }
            if (children.size() == 1) {
                sb.append("----- Inner Stack Trace -----");
            } else {
                sb.append("----- Inner Stack Trace #").append(i + 1)
                        .append(" (").append(failure.getExceptionType(child)).append(") -----");
            }
            String inner = getStackTrace(failure, child);
            if (inner != null && !inner.isEmpty()) {
                sb.append(NEW_LINE).append(inner);
            }
        }
        return sb.toString();
    }

}
