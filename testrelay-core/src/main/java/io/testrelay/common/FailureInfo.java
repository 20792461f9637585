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
import java.util.Arrays;
import java.util.List;

/**
 * A forest of exception causes flattened into four parallel arrays.
 * <p>
 * Entry {@code i} describes one exception: its type name (null when the type is unknown),
 * its message, its stack trace (may be null) and the index of the exception that it was
 * nested in, or {@code -1} for a root. A parent index always points at an earlier entry,
 * so the arrays are in pre-order and can be rebuilt into a tree with a single pass.
 */
public record FailureInfo(String[] exceptionTypes, String[] messages, String[] stackTraces, int[] parentIndices) {

    public FailureInfo {
        if (exceptionTypes == null) {
            throw new IllegalArgumentException("exceptionTypes must not be null");
        }
        if (messages == null) {
            throw new IllegalArgumentException("messages must not be null");
        }
        if (stackTraces == null) {
            throw new IllegalArgumentException("stackTraces must not be null");
        }
        if (parentIndices == null) {
            throw new IllegalArgumentException("parentIndices must not be null");
        }
        int count = exceptionTypes.length;
        if (messages.length != count || stackTraces.length != count || parentIndices.length != count) {
            throw new IllegalArgumentException("failure arrays must have equal lengths, got types: " + count
                    + ", messages: " + messages.length + ", stack traces: " + stackTraces.length
                    + ", parent indices: " + parentIndices.length);
        }
        for (int i = 0; i < count; i++) {
            int parent = parentIndices[i];
            if (parent < -1 || parent >= i) {
                throw new IllegalArgumentException("invalid parent index " + parent + " at position " + i);
            }
        }
        exceptionTypes = exceptionTypes.clone();
        messages = messages.clone();
        stackTraces = stackTraces.clone();
        parentIndices = parentIndices.clone();
    }

    public static FailureInfo of(Throwable error) {
        return ExceptionUtility.toFailureInfo(error);
    }

    public int size() {
        return exceptionTypes.length;
    }

    public boolean isEmpty() {
        return exceptionTypes.length == 0;
    }

    @Override
    public String[] exceptionTypes() {
        return exceptionTypes.clone();
    }

    @Override
    public String[] messages() {
        return messages.clone();
    }

    @Override
    public String[] stackTraces() {
        return stackTraces.clone();
    }

    @Override
    public int[] parentIndices() {
        return parentIndices.clone();
    }

    public String getExceptionType(int index) {
        return exceptionTypes[index];
    }

    public String getMessage(int index) {
        return messages[index];
    }

    public String getStackTrace(int index) {
        return stackTraces[index];
    }

    public int getParentIndex(int index) {
        return parentIndices[index];
    }

    /**
     * Indices of the entries whose parent is {@code index}, in order.
     */
    public List<Integer> getChildIndices(int index) {
        List<Integer> children = new ArrayList<>();
        for (int i = index + 1; i < parentIndices.length; i++) {
            if (parentIndices[i] == index) {
                children.add(i);
            }
        }
        return children;
    }

    /**
     * Rebuilds the cause forest. Each returned node is a root (parent index -1).
     */
    public List<FailureNode> toTree() {
        int count = size();
        FailureNode[] nodes = new FailureNode[count];
        List<FailureNode> roots = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            FailureNode node = new FailureNode(exceptionTypes[i], messages[i], stackTraces[i]);
            nodes[i] = node;
            int parent = parentIndices[i];
            if (parent == -1) {
                roots.add(node);
            } else {
                nodes[parent].addChild(node);
            }
        }
        return roots;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FailureInfo)) return false;
        FailureInfo that = (FailureInfo) o;
        return Arrays.equals(exceptionTypes, that.exceptionTypes)
                && Arrays.equals(messages, that.messages)
                && Arrays.equals(stackTraces, that.stackTraces)
                && Arrays.equals(parentIndices, that.parentIndices);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(exceptionTypes);
        result = 31 * result + Arrays.hashCode(messages);
        result = 31 * result + Arrays.hashCode(stackTraces);
        result = 31 * result + Arrays.hashCode(parentIndices);
        return result;
    }

    @Override
    public String toString() {
        return "FailureInfo" + Arrays.toString(exceptionTypes);
    }

}
