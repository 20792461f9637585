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

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Identity of a test assembly: its declared name, the path it was loaded from and the
 * target framework it was built for (null when none is declared).
 */
public record AssemblyInfo(String name, String assemblyPath, String targetFramework) {

    public AssemblyInfo {
        if (name == null) {
            throw new IllegalArgumentException("name must not be null");
        }
        if (assemblyPath == null) {
            throw new IllegalArgumentException("assemblyPath must not be null");
        }
    }

    public static AssemblyInfo of(String name, String assemblyPath) {
        return new AssemblyInfo(name, assemblyPath, null);
    }

    public String getFileName() {
        Path fileName = Path.of(assemblyPath).getFileName();
        return fileName == null ? assemblyPath : fileName.toString();
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("path", assemblyPath);
        if (targetFramework != null) {
            map.put("targetFramework", targetFramework);
        }
        return map;
    }

}
