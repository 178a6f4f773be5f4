package io.github.flowdiff.analyzer.shell;

import io.github.flowdiff.analyzer.ShellMetadata;
import io.github.flowdiff.analyzer.ShellMetadata.HttpCall;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Line-oriented recognition of the commands a script issues: curl requests and Python invocations.
 * Backslash continuations are joined first, and comment lines are ignored.
 */
final class ShellCommandExtractor {
    private static final Pattern SHEBANG = Pattern.compile("^#!\\s*(\\S+)(?:\\s+(\\S+))?");
    private static final Pattern CURL = Pattern.compile("(?:^|[\\s;&|(`$])curl(?:\\s|$)");
    private static final Pattern VERB = Pattern.compile("(?:-X\\s*|--request[\\s=]+)['\"]?(GET|POST|PUT|DELETE|PATCH)\\b",
                                                        Pattern.CASE_INSENSITIVE);
    private static final Pattern URL = Pattern.compile("https?://[^/\\s\"'`;)]+(/[^\\s\"'?#`;)]*)?");
    private static final Pattern VAR_URL = Pattern.compile("\\$\\{?[A-Za-z_][A-Za-z0-9_]*}?(/[^\\s\"'?#`;)]*)");
    private static final Pattern PYTHON_MODULE = Pattern.compile("(?:^|[\\s;&|(`/])python[0-9.]*\\s+(?:-[A-Za-z]+\\s+)*-m\\s+([A-Za-z0-9_.]+)");
    private static final Pattern PYTHON_SCRIPT = Pattern.compile("(?:^|[\\s;&|(`/])python[0-9.]*\\s+(?:-[A-Za-z]+\\s+)*([A-Za-z0-9_/.-]+\\.py)\\b");

    record Result(String interpreter, List<HttpCall> httpCalls, List<String> pythonInvocations,
                  List<String> rawCalls, @Nullable String documentation) {
        ShellMetadata metadata() {
            return new ShellMetadata(interpreter, httpCalls, pythonInvocations);
        }
    }

    private ShellCommandExtractor() {
    }

    static Result extract(String content) {
        var lines = logicalLines(content);
        var httpCalls = new ArrayList<HttpCall>();
        var pythonInvocations = new ArrayList<String>();
        var rawCalls = new ArrayList<String>();

        for (var line : lines) {
            var trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            var http = httpCall(trimmed);
            if (http != null) {
                httpCalls.add(http);
                rawCalls.add(http.toRawCall());
            }
            var python = pythonInvocation(trimmed);
            if (python != null) {
                pythonInvocations.add(python);
                rawCalls.add(ShellMetadata.PYTHON_CALL_PREFIX + python);
            }
        }
        return new Result(interpreter(content), httpCalls, pythonInvocations, rawCalls, leadingComment(content));
    }

    static @Nullable HttpCall httpCall(String line) {
        if (!CURL.matcher(line).find()) {
            return null;
        }
        var verbMatcher = VERB.matcher(line);
        var method = verbMatcher.find() ? verbMatcher.group(1).toUpperCase(Locale.ROOT) : "GET";

        String path = null;
        var urlMatcher = URL.matcher(line);
        if (urlMatcher.find()) {
            path = urlMatcher.group(1) == null || urlMatcher.group(1).isEmpty() ? "/" : urlMatcher.group(1);
        } else {
            var varMatcher = VAR_URL.matcher(line);
            if (varMatcher.find()) {
                path = varMatcher.group(1);
            }
        }
        return path == null ? null : new HttpCall(method, path);
    }

    /** Module name for {@code -m} invocations, otherwise the script path as written. */
    static @Nullable String pythonInvocation(String line) {
        var module = PYTHON_MODULE.matcher(line);
        if (module.find()) {
            return module.group(1);
        }
        var script = PYTHON_SCRIPT.matcher(line);
        return script.find() ? script.group(1) : null;
    }

    /** Physical lines with trailing-backslash continuations folded into one. */
    static List<String> logicalLines(String content) {
        var result = new ArrayList<String>();
        var current = new StringBuilder();
        for (var line : content.split("\\R", -1)) {
            var stripped = line.stripTrailing();
            if (stripped.endsWith("\\")) {
                current.append(stripped, 0, stripped.length() - 1).append(' ');
                continue;
            }
            current.append(line);
            result.add(current.toString());
            current.setLength(0);
        }
        if (current.length() > 0) {
            result.add(current.toString());
        }
        return result;
    }

    /** {@code bash} for {@code #!/bin/bash} and {@code #!/usr/bin/env bash}; {@code sh} without a shebang. */
    static String interpreter(String content) {
        var firstLine = content.lines().findFirst().orElse("");
        var matcher = SHEBANG.matcher(firstLine);
        if (!matcher.find()) {
            return "sh";
        }
        var program = matcher.group(1);
        if (program.endsWith("/env") && matcher.group(2) != null) {
            program = matcher.group(2);
        }
        int slash = program.lastIndexOf('/');
        return slash >= 0 ? program.substring(slash + 1) : program;
    }

    /** The comment block at the top of the script, after the shebang. */
    static @Nullable String leadingComment(String content) {
        var comment = new ArrayList<String>();
        boolean first = true;
        for (var line : content.lines().toList()) {
            var trimmed = line.strip();
            if (first && trimmed.startsWith("#!")) {
                first = false;
                continue;
            }
            first = false;
            if (trimmed.startsWith("#")) {
                comment.add(trimmed.replaceFirst("^#+\\s?", ""));
            } else if (trimmed.isEmpty() && comment.isEmpty()) {
                continue;
            } else {
                break;
            }
        }
        var text = String.join("\n", comment).strip();
        return text.isEmpty() ? null : text;
    }
}
