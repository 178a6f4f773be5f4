package io.github.flowdiff.analyzer;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Facts about a shell script: the interpreter it declares and the commands recognised in it.
 */
public record ShellMetadata(String interpreter,
                            List<HttpCall> httpCalls,
                            List<String> pythonInvocations) implements SymbolMetadata {
    /** Raw calls naming a Python module or script, e.g. {@code PYTHON:tools.sync}. */
    public static final String PYTHON_CALL_PREFIX = "PYTHON:";

    public ShellMetadata {
        Objects.requireNonNull(interpreter, "interpreter must not be null");
        httpCalls = List.copyOf(httpCalls);
        pythonInvocations = List.copyOf(pythonInvocations);
    }

    /**
     * An HTTP request issued by the script.
     */
    public record HttpCall(String method, String path) {
        public static final String RAW_CALL_PREFIX = "HTTP:";

        public HttpCall {
            Objects.requireNonNull(method, "method must not be null");
            Objects.requireNonNull(path, "path must not be null");
        }

        /** Matches {@link PythonMetadata#httpKey()}. */
        public String key() {
            return method + " " + path;
        }

        public String toRawCall() {
            return RAW_CALL_PREFIX + method + ":" + path;
        }

        /**
         * Parses a raw call of the form {@code HTTP:POST:/analyze}; returns null for anything else.
         */
        public static @Nullable HttpCall fromRawCall(String rawCall) {
            if (!rawCall.startsWith(RAW_CALL_PREFIX)) {
                return null;
            }
            var rest = rawCall.substring(RAW_CALL_PREFIX.length());
            int colon = rest.indexOf(':');
            if (colon <= 0 || colon == rest.length() - 1) {
                return null;
            }
            return new HttpCall(rest.substring(0, colon), rest.substring(colon + 1));
        }
    }
}
