package io.github.flowdiff.analyzer.bridge;

import io.github.flowdiff.analyzer.LanguageBridge;
import io.github.flowdiff.analyzer.ShellMetadata.HttpCall;
import io.github.flowdiff.analyzer.SymbolTable;
import io.github.flowdiff.analyzer.python.PythonAnalyzer;
import io.github.flowdiff.analyzer.shell.ShellAnalyzer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Links {@code curl} requests in shell scripts to the Python handlers routed at the same method and
 * path. Matching is exact on {@code "METHOD PATH"}; path parameters are not expanded.
 */
public final class HttpToPythonBridge implements LanguageBridge {
    private static final Logger logger = LogManager.getLogger(HttpToPythonBridge.class);

    @Override
    public boolean canBridge(String fromLanguage, String toLanguage) {
        return ShellAnalyzer.LANGUAGE.equals(fromLanguage) && PythonAnalyzer.LANGUAGE.equals(toLanguage);
    }

    @Override
    public Map<String, List<String>> resolve(Map<String, SymbolTable> tables) {
        var python = tables.get(PythonAnalyzer.LANGUAGE);
        var shell = tables.get(ShellAnalyzer.LANGUAGE);
        if (python == null || shell == null) {
            return Map.of();
        }

        var endpoints = endpointMap(python);
        if (endpoints.isEmpty()) {
            return Map.of();
        }
        logger.debug("Indexed {} HTTP endpoints", endpoints.size());

        var result = new LinkedHashMap<String, List<String>>();
        for (var script : shell.getAllSymbols()) {
            var handlers = new ArrayList<String>();
            for (var rawCall : script.getRawCalls()) {
                var call = HttpCall.fromRawCall(rawCall);
                if (call == null) {
                    continue;
                }
                var handler = endpoints.get(call.key());
                if (handler != null) {
                    handlers.add(handler);
                    logger.trace("{} {} -> {}", script.getQualifiedName(), rawCall, handler);
                }
            }
            if (!handlers.isEmpty()) {
                result.put(script.getQualifiedName(), handlers);
            }
        }
        return result;
    }

    /** {@code "METHOD PATH"} to handler qualified name. Later handlers for the same route win. */
    static Map<String, String> endpointMap(SymbolTable python) {
        var endpoints = new HashMap<String, String>();
        for (var symbol : python.getAllSymbols()) {
            var metadata = symbol.pythonMetadata();
            if (metadata != null && metadata.isHttpHandler()) {
                endpoints.put(metadata.httpKey(), symbol.getQualifiedName());
            }
        }
        return endpoints;
    }
}
