package io.github.flowdiff.analyzer;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Facts about a Python function or method.
 *
 * @param module               dotted module the symbol is defined in
 * @param className            enclosing class, or null for module-level functions
 * @param parameters           parameter names in declaration order, without self/cls
 * @param returnType           annotated return type text, if any
 * @param classMethod          true when defined inside a class body
 * @param async                true for {@code async def}
 * @param decorators           decorator expressions as written, without the leading {@code @}
 * @param localBindings        variable name to constructor name, from {@code var = Ctor(...)}
 * @param functionLocalImports local alias to imported dotted target, for imports inside the body
 * @param httpMethod           upper-case HTTP verb when the function is a route handler
 * @param httpRoute            route path when the function is a route handler
 * @param usesCliParsing       argparse, sys.argv or click/typer usage
 * @param calledInMainGuard    called directly from the module's {@code __main__} guard
 * @param scriptEntry          synthetic symbol standing for a whole server script
 */
public record PythonMetadata(String module,
                             @Nullable String className,
                             List<String> parameters,
                             @Nullable String returnType,
                             boolean classMethod,
                             boolean async,
                             List<String> decorators,
                             Map<String, String> localBindings,
                             Map<String, String> functionLocalImports,
                             @Nullable String httpMethod,
                             @Nullable String httpRoute,
                             boolean usesCliParsing,
                             boolean calledInMainGuard,
                             boolean scriptEntry) implements SymbolMetadata {

    public PythonMetadata {
        Objects.requireNonNull(module, "module must not be null");
        parameters = List.copyOf(parameters);
        decorators = List.copyOf(decorators);
        localBindings = Collections.unmodifiableMap(new LinkedHashMap<>(localBindings));
        functionLocalImports = Collections.unmodifiableMap(new LinkedHashMap<>(functionLocalImports));
    }

    /**
     * Metadata for the synthetic symbol that anchors a server script with no entry function.
     */
    public static PythonMetadata forScript(String module) {
        return new PythonMetadata(module, null, List.of(), null, false, false, List.of(),
                                  Map.of(), Map.of(), null, null, false, false, true);
    }

    public boolean isHttpHandler() {
        return httpMethod != null && httpRoute != null;
    }

    /**
     * Key used to match HTTP calls from other languages, e.g. {@code "POST /analyze"}.
     */
    public @Nullable String httpKey() {
        return isHttpHandler() ? httpMethod + " " + httpRoute : null;
    }

    public PythonMetadata withCalledInMainGuard(boolean called) {
        return new PythonMetadata(module, className, parameters, returnType, classMethod, async, decorators,
                                  localBindings, functionLocalImports, httpMethod, httpRoute, usesCliParsing,
                                  called, scriptEntry);
    }
}
