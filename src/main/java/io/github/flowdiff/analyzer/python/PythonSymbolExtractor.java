package io.github.flowdiff.analyzer.python;

import com.google.common.base.Splitter;
import io.github.flowdiff.analyzer.ProjectFile;
import io.github.flowdiff.analyzer.PythonMetadata;
import io.github.flowdiff.analyzer.Symbol;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import static io.github.flowdiff.analyzer.python.PythonTreeSitterNodeTypes.*;

/**
 * Walks the syntax tree of one Python file and fills a {@link PythonSymbolTable} with its
 * functions, methods, classes and imports. One instance handles exactly one file.
 */
final class PythonSymbolExtractor {
    private static final Splitter DOT_SPLITTER = Splitter.on('.');

    private static final Set<String> HTTP_VERB_DECORATORS = Set.of("get", "post", "put", "delete", "patch");
    private static final Set<String> CLI_DECORATORS = Set.of("command", "group", "option", "argument");
    private static final List<String> CLI_CALL_PATTERNS = List.of("ArgumentParser", "parse_args", "add_argument");
    private static final List<String> SERVER_STARTUP_CALLS = List.of("uvicorn.run", "app.run", "flask.run",
                                                                     "waitress.serve", "web.run_app", "socketio.run");
    private static final List<String> NON_PRODUCTION_PATH_MARKERS = List.of(
            "/tests/", "/test/", "test_", "/debug/", "/archive/", "/archived/", "/testing/", "/examples/",
            "example_", "/tools/", "/management/", "/scripts/", "/admin/", "conftest.py", "/old/", "/backup/");
    private static final Pattern MAIN_GUARD = Pattern.compile("__name__==\"__main__\"|\"__main__\"==__name__");

    private final ProjectFile file;
    private final String module;
    private final boolean packageInit;
    private final byte[] src;
    private final PythonSymbolTable table;

    private final List<FunctionDraft> functions = new ArrayList<>();
    private final Set<String> mainGuardCalls = new LinkedHashSet<>();
    private boolean hasMainGuard;

    private record HttpRoute(String method, String path) {
    }

    /** Everything known about a function before main-guard information is complete. */
    private record FunctionDraft(String name, String qualifiedName, int line, PythonMetadata metadata,
                                 List<String> rawCalls, @Nullable String documentation) {
    }

    PythonSymbolExtractor(ProjectFile file, String module, String source, PythonSymbolTable table) {
        this.file = file;
        this.module = module;
        this.packageInit = file.getFileName().equals("__init__.py");
        this.src = source.getBytes(StandardCharsets.UTF_8);
        this.table = table;
    }

    void extract(TSNode root) {
        walkModuleScope(root);

        var fileCalls = new ArrayList<String>();
        collectCalls(root, fileCalls);
        if (hasMainGuard && startsServer(fileCalls) && isProductionPath()) {
            var stem = file.getFileName().replaceFirst("\\.py$", "");
            var script = new Symbol("<script:" + stem + ">", module + "." + stem, PythonAnalyzer.LANGUAGE,
                                    file, 1, PythonMetadata.forScript(module), List.of(), null);
            script.setEntryPoint(true);
            table.addSymbol(script);
        }

        for (var draft : functions) {
            var metadata = draft.metadata();
            if (metadata.className() == null && mainGuardCalls.contains(draft.name())) {
                metadata = metadata.withCalledInMainGuard(true);
            }
            table.addSymbol(new Symbol(draft.name(), draft.qualifiedName(), PythonAnalyzer.LANGUAGE, file,
                                       draft.line(), metadata, draft.rawCalls(), draft.documentation()));
        }
    }

    /* ---------- module scope ---------- */

    private void walkModuleScope(TSNode scope) {
        for (int i = 0; i < scope.getNamedChildCount(); i++) {
            var child = scope.getNamedChild(i);
            switch (child.getType()) {
                case IMPORT_STATEMENT, IMPORT_FROM_STATEMENT -> {
                    var imports = new LinkedHashMap<String, String>();
                    collectImports(child, imports);
                    imports.forEach((alias, target) -> table.addImport(module, alias, target));
                }
                case FUNCTION_DEFINITION -> extractFunction(child, null, List.of());
                case CLASS_DEFINITION -> extractClass(child);
                case DECORATED_DEFINITION -> {
                    var definition = child.getChildByFieldName(FIELD_DEFINITION);
                    if (isPresent(definition) && FUNCTION_DEFINITION.equals(definition.getType())) {
                        extractFunction(definition, null, decoratorsOf(child));
                    } else if (isPresent(definition) && CLASS_DEFINITION.equals(definition.getType())) {
                        extractClass(definition);
                    }
                }
                case IF_STATEMENT -> {
                    if (isMainGuard(child)) {
                        hasMainGuard = true;
                        var calls = new ArrayList<String>();
                        collectCalls(child.getChildByFieldName(FIELD_CONSEQUENCE), calls);
                        calls.stream().filter(c -> !c.contains(".")).forEach(mainGuardCalls::add);
                    } else {
                        walkModuleScope(child);
                    }
                }
                case BLOCK, ELIF_CLAUSE, ELSE_CLAUSE, TRY_STATEMENT, EXCEPT_CLAUSE, FINALLY_CLAUSE, WITH_STATEMENT ->
                        walkModuleScope(child);
                default -> {
                    // expressions and other statements define nothing
                }
            }
        }
    }

    private boolean isMainGuard(TSNode ifStatement) {
        var condition = ifStatement.getChildByFieldName(FIELD_CONDITION);
        if (!isPresent(condition)) {
            return false;
        }
        var normalized = text(condition).replaceAll("\\s+", "").replace('\'', '"');
        return MAIN_GUARD.matcher(normalized).matches();
    }

    private boolean startsServer(List<String> calls) {
        return calls.stream().anyMatch(call -> call.contains("gunicorn")
                || SERVER_STARTUP_CALLS.stream().anyMatch(p -> call.equals(p) || call.endsWith("." + p)));
    }

    private boolean isProductionPath() {
        var path = "/" + file.getRelPathString();
        return NON_PRODUCTION_PATH_MARKERS.stream().noneMatch(path::contains);
    }

    /* ---------- classes ---------- */

    private void extractClass(TSNode classNode) {
        var className = text(classNode.getChildByFieldName(FIELD_NAME));
        var qualifiedName = module + "." + className;

        var bases = new ArrayList<String>();
        var superclasses = classNode.getChildByFieldName(FIELD_SUPERCLASSES);
        if (isPresent(superclasses)) {
            for (int i = 0; i < superclasses.getNamedChildCount(); i++) {
                var base = dottedName(superclasses.getNamedChild(i));
                if (base != null) {
                    bases.add(base);
                }
            }
        }

        var methods = new LinkedHashMap<String, String>();
        var instanceAttributes = new LinkedHashMap<String, String>();
        var body = classNode.getChildByFieldName(FIELD_BODY);
        if (isPresent(body)) {
            for (int i = 0; i < body.getNamedChildCount(); i++) {
                var member = body.getNamedChild(i);
                TSNode function = null;
                List<String> decorators = List.of();
                if (FUNCTION_DEFINITION.equals(member.getType())) {
                    function = member;
                } else if (DECORATED_DEFINITION.equals(member.getType())) {
                    var definition = member.getChildByFieldName(FIELD_DEFINITION);
                    if (isPresent(definition) && FUNCTION_DEFINITION.equals(definition.getType())) {
                        function = definition;
                        decorators = decoratorsOf(member);
                    }
                }
                if (function == null) {
                    continue;
                }
                var draft = extractFunction(function, className, decorators);
                methods.put(draft.name(), draft.qualifiedName());
                if ("__init__".equals(draft.name())) {
                    collectInstanceAttributes(function.getChildByFieldName(FIELD_BODY), instanceAttributes);
                }
            }
        }

        table.addClass(new PythonSymbolTable.ClassInfo(className, qualifiedName, module, bases, methods, instanceAttributes));
    }

    /** {@code self.x: Type = ...} or {@code self.x = Ctor(...)} inside __init__; the annotation wins. */
    private void collectInstanceAttributes(TSNode body, Map<String, String> into) {
        for (var node : descendants(body, true)) {
            if (!ASSIGNMENT.equals(node.getType())) {
                continue;
            }
            var left = node.getChildByFieldName(FIELD_LEFT);
            if (!isPresent(left) || !ATTRIBUTE.equals(left.getType())) {
                continue;
            }
            var object = left.getChildByFieldName(FIELD_OBJECT);
            if (isPresent(object) && "self".equals(text(object))) {
                var attr = text(left.getChildByFieldName(FIELD_ATTRIBUTE));
                var annotation = node.getChildByFieldName(FIELD_TYPE);
                var type = isPresent(annotation)
                           ? text(annotation).strip()
                           : constructorName(node.getChildByFieldName(FIELD_RIGHT));
                if (type != null && !attr.isEmpty()) {
                    into.put(attr, type);
                }
            }
        }
    }

    /* ---------- functions ---------- */

    private FunctionDraft extractFunction(TSNode function, @Nullable String className, List<String> decorators) {
        var name = text(function.getChildByFieldName(FIELD_NAME));
        var qualifiedName = className == null ? module + "." + name : module + "." + className + "." + name;
        var body = function.getChildByFieldName(FIELD_BODY);
        var returnTypeNode = function.getChildByFieldName(FIELD_RETURN_TYPE);
        boolean async = function.getChildCount() > 0 && ASYNC.equals(function.getChild(0).getType());

        var rawCalls = new ArrayList<String>();
        collectCalls(body, rawCalls);

        var localBindings = new LinkedHashMap<String, String>();
        collectLocalBindings(body, localBindings);

        var localImports = new LinkedHashMap<String, String>();
        collectFunctionLocalImports(body, localImports);

        String httpMethod = null;
        String httpRoute = null;
        for (var decorator : decoratorNodes(function)) {
            var route = httpRoute(decorator);
            if (route != null) {
                httpMethod = route.method();
                httpRoute = route.path();
                break;
            }
        }

        var metadata = new PythonMetadata(module,
                                          className,
                                          parameters(function.getChildByFieldName(FIELD_PARAMETERS), className != null),
                                          isPresent(returnTypeNode) ? text(returnTypeNode).strip() : null,
                                          className != null,
                                          async,
                                          decorators,
                                          localBindings,
                                          localImports,
                                          httpMethod,
                                          httpRoute,
                                          usesCliParsing(body, rawCalls, function),
                                          false,
                                          false);
        var draft = new FunctionDraft(name, qualifiedName, function.getStartPoint().getRow() + 1, metadata,
                                      rawCalls, docstring(body));
        functions.add(draft);
        return draft;
    }

    private List<String> parameters(TSNode parameters, boolean isMethod) {
        var names = new ArrayList<String>();
        if (!isPresent(parameters)) {
            return names;
        }
        for (int i = 0; i < parameters.getNamedChildCount(); i++) {
            var param = parameters.getNamedChild(i);
            String name = switch (param.getType()) {
                case IDENTIFIER -> text(param);
                case TYPED_PARAMETER -> param.getNamedChildCount() > 0 ? text(param.getNamedChild(0)) : null;
                case DEFAULT_PARAMETER, TYPED_DEFAULT_PARAMETER -> text(param.getChildByFieldName(FIELD_NAME));
                case LIST_SPLAT_PATTERN, DICTIONARY_SPLAT_PATTERN -> text(param);
                default -> null;
            };
            if (name != null) {
                name = name.replace("*", "").strip();
                if (!name.isEmpty()) {
                    names.add(name);
                }
            }
        }
        if (isMethod && !names.isEmpty() && (names.get(0).equals("self") || names.get(0).equals("cls"))) {
            names.remove(0);
        }
        return names;
    }

    private @Nullable String docstring(TSNode body) {
        if (!isPresent(body) || body.getNamedChildCount() == 0) {
            return null;
        }
        var first = body.getNamedChild(0);
        if (!EXPRESSION_STATEMENT.equals(first.getType()) || first.getNamedChildCount() == 0) {
            return null;
        }
        var expr = first.getNamedChild(0);
        if (!STRING.equals(expr.getType())) {
            return null;
        }
        var cleaned = cleanDocstring(stringValue(expr));
        return cleaned.isEmpty() ? null : cleaned;
    }

    /** Strips the first line and removes the common indentation of the rest. */
    static String cleanDocstring(String raw) {
        var lines = raw.split("\n", -1);
        int indent = Integer.MAX_VALUE;
        for (int i = 1; i < lines.length; i++) {
            var line = lines[i];
            if (!line.isBlank()) {
                indent = Math.min(indent, line.length() - line.stripLeading().length());
            }
        }
        var result = new ArrayList<String>();
        result.add(lines[0].strip());
        for (int i = 1; i < lines.length; i++) {
            var line = lines[i];
            result.add(line.isBlank() ? "" : line.substring(Math.min(indent, line.length())).stripTrailing());
        }
        return String.join("\n", result).strip();
    }

    /* ---------- calls and bindings ---------- */

    /**
     * {@code start} and its named descendants in source order. With {@code skipNestedScopes}, nested
     * functions, classes and lambdas below {@code start} are left out together with their contents.
     * Uses an explicit stack rather than recursion.
     */
    private static List<TSNode> descendants(@Nullable TSNode start, boolean skipNestedScopes) {
        var result = new ArrayList<TSNode>();
        if (!isPresent(start)) {
            return result;
        }
        var pending = new ArrayDeque<TSNode>();
        pending.push(start);
        while (!pending.isEmpty()) {
            var node = pending.pop();
            result.add(node);
            for (int i = node.getNamedChildCount() - 1; i >= 0; i--) {
                var child = node.getNamedChild(i);
                if (!skipNestedScopes || !isNestedScope(child)) {
                    pending.push(child);
                }
            }
        }
        return result;
    }

    private void collectCalls(@Nullable TSNode node, List<String> into) {
        for (var candidate : descendants(node, false)) {
            if (CALL.equals(candidate.getType())) {
                var callee = dottedName(candidate.getChildByFieldName(FIELD_FUNCTION));
                if (callee != null) {
                    into.add(callee);
                }
            }
        }
    }

    /**
     * {@code a}, {@code a.b.c}; an attribute chain on something that is not a name keeps only the
     * attributes.
     */
    private @Nullable String dottedName(@Nullable TSNode node) {
        var parts = new ArrayDeque<String>();
        var current = node;
        while (isPresent(current) && ATTRIBUTE.equals(current.getType())) {
            parts.addFirst(text(current.getChildByFieldName(FIELD_ATTRIBUTE)));
            current = current.getChildByFieldName(FIELD_OBJECT);
        }
        if (isPresent(current) && IDENTIFIER.equals(current.getType())) {
            parts.addFirst(text(current));
        }
        return parts.isEmpty() ? null : String.join(".", parts);
    }

    private @Nullable String constructorName(TSNode node) {
        if (!isPresent(node) || !CALL.equals(node.getType())) {
            return null;
        }
        return dottedName(node.getChildByFieldName(FIELD_FUNCTION));
    }

    private void collectLocalBindings(@Nullable TSNode body, Map<String, String> into) {
        for (var node : descendants(body, false)) {
            if (ASSIGNMENT.equals(node.getType())) {
                var left = node.getChildByFieldName(FIELD_LEFT);
                var ctor = constructorName(node.getChildByFieldName(FIELD_RIGHT));
                if (isPresent(left) && IDENTIFIER.equals(left.getType()) && ctor != null) {
                    into.put(text(left), ctor);
                }
            }
        }
    }

    private void collectFunctionLocalImports(@Nullable TSNode body, Map<String, String> into) {
        for (var node : descendants(body, true)) {
            var type = node.getType();
            if (IMPORT_STATEMENT.equals(type) || IMPORT_FROM_STATEMENT.equals(type)) {
                collectImports(node, into);
            }
        }
    }

    private static boolean isNestedScope(TSNode node) {
        var type = node.getType();
        return FUNCTION_DEFINITION.equals(type) || CLASS_DEFINITION.equals(type)
                || DECORATED_DEFINITION.equals(type) || LAMBDA.equals(type);
    }

    private boolean usesCliParsing(TSNode body, List<String> calls, TSNode function) {
        if (calls.stream().anyMatch(call -> CLI_CALL_PATTERNS.stream().anyMatch(call::contains))) {
            return true;
        }
        if (referencesSysArgv(body)) {
            return true;
        }
        for (var decorator : decoratorNodes(function)) {
            var expr = decorator.getNamedChildCount() > 0 ? decorator.getNamedChild(0) : null;
            if (expr != null && CALL.equals(expr.getType())) {
                expr = expr.getChildByFieldName(FIELD_FUNCTION);
            }
            var name = dottedName(expr);
            if (name != null) {
                var segments = DOT_SPLITTER.splitToList(name);
                if (CLI_DECORATORS.contains(segments.get(segments.size() - 1))) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean referencesSysArgv(@Nullable TSNode body) {
        return descendants(body, false).stream()
                .anyMatch(node -> ATTRIBUTE.equals(node.getType()) && "sys.argv".equals(dottedName(node)));
    }

    /* ---------- decorators ---------- */

    /** Decorator nodes of a function, found on its enclosing decorated_definition. */
    private static List<TSNode> decoratorNodes(TSNode function) {
        var parent = function.getParent();
        if (!isPresent(parent) || !DECORATED_DEFINITION.equals(parent.getType())) {
            return List.of();
        }
        var result = new ArrayList<TSNode>();
        for (int i = 0; i < parent.getNamedChildCount(); i++) {
            var child = parent.getNamedChild(i);
            if (DECORATOR.equals(child.getType())) {
                result.add(child);
            }
        }
        return result;
    }

    private List<String> decoratorsOf(TSNode decoratedDefinition) {
        var result = new ArrayList<String>();
        for (int i = 0; i < decoratedDefinition.getNamedChildCount(); i++) {
            var child = decoratedDefinition.getNamedChild(i);
            if (DECORATOR.equals(child.getType())) {
                result.add(text(child).replaceFirst("^@", "").strip());
            }
        }
        return result;
    }

    /**
     * Method and path for FastAPI-style {@code @x.post("/p")} and Flask-style
     * {@code @x.route("/p", methods=[...])} decorators, otherwise null.
     */
    private @Nullable HttpRoute httpRoute(TSNode decorator) {
        if (decorator.getNamedChildCount() == 0) {
            return null;
        }
        var expr = decorator.getNamedChild(0);
        if (!CALL.equals(expr.getType())) {
            return null;
        }
        var function = expr.getChildByFieldName(FIELD_FUNCTION);
        var arguments = expr.getChildByFieldName(FIELD_ARGUMENTS);
        if (!isPresent(function) || !ATTRIBUTE.equals(function.getType()) || !isPresent(arguments)) {
            return null;
        }
        var verb = text(function.getChildByFieldName(FIELD_ATTRIBUTE));
        if (HTTP_VERB_DECORATORS.contains(verb)) {
            var path = routePath(arguments);
            return path == null ? null : new HttpRoute(verb.toUpperCase(Locale.ROOT), path);
        }
        if ("route".equals(verb)) {
            var path = routePath(arguments);
            if (path == null) {
                return null;
            }
            var method = "GET";
            var methods = keywordArgument(arguments, "methods");
            if (methods != null && LIST.equals(methods.getType()) && methods.getNamedChildCount() > 0
                    && STRING.equals(methods.getNamedChild(0).getType())) {
                method = stringValue(methods.getNamedChild(0)).toUpperCase(Locale.ROOT);
            }
            return new HttpRoute(method, path);
        }
        return null;
    }

    private @Nullable String routePath(TSNode arguments) {
        if (arguments.getNamedChildCount() > 0) {
            var first = arguments.getNamedChild(0);
            if (STRING.equals(first.getType())) {
                return stringValue(first);
            }
        }
        var path = keywordArgument(arguments, "path");
        return path != null && STRING.equals(path.getType()) ? stringValue(path) : null;
    }

    private @Nullable TSNode keywordArgument(TSNode arguments, String keyword) {
        for (int i = 0; i < arguments.getNamedChildCount(); i++) {
            var arg = arguments.getNamedChild(i);
            if (KEYWORD_ARGUMENT.equals(arg.getType()) && keyword.equals(text(arg.getChildByFieldName(FIELD_NAME)))) {
                var value = arg.getChildByFieldName(FIELD_VALUE);
                return isPresent(value) ? value : null;
            }
        }
        return null;
    }

    /* ---------- imports ---------- */

    /**
     * Adds alias to target entries for an import or from-import statement. {@code import a.b}
     * binds both {@code a.b} and {@code a}; wildcard imports are ignored.
     */
    private void collectImports(TSNode statement, Map<String, String> into) {
        if (IMPORT_STATEMENT.equals(statement.getType())) {
            for (int i = 0; i < statement.getNamedChildCount(); i++) {
                var name = statement.getNamedChild(i);
                if (DOTTED_NAME.equals(name.getType())) {
                    var full = text(name);
                    into.put(full, full);
                    var first = DOT_SPLITTER.splitToList(full).get(0);
                    into.putIfAbsent(first, first);
                } else if (ALIASED_IMPORT.equals(name.getType())) {
                    into.put(text(name.getChildByFieldName(FIELD_ALIAS)), text(name.getChildByFieldName(FIELD_NAME)));
                }
            }
            return;
        }

        var moduleNode = statement.getChildByFieldName(FIELD_MODULE_NAME);
        if (!isPresent(moduleNode)) {
            return;
        }
        var base = RELATIVE_IMPORT.equals(moduleNode.getType()) ? resolveRelative(text(moduleNode)) : text(moduleNode);
        for (int i = 0; i < statement.getNamedChildCount(); i++) {
            var name = statement.getNamedChild(i);
            if (name.getStartByte() == moduleNode.getStartByte()) {
                continue;
            }
            if (DOTTED_NAME.equals(name.getType())) {
                var imported = text(name);
                into.put(imported, join(base, imported));
            } else if (ALIASED_IMPORT.equals(name.getType())) {
                into.put(text(name.getChildByFieldName(FIELD_ALIAS)), join(base, text(name.getChildByFieldName(FIELD_NAME))));
            }
        }
    }

    /** {@code .x} relative to this file's package; each extra dot climbs one level. */
    String resolveRelative(String relative) {
        int dots = 0;
        while (dots < relative.length() && relative.charAt(dots) == '.') {
            dots++;
        }
        var rest = relative.substring(dots);
        var parts = new ArrayList<>(Arrays.asList(module.split("\\.")));
        if (!packageInit && !parts.isEmpty()) {
            parts.remove(parts.size() - 1);
        }
        for (int i = 1; i < dots && !parts.isEmpty(); i++) {
            parts.remove(parts.size() - 1);
        }
        return join(String.join(".", parts), rest);
    }

    private static String join(String base, String name) {
        if (base.isEmpty()) {
            return name;
        }
        return name.isEmpty() ? base : base + "." + name;
    }

    /* ---------- text helpers ---------- */

    private static boolean isPresent(@Nullable TSNode node) {
        return node != null && !node.isNull();
    }

    private String text(@Nullable TSNode node) {
        if (!isPresent(node)) {
            return "";
        }
        int start = Math.max(0, node.getStartByte());
        int end = Math.min(src.length, node.getEndByte());
        return end <= start ? "" : new String(src, start, end - start, StandardCharsets.UTF_8);
    }

    /** Contents of a string literal without prefix letters or quotes. */
    private String stringValue(TSNode stringNode) {
        return unquote(text(stringNode));
    }

    static String unquote(String literal) {
        int i = 0;
        while (i < literal.length() && Character.isLetter(literal.charAt(i))) {
            i++;
        }
        var body = literal.substring(i);
        for (var quote : List.of("\"\"\"", "'''", "\"", "'")) {
            if (body.length() >= 2 * quote.length() && body.startsWith(quote) && body.endsWith(quote)) {
                return body.substring(quote.length(), body.length() - quote.length());
            }
        }
        return body;
    }
}
