/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.rms.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.rms.check.CheckOptions;
import ru.nts.tools.rms.check.CheckResult;
import ru.nts.tools.rms.check.RmsChecker;
import ru.nts.tools.rms.core.RmsLog;
import ru.nts.tools.rms.diagnostic.Diagnostic;
import ru.nts.tools.rms.diagnostic.Suggestion;
import ru.nts.tools.rms.symbols.Symbol;
import ru.nts.tools.rms.syntax.Script;
import ru.nts.tools.rms.syntax.StructureParser;
import ru.nts.tools.rms.syntax.Token;
import ru.nts.tools.rms.text.SourceText;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Сервер протокола редактора (JSON-RPC 2.0 поверх stdio).
 *
 * <p>Запросы читаются и обрабатываются в одном потоке. Проверки документов выполняются на
 * отдельном однопоточном исполнителе: новая правка документа отменяет проверку предыдущей
 * версии, и её результат не публикуется.
 */
public final class LanguageServer {

    private static final String SERVER_NAME = "rms-check";
    private static final String SERVER_VERSION = "1.0.0";

    private final MessageTransport transport;
    private final ObjectMapper mapper;
    private final LspJson json;
    private final RmsChecker checker;
    private final StructureParser parser = new StructureParser();
    private final CheckOptions options;
    private final DocumentStore documents = new DocumentStore();
    private final ExecutorService checks = Executors.newSingleThreadExecutor(task -> {
        Thread thread = new Thread(task, "rms-server-check");
        thread.setDaemon(true);
        return thread;
    });

    private volatile boolean shutdownRequested;

    public LanguageServer(InputStream in, OutputStream out, RmsChecker checker, CheckOptions options) {
        this.transport = new MessageTransport(in, out);
        this.mapper = new ObjectMapper();
        this.json = new LspJson(mapper);
        this.checker = checker;
        this.options = options;
    }

    /**
     * Обрабатывает сообщения до {@code exit} или конца входного потока.
     *
     * @return код завершения процесса: 0, если клиент корректно вызвал {@code shutdown}
     */
    public int run() {
        RmsLog.log("Language server starting...");
        try {
            String message;
            while ((message = transport.read()) != null) {
                if (!handle(message)) {
                    break;
                }
            }
        } catch (IOException e) {
            RmsLog.log("Language server transport failed", e);
        } finally {
            stopChecks();
        }
        RmsLog.log("Language server stopped");
        return shutdownRequested ? 0 : 1;
    }

    /**
     * @return {@code false}, если получен {@code exit}
     */
    boolean handle(String message) throws IOException {
        JsonNode request;
        try {
            request = mapper.readTree(message);
        } catch (IOException e) {
            RmsLog.log("Cannot parse message: " + message, e);
            ObjectNode response = responseFrame(null);
            response.set("error", error(-32700, "Parse error: " + e.getMessage()));
            send(response);
            return true;
        }
        String method = request.path("method").asText("");
        JsonNode id = request.get("id");
        JsonNode params = request.path("params");
        if (RmsLog.isDebug()) {
            RmsLog.log("<<< " + method);
        }

        ObjectNode response = responseFrame(id);
        try {
            switch (method) {
                case "initialize" -> response.set("result", initializeResult());
                case "initialized" -> {
                    return true;
                }
                case "shutdown" -> {
                    shutdownRequested = true;
                    response.putNull("result");
                }
                case "exit" -> {
                    return false;
                }
                case "textDocument/didOpen" -> {
                    JsonNode document = params.path("textDocument");
                    open(requireText(document, "uri"), requireText(document, "text"), document.path("version").asInt(0));
                    return true;
                }
                case "textDocument/didChange" -> {
                    String uri = requireText(params.path("textDocument"), "uri");
                    JsonNode changes = params.path("contentChanges");
                    if (!changes.isArray() || changes.isEmpty()) {
                        throw new IllegalArgumentException("contentChanges must contain the full document text");
                    }
                    String text = requireText(changes.get(changes.size() - 1), "text");
                    open(uri, text, params.path("textDocument").path("version").asInt(0));
                    return true;
                }
                case "textDocument/didClose" -> {
                    String uri = requireText(params.path("textDocument"), "uri");
                    documents.close(uri);
                    publish(uri, mapper.createArrayNode());
                    return true;
                }
                case "textDocument/foldingRange" -> response.set("result", foldingRanges(documentText(params)));
                case "textDocument/definition" -> response.set("result", definition(params));
                case "textDocument/codeAction" -> response.set("result", codeActions(params));
                default -> {
                    if (id == null) {
                        return true;
                    }
                    response.set("error", error(-32601, "Method not found: " + method));
                }
            }
        } catch (IllegalArgumentException e) {
            RmsLog.log("Invalid params for " + method + ": " + e.getMessage());
            response.set("error", error(-32602, "Invalid params: " + e.getMessage()));
        } catch (RuntimeException e) {
            RmsLog.log("Request " + method + " failed", e);
            response.set("error", error(-32603, "Internal error: " + e.getMessage()));
        }
        if (id != null) {
            send(response);
        }
        return true;
    }

    private ObjectNode initializeResult() {
        ObjectNode result = mapper.createObjectNode();
        ObjectNode capabilities = result.putObject("capabilities");
        capabilities.put("textDocumentSync", 1);
        capabilities.put("foldingRangeProvider", true);
        capabilities.put("definitionProvider", true);
        capabilities.put("codeActionProvider", true);
        ObjectNode serverInfo = result.putObject("serverInfo");
        serverInfo.put("name", SERVER_NAME);
        serverInfo.put("version", SERVER_VERSION);
        return result;
    }

    private void open(String uri, String text, int version) {
        DocumentStore.Document document = documents.update(uri, text, version);
        checks.submit(() -> checkAndPublish(document));
    }

    private void checkAndPublish(DocumentStore.Document document) {
        try {
            CheckResult result = checker.check(document.text(), options.withCancellation(document.check()));
            if (!documents.isCurrent(document)) {
                return;
            }
            ArrayNode diagnostics = mapper.createArrayNode();
            for (Diagnostic diagnostic : result.diagnostics()) {
                diagnostics.add(json.diagnostic(diagnostic));
            }
            publish(document.uri(), diagnostics);
        } catch (CancellationException e) {
            RmsLog.log("Check of " + document.uri() + " v" + document.version() + " cancelled");
        } catch (IOException e) {
            RmsLog.log("Cannot publish diagnostics for " + document.uri(), e);
        } catch (RuntimeException e) {
            RmsLog.log("Check of " + document.uri() + " failed", e);
        }
    }

    private void publish(String uri, ArrayNode diagnostics) throws IOException {
        ObjectNode notification = mapper.createObjectNode();
        notification.put("jsonrpc", "2.0");
        notification.put("method", "textDocument/publishDiagnostics");
        ObjectNode params = notification.putObject("params");
        params.put("uri", uri);
        params.set("diagnostics", diagnostics);
        send(notification);
    }

    private ArrayNode foldingRanges(String text) {
        ArrayNode result = mapper.createArrayNode();
        for (FoldingRanges.Range range : FoldingRanges.compute(parser.parse(new SourceText(text)))) {
            ObjectNode node = result.addObject();
            node.put("startLine", range.startLine() - 1);
            node.put("endLine", range.endLine() - 1);
            if (range.comment()) {
                node.put("kind", "comment");
            }
        }
        return result;
    }

    /**
     * Первое {@code #const}/{@code #define} для слова под курсором.
     */
    private JsonNode definition(JsonNode params) {
        String uri = requireText(params.path("textDocument"), "uri");
        String text = documentText(params);
        CheckResult result = checker.check(text, options.withParallel(false));
        int offset = LspJson.offset(result.source(), params.get("position"));
        Optional<Token> word = wordAt(result.script(), offset);
        Optional<Symbol> symbol = word.flatMap(token -> result.symbols().userSymbol(token.text()));
        if (symbol.isEmpty()) {
            return mapper.nullNode();
        }
        return json.location(uri, symbol.get().definition());
    }

    private static Optional<Token> wordAt(Script script, int offset) {
        for (Token token : script.tokens()) {
            if (token.isWordLike() && token.span().touches(offset)) {
                return Optional.of(token);
            }
        }
        return Optional.empty();
    }

    /**
     * По одному быстрому исправлению на безопасную подсказку, если диагностика пересекает запрошенный диапазон.
     */
    private ArrayNode codeActions(JsonNode params) {
        String uri = requireText(params.path("textDocument"), "uri");
        String text = documentText(params);
        CheckResult result = checker.check(text, options.withParallel(false));
        JsonNode range = params.get("range");
        if (range == null) {
            throw new IllegalArgumentException("range is required");
        }
        int from = LspJson.offset(result.source(), range.get("start"));
        int to = LspJson.offset(result.source(), range.get("end"));

        ArrayNode actions = mapper.createArrayNode();
        for (Diagnostic diagnostic : result.diagnostics()) {
            if (diagnostic.span().startOffset() > to || diagnostic.span().endOffset() < from) continue;
            for (Suggestion suggestion : diagnostic.suggestions()) {
                if (!suggestion.safe() || !suggestion.hasReplacement()) continue;
                ObjectNode action = actions.addObject();
                action.put("title", suggestion.message());
                action.put("kind", "quickfix");
                action.putArray("diagnostics").add(json.diagnostic(diagnostic));
                ObjectNode edit = mapper.createObjectNode();
                edit.put("newText", suggestion.replacement());
                edit.set("range", json.range(suggestion.span()));
                action.putObject("edit").putObject("changes").putArray(uri).add(edit);
            }
        }
        return actions;
    }

    private String documentText(JsonNode params) {
        String uri = requireText(params.path("textDocument"), "uri");
        return documents.get(uri)
                .map(DocumentStore.Document::text)
                .orElseThrow(() -> new IllegalArgumentException("Document is not open: " + uri));
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new IllegalArgumentException(field + " is required");
        }
        return value.asText();
    }

    private ObjectNode responseFrame(JsonNode id) {
        ObjectNode response = mapper.createObjectNode();
        response.put("jsonrpc", "2.0");
        if (id != null) {
            response.set("id", id);
        } else {
            response.putNull("id");
        }
        return response;
    }

    private ObjectNode error(int code, String message) {
        ObjectNode error = mapper.createObjectNode();
        error.put("code", code);
        error.put("message", message);
        return error;
    }

    private void send(ObjectNode message) throws IOException {
        String text = mapper.writeValueAsString(message);
        if (RmsLog.isDebug()) {
            RmsLog.log(">>> " + text);
        }
        transport.write(text);
    }

    private void stopChecks() {
        checks.shutdown();
        try {
            if (!checks.awaitTermination(10, TimeUnit.SECONDS)) {
                RmsLog.log("Pending checks did not finish in time");
                checks.shutdownNow();
            }
        } catch (InterruptedException e) {
            checks.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
