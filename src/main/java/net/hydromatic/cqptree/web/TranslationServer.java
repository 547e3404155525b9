/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.cqptree.web;

import static java.util.Objects.requireNonNull;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import net.hydromatic.cqptree.ast.IdentifierGenerator;
import net.hydromatic.cqptree.compile.CompiledPlan;
import net.hydromatic.cqptree.compile.Compiler;
import net.hydromatic.cqptree.compile.Prop;
import net.hydromatic.cqptree.compile.Tracers;
import net.hydromatic.cqptree.query.Query;
import net.hydromatic.cqptree.query.Recipe;
import net.hydromatic.cqptree.translate.Translators;
import net.hydromatic.cqptree.util.CqpTreeException;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP server that translates queries.
 *
 * <p>Endpoints:
 *
 * <ul>
 * <li>{@code GET /translators} returns a JSON array of the names of the
 *   translators;
 * <li>{@code POST /translate} with body {@code {"text": ..., "translator":
 *   ...}} returns {@code {"query": ..., "additional_steps": [...]}}, or
 *   status 400 and {@code {"error": ...}} if the query cannot be translated.
 * </ul>
 */
public class TranslationServer {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(TranslationServer.class);

  /** Number of threads that translate; a translation that has timed out
   * keeps its thread until it notices that it has been interrupted. */
  private static final int THREAD_COUNT =
      Math.max(2, Runtime.getRuntime().availableProcessors());

  private final Translators translators;
  private final Compiler compiler;
  private final int port;
  private final int maxTokens;
  private final int timeoutMillis;
  private final Gson gson =
      new GsonBuilder().disableHtmlEscaping().create();
  private @Nullable HttpServer server;
  private @Nullable ExecutorService executor;

  public TranslationServer(Translators translators, Map<Prop, Object> props) {
    this.translators = requireNonNull(translators);
    this.compiler = new Compiler(props, Tracers.empty());
    this.port = Prop.PORT.intValue(props);
    this.maxTokens = Prop.MAX_TOKENS.intValue(props);
    this.timeoutMillis = Prop.TIMEOUT_MILLIS.intValue(props);
  }

  /** Command-line entry point. Accepts "--port=N", "--maxTokens=N",
   * "--timeoutMillis=N" and "--span=S". */
  public static void main(String[] args) throws IOException {
    final Map<Prop, Object> props = new LinkedHashMap<>();
    for (String arg : args) {
      if (!arg.startsWith("--") || !arg.contains("=")) {
        throw new IllegalArgumentException("invalid argument: " + arg);
      }
      final int i = arg.indexOf('=');
      Prop.lookup(arg.substring(2, i))
          .setLenient(props, arg.substring(i + 1));
    }
    final TranslationServer server =
        new TranslationServer(
            Translators.builtIn(new IdentifierGenerator()), props);
    server.start();
    Runtime.getRuntime().addShutdownHook(new Thread(server::stop));
  }

  /** Starts the server. */
  public synchronized TranslationServer start() throws IOException {
    final HttpServer server =
        HttpServer.create(new InetSocketAddress(port), 0);
    server.createContext("/translators", wrapHandler(this::handleTranslators));
    server.createContext("/translate", wrapHandler(this::handleTranslate));
    server.setExecutor(null);
    this.executor =
        Executors.newFixedThreadPool(THREAD_COUNT, r -> {
          final Thread thread = new Thread(r, "cqp-tree-translate");
          thread.setDaemon(true);
          return thread;
        });
    server.start();
    this.server = server;
    LOGGER.info("Translation server started on http://localhost:{}", port());
    return this;
  }

  /** Returns the port the server is listening on; useful if it was
   * started on port 0. */
  public int port() {
    final HttpServer server = this.server;
    return server == null ? port : server.getAddress().getPort();
  }

  /** Stops the server. */
  public synchronized void stop() {
    if (server != null) {
      server.stop(0);
      server = null;
      LOGGER.info("Translation server stopped");
    }
    if (executor != null) {
      executor.shutdownNow();
      executor = null;
    }
  }

  private HttpHandler wrapHandler(HttpHandler handler) {
    return exchange -> {
      try {
        handler.handle(exchange);
      } catch (IOException | RuntimeException e) {
        LOGGER.error("Unhandled exception", e);
        if (exchange.getResponseCode() == -1) {
          sendError(exchange, 500, String.valueOf(e.getMessage()));
        }
      } finally {
        exchange.close();
      }
    };
  }

  private void handleTranslators(HttpExchange exchange) throws IOException {
    if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
      sendError(exchange, 405, "Method not allowed");
      return;
    }
    final JsonArray names = new JsonArray();
    translators.names().forEach(names::add);
    sendJson(exchange, 200, names);
  }

  private void handleTranslate(HttpExchange exchange) throws IOException {
    if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
      sendError(exchange, 405, "Method not allowed");
      return;
    }
    final String body;
    try (InputStream in = exchange.getRequestBody()) {
      body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }

    final JsonObject request;
    try {
      final JsonElement element = JsonParser.parseString(body);
      if (!element.isJsonObject()) {
        sendError(exchange, 400, "Request body must be a JSON object");
        return;
      }
      request = element.getAsJsonObject();
    } catch (JsonParseException e) {
      sendError(exchange, 400, "Malformed JSON: " + e.getMessage());
      return;
    }
    final @Nullable String text = stringMember(request, "text");
    if (text == null) {
      sendError(exchange, 400, "Missing \"text\"");
      return;
    }
    final @Nullable String translator = stringMember(request, "translator");

    final ExecutorService executor = requireNonNull(this.executor);
    final Future<CompiledPlan> future =
        executor.submit(() -> translate(text, translator));
    final CompiledPlan plan;
    try {
      plan = future.get(timeoutMillis, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      LOGGER.warn("Translation timed out after {} ms", timeoutMillis);
      sendError(exchange, 408, "Translation timed out");
      return;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      sendError(exchange, 500, "Interrupted");
      return;
    } catch (ExecutionException e) {
      final Throwable cause = e.getCause();
      if (cause instanceof CqpTreeException) {
        final String message =
            ((CqpTreeException) cause).describeTo(new StringBuilder())
                .toString();
        LOGGER.debug("Rejected query: {}", message);
        sendError(exchange, 400, message);
        return;
      }
      if (cause instanceof IllegalArgumentException) {
        sendError(exchange, 400, cause.getMessage());
        return;
      }
      throw new RuntimeException(cause);
    }

    final JsonObject response = new JsonObject();
    response.addProperty("query", plan.query());
    final List<String> additionalSteps = plan.additionalSteps();
    if (!additionalSteps.isEmpty()) {
      final JsonArray array = new JsonArray();
      additionalSteps.forEach(array::add);
      response.add("additional_steps", array);
    }
    sendJson(exchange, 200, response);
  }

  /** Translates and compiles a query, rejecting it if it has too many
   * tokens. */
  CompiledPlan translate(String text, @Nullable String translator) {
    final Recipe recipe = translators.translate(text, translator);
    for (Query query : recipe.queries) {
      final int tokenCount = tokenCount(query);
      if (tokenCount > maxTokens) {
        throw new IllegalArgumentException("Query has " + tokenCount
            + " tokens, but at most " + maxTokens + " are allowed");
      }
    }
    return compiler.compile(recipe);
  }

  /** Returns the number of tokens in the largest query that compiling
   * {@code query} produces: the query merged with its largest part. */
  static int tokenCount(Query query) {
    int max = 0;
    for (Query.Part part : query.parts) {
      max = Math.max(max, part.tokens.size());
    }
    return query.tokens.size() + max;
  }

  private static @Nullable String stringMember(JsonObject object,
      String name) {
    final JsonElement element = object.get(name);
    if (element == null || element.isJsonNull()
        || !element.isJsonPrimitive()
        || !element.getAsJsonPrimitive().isString()) {
      return null;
    }
    return element.getAsString();
  }

  private void sendJson(HttpExchange exchange, int status, JsonElement data)
      throws IOException {
    final byte[] body = gson.toJson(data).getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders()
        .set("Content-Type", "application/json; charset=UTF-8");
    exchange.sendResponseHeaders(status, body.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(body);
    }
  }

  private void sendError(HttpExchange exchange, int status, String message)
      throws IOException {
    final JsonObject error = new JsonObject();
    error.addProperty("error", message);
    sendJson(exchange, status, error);
  }
}

// End TranslationServer.java
