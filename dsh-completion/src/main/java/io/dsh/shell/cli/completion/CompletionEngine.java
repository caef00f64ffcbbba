package io.dsh.shell.cli.completion;

import io.dsh.shell.cli.completion.cache.CompletionCache;
import io.dsh.shell.cli.completion.completers.HistoryCompleter;
import io.dsh.shell.cli.completion.completers.StaticCandidateGenerator;
import io.dsh.shell.cli.completion.dynamic.CancellationSignal;
import io.dsh.shell.cli.completion.dynamic.CommandQuery;
import io.dsh.shell.cli.completion.dynamic.DynamicHandlerRegistry;
import io.dsh.shell.cli.completion.dynamic.ProcessRunner;
import io.dsh.shell.cli.completion.dynamic.ScriptDefinition;
import io.dsh.shell.cli.completion.dynamic.ScriptDefinitionLoader;
import io.dsh.shell.cli.completion.dynamic.SystemProcessRunner;
import io.dsh.shell.cli.completion.generators.ShellEnvironment;
import io.dsh.shell.cli.completion.rank.CandidateDeduplicator;
import io.dsh.shell.cli.completion.rank.SmartRanker;
import io.dsh.shell.cli.completion.schema.CommandSchemaDatabase;
import io.dsh.shell.cli.completion.schema.SchemaLoader;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the completion engine.
 *
 * <p>A request runs: parse, static generation for the context, dynamic handlers, executables in
 * command position, file fallback for argument positions with no candidates, history, optional
 * fuzzy retry, de-duplication, ranking, truncation. Any source failing only reduces the result.
 * Starting a request cancels the external queries of the previous one.
 */
public final class CompletionEngine {
  private static final Logger log = LoggerFactory.getLogger(CompletionEngine.class);

  private final CompletionConfig config;
  private final CommandLineParser parser;
  private final CompletionSources sources;
  private final StaticCandidateGenerator staticGenerator = new StaticCandidateGenerator();
  private final DynamicHandlerRegistry dynamicHandlers;
  private final HistoryCompleter historyCompleter = new HistoryCompleter();
  private final CandidateDeduplicator deduplicator = new CandidateDeduplicator();
  private final SmartRanker ranker = new SmartRanker();
  private final ProcessRunner processRunner;
  private final CompletionCache<CommandQuery.Key, List<String>> commandCache =
      new CompletionCache<>(CompletionCache.COMMAND_TTL);
  private final AtomicReference<CancellationSignal> inFlight = new AtomicReference<>();

  public CompletionEngine(
      CommandSchemaDatabase database,
      CompletionConfig config,
      ShellEnvironment environment,
      ProcessRunner processRunner) {
    this(
        CompletionSources.create(database, environment),
        config,
        processRunner,
        new DynamicHandlerRegistry());
  }

  /**
   * Constructor with explicit sources and handlers, for tests and embedding.
   *
   * @param sources schema database and generators
   * @param config engine settings
   * @param processRunner runs external queries of dynamic handlers
   * @param dynamicHandlers dynamic handlers to consult
   */
  public CompletionEngine(
      CompletionSources sources,
      CompletionConfig config,
      ProcessRunner processRunner,
      DynamicHandlerRegistry dynamicHandlers) {
    this.sources = sources;
    this.config = config;
    this.processRunner = processRunner;
    this.dynamicHandlers = dynamicHandlers;
    this.parser = new CommandLineParser(sources.database());
  }

  /**
   * Engine over the shared schema database, the process environment, system settings and the
   * script completions found in the lookup directories.
   */
  public static CompletionEngine createDefault() {
    CompletionConfig config = CompletionConfig.load();
    log.debug("Creating completion engine with {}", config);
    List<ScriptDefinition> scripts =
        ScriptDefinitionLoader.withDefaultDirectories(config, Paths.get("").toAbsolutePath())
            .load();
    return new CompletionEngine(
        CompletionSources.create(SchemaLoader.sharedDatabase(), ShellEnvironment.system()),
        config,
        new SystemProcessRunner(),
        DynamicHandlerRegistry.withScripts(scripts));
  }

  public CompletionConfig config() {
    return config;
  }

  public CommandSchemaDatabase database() {
    return sources.database();
  }

  /** Parses {@code input} with this engine's schemas. */
  public ParsedCommandLine parse(String input, int cursor) {
    return parser.parse(input, cursor);
  }

  /** Completes with the configured result limit and no history. */
  public List<CompletionCandidate> complete(String input, int cursor, Path currentDir) {
    return complete(input, cursor, currentDir, config.maxResults(), CommandHistory.empty());
  }

  /**
   * Completes the token under the cursor.
   *
   * @param input the line being edited
   * @param cursor cursor position, {@code 0 <= cursor <= input.length()}
   * @param currentDir directory relative paths resolve against
   * @param maxResults result limit; zero or less means the configured limit
   * @param history past command lines, may be null
   * @return ranked candidates, empty when nothing matches
   * @throws IllegalArgumentException if the cursor is outside the input
   */
  public List<CompletionCandidate> complete(
      String input, int cursor, Path currentDir, int maxResults, CommandHistory history) {
    ParsedCommandLine parsed = parser.parse(input, cursor);
    CancellationSignal signal = new CancellationSignal();
    CancellationSignal previous = inFlight.getAndSet(signal);
    if (previous != null) {
      previous.cancel();
    }
    try {
      return complete(
          parsed,
          sources.withCurrentDirectory(currentDir),
          maxResults > 0 ? maxResults : config.maxResults(),
          history == null ? CommandHistory.empty() : history,
          signal);
    } finally {
      inFlight.compareAndSet(signal, null);
    }
  }

  private List<CompletionCandidate> complete(
      ParsedCommandLine parsed,
      CompletionSources request,
      int limit,
      CommandHistory history,
      CancellationSignal signal) {
    CompletionContext ctx = parsed.completionContext();
    String token = parsed.currentToken();
    log.debug("Completing '{}' as {} in {}", token, ctx, request.currentDirectory());

    List<CompletionCandidate> candidates =
        new ArrayList<>(staticGenerator.generate(parsed, request));

    if (dynamicHandlers.matches(parsed)) {
      CommandQuery query =
          new CommandQuery(
              processRunner,
              commandCache,
              request.currentDirectory(),
              config.commandTimeout(),
              signal);
      candidates.addAll(dynamicHandlers.generate(parsed, query));
    }

    if (parsed.isCommandPosition()) {
      if (token.indexOf('/') >= 0) {
        candidates.addAll(request.files().files(token, request.currentDirectory(), null));
      } else {
        candidates.addAll(request.executables().search(token));
      }
    }

    if (candidates.isEmpty() && acceptsFiles(ctx)) {
      candidates.addAll(request.files().files(token, request.currentDirectory(), null));
    }

    historyCompleter.complete(parsed, history, candidates);

    if (candidates.isEmpty() && config.fuzzyFallback() && !token.isEmpty() && isNamed(ctx)) {
      candidates.addAll(fuzzyRetry(parsed, request));
    }

    List<CompletionCandidate> ranked = ranker.rank(deduplicator.deduplicate(candidates), token);
    List<CompletionCandidate> result =
        ranked.size() > limit ? List.copyOf(ranked.subList(0, limit)) : List.copyOf(ranked);
    log.debug("{} candidates ({} before truncation)", result.size(), ranked.size());
    return result;
  }

  /** Re-runs static generation without the prefix filter and keeps fuzzy matches. */
  private List<CompletionCandidate> fuzzyRetry(
      ParsedCommandLine parsed, CompletionSources request) {
    String token = parsed.currentToken();
    List<CompletionCandidate> unfiltered =
        new ArrayList<>(staticGenerator.generate(parsed.withCurrentToken(""), request));
    if (parsed.isCommandPosition()) {
      unfiltered.addAll(request.executables().search(""));
    }
    List<CompletionCandidate> matches = ranker.fuzzyFilter(unfiltered, token);
    log.debug("Fuzzy retry for '{}' found {} candidates", token, matches.size());
    return matches;
  }

  /**
   * Returns the first path that starts with the last word of {@code input}, for callers that take
   * a single answer (e.g. inline suggestions).
   *
   * @param input text whose last word is a path prefix
   * @param currentDir directory relative paths resolve against
   * @return the completed path, if any
   */
  public Optional<String> completePathPrefix(String input, Path currentDir) {
    if (input == null
        || input.isEmpty()
        || Character.isWhitespace(input.charAt(input.length() - 1))) {
      return Optional.empty();
    }
    ParsedCommandLine parsed = parser.parse(input, input.length());
    return sources.files().bestMatch(parsed.currentToken(), currentDir);
  }

  private static boolean acceptsFiles(CompletionContext ctx) {
    return ctx instanceof CompletionContext.Argument
        || ctx instanceof CompletionContext.OptionValue
        || ctx instanceof CompletionContext.SubCommand;
  }

  private static boolean isNamed(CompletionContext ctx) {
    return ctx instanceof CompletionContext.Command
        || ctx instanceof CompletionContext.SubCommand
        || ctx.isOption();
  }
}
