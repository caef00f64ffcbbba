package io.dsh.shell.cli.completion.dynamic;

import io.dsh.shell.cli.completion.CompletionCandidate;
import io.dsh.shell.cli.completion.CompletionSourceException;
import io.dsh.shell.cli.completion.ParsedCommandLine;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every dynamic handler that matches a line and concatenates their candidates. A failing
 * handler is logged and contributes nothing.
 */
public final class DynamicHandlerRegistry {
  private static final Logger log = LoggerFactory.getLogger(DynamicHandlerRegistry.class);

  private final List<DynamicHandler> handlers;

  public DynamicHandlerRegistry() {
    this(builtIns());
  }

  public DynamicHandlerRegistry(List<DynamicHandler> handlers) {
    this.handlers = List.copyOf(handlers);
  }

  /** Built-in handlers followed by one {@link ScriptHandler} per definition. */
  public static DynamicHandlerRegistry withScripts(List<ScriptDefinition> definitions) {
    List<DynamicHandler> handlers = new ArrayList<>(builtIns());
    for (ScriptDefinition definition : definitions) {
      handlers.add(new ScriptHandler(definition));
    }
    return new DynamicHandlerRegistry(handlers);
  }

  private static List<DynamicHandler> builtIns() {
    return List.of(new KillHandler(), new SudoHandler(), new GitHandler(), new PackageHandler());
  }

  public boolean matches(ParsedCommandLine parsed) {
    for (DynamicHandler handler : handlers) {
      if (handler.matches(parsed)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Collects candidates from all matching handlers.
   *
   * @param parsed the parsed line
   * @param query external queries of the current request
   * @return candidates in handler order
   */
  public List<CompletionCandidate> generate(ParsedCommandLine parsed, CommandQuery query) {
    List<CompletionCandidate> candidates = new ArrayList<>();
    for (DynamicHandler handler : handlers) {
      if (!handler.matches(parsed)) {
        continue;
      }
      String name = handler.getClass().getSimpleName();
      if (query.isCancelled()) {
        log.debug("Request superseded, skipping {}", name);
        break;
      }
      try {
        List<CompletionCandidate> generated = handler.generate(parsed, query);
        log.debug("{} generated {} candidates", name, generated.size());
        candidates.addAll(generated);
      } catch (CompletionSourceException e) {
        log.warn("{} failed: {}", name, e.getMessage());
      } catch (RuntimeException e) {
        log.warn("{} failed unexpectedly", name, e);
      }
    }
    return candidates;
  }
}
