package io.dsh.shell.cli.completion.generators;

import io.dsh.shell.cli.completion.CandidateType;
import io.dsh.shell.cli.completion.CompletionCandidate;
import io.dsh.shell.cli.completion.CompletionSourceException;
import io.dsh.shell.cli.completion.cache.CompletionCache;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Network interfaces from {@code /sys/class/net}, described as {@code type (state)} and ordered
 * physical, wireless, other, virtual, loopback.
 */
public final class InterfaceGenerator {
  private static final Logger log = LoggerFactory.getLogger(InterfaceGenerator.class);

  static final Path SYS_CLASS_NET = Path.of("/sys/class/net");
  private static final String ALL = "";

  private final Path netDirectory;
  private final CompletionCache<String, List<CompletionCandidate>> cache;

  public InterfaceGenerator() {
    this(SYS_CLASS_NET, new CompletionCache<>(CompletionCache.INTERFACE_TTL));
  }

  public InterfaceGenerator(
      Path netDirectory, CompletionCache<String, List<CompletionCandidate>> cache) {
    this.netDirectory = netDirectory;
    this.cache = cache;
  }

  public List<CompletionCandidate> generate(String prefix) throws CompletionSourceException {
    return AccountFiles.filter(cache.getOrLoad(ALL, this::readInterfaces), prefix);
  }

  private List<CompletionCandidate> readInterfaces() throws CompletionSourceException {
    List<Path> dirs;
    try (Stream<Path> stream = Files.list(netDirectory)) {
      dirs = stream.collect(Collectors.toList());
    } catch (IOException e) {
      throw new CompletionSourceException("Cannot list " + netDirectory, e);
    }

    List<CompletionCandidate> candidates = new ArrayList<>();
    for (Path dir : dirs) {
      String name = dir.getFileName().toString();
      String state = readAttribute(dir.resolve("operstate"));
      String type = typeName(readAttribute(dir.resolve("type")));
      String description;
      if (state != null && type != null) {
        description = type + " (" + state + ")";
      } else {
        description = state != null ? state : type;
      }
      candidates.add(CompletionCandidate.of(name, description, CandidateType.ARGUMENT));
    }
    candidates.sort(
        Comparator.comparingInt((CompletionCandidate c) -> priority(c.text()))
            .thenComparing(CompletionCandidate::text));
    return List.copyOf(candidates);
  }

  /** Sort rank by name: physical first, loopback last. */
  static int priority(String name) {
    if (name.startsWith("eth") || name.startsWith("enp") || name.startsWith("eno")) {
      return 0;
    }
    if (name.startsWith("wlan") || name.startsWith("wlp")) {
      return 1;
    }
    if (name.equals("lo")) {
      return 5;
    }
    if (name.startsWith("docker") || name.startsWith("br-") || name.startsWith("veth")) {
      return 4;
    }
    return 3;
  }

  private static String typeName(String code) {
    if (code == null) {
      return null;
    }
    return switch (code) {
      case "1" -> "ethernet";
      case "772" -> "loopback";
      case "801" -> "wireless";
      default -> "other";
    };
  }

  private static String readAttribute(Path file) {
    try {
      String value = Files.readString(file, StandardCharsets.UTF_8).trim();
      return value.isEmpty() ? null : value;
    } catch (IOException e) {
      log.debug("Cannot read {}: {}", file, e.getMessage());
      return null;
    }
  }
}
