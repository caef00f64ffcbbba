package io.dsh.shell.cli.completion.generators;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import io.dsh.shell.cli.completion.CompletionCandidate;
import io.dsh.shell.cli.completion.CompletionSourceException;
import io.dsh.shell.cli.completion.cache.CompletionCache;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SystemGeneratorsTest {

  @TempDir Path dir;

  private static List<String> texts(List<CompletionCandidate> candidates) {
    return candidates.stream().map(CompletionCandidate::text).toList();
  }

  private static String description(List<CompletionCandidate> candidates, String text) {
    return candidates.stream()
        .filter(c -> c.text().equals(text))
        .findFirst()
        .map(CompletionCandidate::description)
        .orElse(null);
  }

  @Nested
  class Signals {

    private final SignalGenerator signals = new SignalGenerator();

    @Test
    void emptyPrefixListsAllSignals() {
      assertEquals(31, signals.generate("").size());
    }

    @Test
    void matchesNameWithoutSigPrefix() {
      List<CompletionCandidate> candidates = signals.generate("KI");

      assertEquals(List.of("SIGKILL"), texts(candidates));
      assertEquals("Kill (cannot be caught) (9)", candidates.get(0).description());
    }

    @Test
    void matchesFullNameCaseInsensitively() {
      assertThat(texts(signals.generate("sigt")))
          .containsExactly("SIGTRAP", "SIGTERM", "SIGTSTP", "SIGTTIN", "SIGTTOU");
    }

    @Test
    void matchesNumber() {
      assertEquals(List.of("SIGKILL"), texts(signals.generate("9")));
      assertEquals(11, signals.generate("1").size());
    }

    @Test
    void shortNamesDropSigPrefix() {
      assertEquals(List.of("TERM"), texts(signals.generateShort("TE")));
    }
  }

  @Nested
  class Users {

    private Path passwd() throws IOException {
      return Files.writeString(
          dir.resolve("passwd"),
          String.join(
              "\n",
              "# comment",
              "root:x:0:0:root:/root:/bin/bash",
              "daemon:x:1:1:daemon:/usr/sbin:/usr/sbin/nologin",
              "alice:x:1000:1000:Alice Liddell:/home/alice:/bin/bash",
              "bob:x:1001:1001::/home/bob:/bin/zsh",
              "broken:line",
              "nan:x:abc:1::/:/bin/sh"),
          StandardCharsets.UTF_8);
    }

    @Test
    void regularUsersAndRootSorted() throws Exception {
      UserGenerator users =
          new UserGenerator(passwd(), false, new CompletionCache<>(CompletionCache.ACCOUNT_TTL));

      List<CompletionCandidate> candidates = users.generate("");

      assertEquals(List.of("alice", "bob", "root"), texts(candidates));
      assertEquals("Alice Liddell", description(candidates, "alice"));
      assertNull(description(candidates, "bob"));
    }

    @Test
    void systemUsersOnRequest() throws Exception {
      UserGenerator users =
          new UserGenerator(passwd(), true, new CompletionCache<>(CompletionCache.ACCOUNT_TTL));

      assertThat(texts(users.generate(""))).contains("daemon");
    }

    @Test
    void prefixIsCaseInsensitive() throws Exception {
      UserGenerator users =
          new UserGenerator(passwd(), false, new CompletionCache<>(CompletionCache.ACCOUNT_TTL));

      assertEquals(List.of("alice"), texts(users.generate("AL")));
    }

    @Test
    void missingFileFails() {
      UserGenerator users =
          new UserGenerator(
              dir.resolve("absent"), false, new CompletionCache<>(CompletionCache.ACCOUNT_TTL));

      assertThrows(CompletionSourceException.class, () -> users.generate(""));
    }
  }

  @Nested
  class Groups {

    @Test
    void groupsCarryGid() throws Exception {
      Path file =
          Files.writeString(
              dir.resolve("group"),
              "wheel:x:10:alice\nusers:x:100:alice,bob\nodd:x:notanumber:\n",
              StandardCharsets.UTF_8);
      GroupGenerator groups =
          new GroupGenerator(file, new CompletionCache<>(CompletionCache.ACCOUNT_TTL));

      List<CompletionCandidate> candidates = groups.generate("");

      assertEquals(List.of("odd", "users", "wheel"), texts(candidates));
      assertEquals("GID: 10", description(candidates, "wheel"));
      assertNull(description(candidates, "odd"));
    }
  }

  @Nested
  class Interfaces {

    private void iface(String name, String operstate, String type) throws IOException {
      Path ifDir = Files.createDirectories(dir.resolve(name));
      if (operstate != null) {
        Files.writeString(ifDir.resolve("operstate"), operstate + "\n", StandardCharsets.UTF_8);
      }
      if (type != null) {
        Files.writeString(ifDir.resolve("type"), type + "\n", StandardCharsets.UTF_8);
      }
    }

    @Test
    void physicalInterfacesFirstLoopbackLast() throws Exception {
      iface("lo", "unknown", "772");
      iface("docker0", null, null);
      iface("wlan0", "down", "801");
      iface("eth0", "up", "1");
      iface("tun0", "up", "65534");
      InterfaceGenerator interfaces =
          new InterfaceGenerator(dir, new CompletionCache<>(CompletionCache.INTERFACE_TTL));

      List<CompletionCandidate> candidates = interfaces.generate("");

      assertEquals(List.of("eth0", "wlan0", "tun0", "docker0", "lo"), texts(candidates));
      assertEquals("ethernet (up)", description(candidates, "eth0"));
      assertEquals("wireless (down)", description(candidates, "wlan0"));
      assertEquals("loopback (unknown)", description(candidates, "lo"));
      assertEquals("other (up)", description(candidates, "tun0"));
      assertNull(description(candidates, "docker0"));
    }

    @Test
    void missingDirectoryFails() {
      InterfaceGenerator interfaces =
          new InterfaceGenerator(
              dir.resolve("absent"), new CompletionCache<>(CompletionCache.INTERFACE_TTL));

      assertThrows(CompletionSourceException.class, () -> interfaces.generate(""));
    }
  }
}
