package io.dsh.shell.cli.completion.generators;

import io.dsh.shell.cli.completion.CandidateType;
import io.dsh.shell.cli.completion.CompletionCandidate;
import io.dsh.shell.cli.completion.CompletionSourceException;
import io.dsh.shell.cli.completion.cache.CompletionCache;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Login names from the passwd database. Accounts with a uid below 1000 are skipped unless system
 * users are requested; {@code root} is always offered.
 */
public final class UserGenerator {

  static final Path PASSWD = Path.of("/etc/passwd");
  private static final int FIRST_REGULAR_UID = 1000;

  private final Path passwdFile;
  private final boolean includeSystemUsers;
  private final CompletionCache<Boolean, List<CompletionCandidate>> cache;

  public UserGenerator() {
    this(PASSWD, false, new CompletionCache<>(CompletionCache.ACCOUNT_TTL));
  }

  public UserGenerator(
      Path passwdFile,
      boolean includeSystemUsers,
      CompletionCache<Boolean, List<CompletionCandidate>> cache) {
    this.passwdFile = passwdFile;
    this.includeSystemUsers = includeSystemUsers;
    this.cache = cache;
  }

  /**
   * Accounts whose name starts with {@code prefix}, ignoring case.
   *
   * @param prefix typed text
   * @return matching accounts sorted by name, described by their GECOS field
   * @throws CompletionSourceException if the passwd database cannot be read
   */
  public List<CompletionCandidate> generate(String prefix) throws CompletionSourceException {
    List<CompletionCandidate> all = cache.getOrLoad(includeSystemUsers, this::readAccounts);
    return AccountFiles.filter(all, prefix);
  }

  private List<CompletionCandidate> readAccounts() throws CompletionSourceException {
    List<CompletionCandidate> candidates = new ArrayList<>();
    for (String[] fields : AccountFiles.records(passwdFile)) {
      if (fields.length < 5) {
        continue;
      }
      String name = fields[0];
      int uid;
      try {
        uid = Integer.parseInt(fields[2]);
      } catch (NumberFormatException e) {
        continue;
      }
      if (includeSystemUsers || uid >= FIRST_REGULAR_UID || "root".equals(name)) {
        String gecos = fields[4].isEmpty() ? null : fields[4];
        candidates.add(CompletionCandidate.of(name, gecos, CandidateType.ARGUMENT));
      }
    }
    candidates.sort(Comparator.comparing(CompletionCandidate::text));
    return List.copyOf(candidates);
  }
}
