package io.dsh.shell.cli.completion.generators;

import io.dsh.shell.cli.completion.CandidateType;
import io.dsh.shell.cli.completion.CompletionCandidate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** POSIX signal names, matched by name with or without {@code SIG}, or by number. */
public final class SignalGenerator {

  record Signal(String name, int number, String description) {}

  static final List<Signal> SIGNALS =
      List.of(
          new Signal("SIGHUP", 1, "Hangup"),
          new Signal("SIGINT", 2, "Interrupt"),
          new Signal("SIGQUIT", 3, "Quit"),
          new Signal("SIGILL", 4, "Illegal instruction"),
          new Signal("SIGTRAP", 5, "Trace trap"),
          new Signal("SIGABRT", 6, "Abort"),
          new Signal("SIGBUS", 7, "Bus error"),
          new Signal("SIGFPE", 8, "Floating point exception"),
          new Signal("SIGKILL", 9, "Kill (cannot be caught)"),
          new Signal("SIGUSR1", 10, "User defined signal 1"),
          new Signal("SIGSEGV", 11, "Segmentation violation"),
          new Signal("SIGUSR2", 12, "User defined signal 2"),
          new Signal("SIGPIPE", 13, "Broken pipe"),
          new Signal("SIGALRM", 14, "Alarm clock"),
          new Signal("SIGTERM", 15, "Termination"),
          new Signal("SIGSTKFLT", 16, "Stack fault"),
          new Signal("SIGCHLD", 17, "Child status changed"),
          new Signal("SIGCONT", 18, "Continue"),
          new Signal("SIGSTOP", 19, "Stop (cannot be caught)"),
          new Signal("SIGTSTP", 20, "Terminal stop"),
          new Signal("SIGTTIN", 21, "Background read from tty"),
          new Signal("SIGTTOU", 22, "Background write to tty"),
          new Signal("SIGURG", 23, "Urgent I/O condition"),
          new Signal("SIGXCPU", 24, "CPU time limit exceeded"),
          new Signal("SIGXFSZ", 25, "File size limit exceeded"),
          new Signal("SIGVTALRM", 26, "Virtual timer expired"),
          new Signal("SIGPROF", 27, "Profiling timer expired"),
          new Signal("SIGWINCH", 28, "Window size changed"),
          new Signal("SIGIO", 29, "I/O possible"),
          new Signal("SIGPWR", 30, "Power failure"),
          new Signal("SIGSYS", 31, "Bad system call"));

  /**
   * Signals matching {@code prefix}, e.g. {@code SIGK}, {@code KI} or {@code 9}.
   *
   * @param prefix typed text, case-insensitive
   * @return full signal names described with their number
   */
  public List<CompletionCandidate> generate(String prefix) {
    return generate(prefix, false);
  }

  /** Like {@link #generate(String)} but offers names without the {@code SIG} prefix. */
  public List<CompletionCandidate> generateShort(String prefix) {
    return generate(prefix, true);
  }

  private List<CompletionCandidate> generate(String prefix, boolean shortNames) {
    String upper = prefix.toUpperCase(Locale.ROOT);
    List<CompletionCandidate> candidates = new ArrayList<>();
    for (Signal signal : SIGNALS) {
      String bare = signal.name().substring(3);
      boolean matches =
          prefix.isEmpty()
              || bare.startsWith(upper)
              || (!shortNames && signal.name().startsWith(upper))
              || Integer.toString(signal.number()).startsWith(prefix);
      if (matches) {
        candidates.add(
            CompletionCandidate.of(
                shortNames ? bare : signal.name(),
                signal.description() + " (" + signal.number() + ")",
                CandidateType.ARGUMENT));
      }
    }
    return candidates;
  }
}
