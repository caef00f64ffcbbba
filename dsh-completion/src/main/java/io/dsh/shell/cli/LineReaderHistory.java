package io.dsh.shell.cli;

import io.dsh.shell.cli.completion.CommandHistory;
import java.util.ArrayList;
import java.util.List;
import org.jline.reader.History;

/** Exposes a JLine {@link History} to the completion engine. */
public final class LineReaderHistory implements CommandHistory {

  private final History history;

  public LineReaderHistory(History history) {
    this.history = history;
  }

  @Override
  public List<String> entries() {
    List<String> lines = new ArrayList<>(history.size());
    for (History.Entry entry : history) {
      lines.add(entry.line());
    }
    return lines;
  }
}
