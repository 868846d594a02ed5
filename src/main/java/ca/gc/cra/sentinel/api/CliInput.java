package ca.gc.cra.sentinel.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command arguments split into {@code key=value} settings and dash-prefixed flags.
 *
 * <p>{@code --help}/{@code -h}/{@code help} and {@code --verbose}/{@code -v}/{@code --debug} are normalized to
 * {@code --help} and {@code --verbose}; every other flag is kept lowercased. Bare words (a command name) stay with
 * the settings so the dispatcher can find them.</p>
 */
public final class CliInput {
  static final String HELP = "--help";
  static final String VERBOSE = "--verbose";

  private final String[] keyValueArgs;
  private final Set<String> flags;

  private CliInput(String[] keyValueArgs, Set<String> flags) {
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
  }

  /**
   * Splits raw arguments. {@code null} entries and blank arguments are ignored.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed arguments
   */
  public static CliInput parse(String[] args) {
    List<String> settings = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    for (String raw : args == null ? new String[0] : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String flag = normalizeFlag(arg);
      if (flag != null) {
        flags.add(flag);
      } else {
        settings.add(arg);
      }
    }
    return new CliInput(settings.toArray(String[]::new), Collections.unmodifiableSet(flags));
  }

  private static String normalizeFlag(String arg) {
    String lower = arg.toLowerCase(Locale.ROOT);
    switch (lower) {
      case "--help", "-h", "help":
        return HELP;
      case "--verbose", "-v", "--debug":
        return VERBOSE;
      default:
        return lower.startsWith("-") && !lower.contains("=") ? lower : null;
    }
  }

  /**
   * Returns a copy of the {@code key=value} style arguments.
   *
   * @return arguments intended for {@link CliArgsParser}
   */
  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  public boolean help() {
    return flags.contains(HELP);
  }

  public boolean verbose() {
    return flags.contains(VERBOSE);
  }

  /**
   * Checks whether a flag such as {@code --json} was provided.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if the flag was supplied
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Lists flags the command does not understand; help and verbose are always understood.
   *
   * @param supported command-specific flags, lowercased
   * @return unknown flags in argument order
   */
  public List<String> unsupportedFlags(Set<String> supported) {
    List<String> unknown = new ArrayList<>();
    for (String flag : flags) {
      if (!HELP.equals(flag) && !VERBOSE.equals(flag) && !supported.contains(flag)) {
        unknown.add(flag);
      }
    }
    return unknown;
  }
}
