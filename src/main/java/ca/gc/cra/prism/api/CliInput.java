package ca.gc.cra.prism.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parsed command line split into switches and {@code key=value} arguments.
 *
 * <p>Switches start with {@code -} and carry no {@code =}. {@code --help}/{@code -h}/{@code help} and
 * {@code --verbose}/{@code -v}/{@code --debug} are normalized; every other switch is kept lower-cased.
 * A {@code --key=value} token is treated as {@code key=value}.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final List<String> keyValueArgs;
  private final Set<String> flags;

  private CliInput(List<String> keyValueArgs, Set<String> flags) {
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
  }

  /**
   * Parses raw arguments.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation of the arguments
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(List.of(), Set.of());
    }
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    for (String raw : Arrays.asList(args)) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        flags.add("--verbose");
      } else if (arg.startsWith("--") && arg.indexOf('=') > 2) {
        kv.add(arg.substring(2));
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else {
        kv.add(arg);
      }
    }
    return new CliInput(List.copyOf(kv), Set.copyOf(flags));
  }

  /**
   * Returns the {@code key=value} style arguments in command-line order.
   *
   * @return copy of the positional and key/value arguments
   */
  public String[] keyValueArgs() {
    return keyValueArgs.toArray(String[]::new);
  }

  public boolean help() {
    return flags.contains("--help");
  }

  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /**
   * Checks whether a switch such as {@code --dry-run} was supplied.
   *
   * @param flag switch to query (case-insensitive)
   * @return {@code true} if present
   */
  public boolean hasFlag(String flag) {
    return flag != null && flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Returns switches that are not in {@code known}; used to reject typos such as {@code --dryrun}.
   *
   * @param known accepted switches besides help and verbose
   * @return unknown switches in command-line order
   */
  public List<String> unknownFlags(Set<String> known) {
    List<String> unknown = new ArrayList<>();
    for (String flag : flags) {
      if (!flag.equals("--help") && !flag.equals("--verbose") && !known.contains(flag)) {
        unknown.add(flag);
      }
    }
    return unknown;
  }
}
