package ca.gc.cra.prism.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parsed representation of CLI arguments split into flags, positional words and key/value pairs.
 *
 * <p>{@code prism results get key=job-1 --verbose} yields positionals {@code [results, get]}, key/value
 * {@code [key=job-1]} and flags {@code [--verbose]}.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final List<String> positionals;
  private final String[] keyValueArgs;
  private final Set<String> flags;
  private final boolean help;
  private final boolean verbose;

  private CliInput(
      List<String> positionals, String[] keyValueArgs, Set<String> flags, boolean help, boolean verbose) {
    this.positionals = positionals;
    this.keyValueArgs = keyValueArgs;
    this.flags = flags;
    this.help = help;
    this.verbose = verbose;
  }

  /**
   * Parses raw arguments into flag, positional and key/value partitions.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation of the arguments
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(List.of(), new String[0], Set.of(), false, false);
    }

    List<String> words = new ArrayList<>();
    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    boolean help = false;
    boolean verbose = false;
    for (String raw : args) {
      if (raw == null) {
        continue;
      }
      String arg = raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        help = true;
        flags.add("--help");
        continue;
      }
      if (VERBOSE_FLAGS.contains(lower)) {
        verbose = true;
        flags.add("--verbose");
        continue;
      }
      if (arg.contains("=")) {
        kv.add(arg);
      } else if (arg.startsWith("-")) {
        flags.add(lower);
      } else {
        words.add(arg);
      }
    }
    return new CliInput(List.copyOf(words), kv.toArray(String[]::new), Set.copyOf(flags), help, verbose);
  }

  /**
   * Returns the words that are neither flags nor {@code key=value} pairs, in order.
   *
   * @return positional arguments such as subcommand names
   */
  public List<String> positionals() {
    return positionals;
  }

  /**
   * Returns the positional at {@code index}, or {@code null} when absent.
   *
   * @param index zero-based position
   * @return positional word or {@code null}
   */
  public String positional(int index) {
    return index < positionals.size() ? positionals.get(index) : null;
  }

  /**
   * Returns a defensive copy of the key/value style arguments.
   *
   * @return copy of arguments intended for key=value parsing
   */
  public String[] keyValueArgs() {
    return Arrays.copyOf(keyValueArgs, keyValueArgs.length);
  }

  /**
   * Indicates whether a help flag was supplied.
   *
   * @return {@code true} if help output was requested
   */
  public boolean help() {
    return help;
  }

  /**
   * Indicates whether verbose logging was requested.
   *
   * @return {@code true} when --verbose (or equivalent) was present
   */
  public boolean verbose() {
    return verbose;
  }

  /**
   * Checks whether a normalized flag such as {@code --vector} was provided.
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
}
