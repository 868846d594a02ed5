package ca.gc.cra.sentinel.application.block;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Glob support for block rules: {@code *} matches any run of characters, {@code ?} exactly one. Matching is anchored
 * and case-insensitive; every other character is literal.
 *
 * @since 0.1.0
 */
public final class GlobMatcher {
  private final Pattern pattern;

  private GlobMatcher(Pattern pattern) {
    this.pattern = pattern;
  }

  public static boolean isGlob(String value) {
    return value != null && (value.indexOf('*') >= 0 || value.indexOf('?') >= 0);
  }

  public static GlobMatcher compile(String glob) {
    Objects.requireNonNull(glob, "glob");
    StringBuilder regex = new StringBuilder(glob.length() + 8);
    StringBuilder literal = new StringBuilder();
    for (int i = 0; i < glob.length(); i++) {
      char c = glob.charAt(i);
      if (c == '*' || c == '?') {
        if (literal.length() > 0) {
          regex.append(Pattern.quote(literal.toString()));
          literal.setLength(0);
        }
        regex.append(c == '*' ? ".*" : ".");
      } else {
        literal.append(c);
      }
    }
    if (literal.length() > 0) {
      regex.append(Pattern.quote(literal.toString()));
    }
    return new GlobMatcher(Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.DOTALL));
  }

  public boolean matches(String value) {
    return value != null && pattern.matcher(value).matches();
  }

  @Override
  public String toString() {
    return pattern.pattern();
  }
}
