package secenv.vault.impls;

import secenv.vault.types.PasswordStrength;
import secenv.vault.types.PasswordStrength.Requirement;
import com.google.common.collect.ImmutableList;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Scores passwords against a fixed policy.  Each of the six {@link Requirement}s is
 * worth one point, and a password is strong if it scores at least
 * {@value #MIN_SCORE}, i.e. it may miss at most one requirement.
 */
public class KeyValidator {

  public static final int MIN_LENGTH = 12;
  public static final int MIN_SCORE = 5;
  public static final String SPECIAL_CHARS = "!@#$%^&*()_+-=[]{};':\"\\|,.<>/?";

  private static final List<String> COMMON_PASSWORDS = ImmutableList.of(
          "password",
          "password123",
          "123456789",
          "qwerty");

  public PasswordStrength validate(String password) {
    Set<Requirement> unmet = EnumSet.noneOf(Requirement.class);

    if (password.length() < MIN_LENGTH) {
      unmet.add(Requirement.MIN_LENGTH);
    }
    if (password.chars().noneMatch(c -> c >= 'A' && c <= 'Z')) {
      unmet.add(Requirement.HAS_UPPER);
    }
    if (password.chars().noneMatch(c -> c >= 'a' && c <= 'z')) {
      unmet.add(Requirement.HAS_LOWER);
    }
    if (password.chars().noneMatch(c -> c >= '0' && c <= '9')) {
      unmet.add(Requirement.HAS_NUMBER);
    }
    if (password.chars().noneMatch(c -> SPECIAL_CHARS.indexOf(c) >= 0)) {
      unmet.add(Requirement.HAS_SPECIAL);
    }
    String lower = password.toLowerCase(Locale.ROOT);
    if (COMMON_PASSWORDS.stream().anyMatch(lower::contains)) {
      unmet.add(Requirement.NOT_COMMON);
    }

    int score = Requirement.values().length - unmet.size();
    return new PasswordStrength(score >= MIN_SCORE, score, unmet);
  }

}
