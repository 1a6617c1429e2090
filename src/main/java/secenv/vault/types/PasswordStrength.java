package secenv.vault.types;

import com.google.common.collect.Sets;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * The outcome of checking a password against the strength policy.
 *
 * @param strong whether the password is acceptable
 * @param score the number of requirements met, 0 to {@link Requirement#values() all of them}
 * @param unmet the requirements the password does not meet
 */
public record PasswordStrength(boolean strong, int score, Set<Requirement> unmet) {

  public enum Requirement {
    MIN_LENGTH("min length"),
    HAS_UPPER("has upper"),
    HAS_LOWER("has lower"),
    HAS_NUMBER("has number"),
    HAS_SPECIAL("has special"),
    NOT_COMMON("not common");

    private final String description;

    Requirement(String description) {
      this.description = description;
    }

    @Override
    public String toString() {
      return description;
    }
  }

  public PasswordStrength {
    unmet = Sets.immutableEnumSet(unmet);
  }

  public String message() {
    if (strong) {
      return "Strong password";
    }
    return "Weak password. Requirements: " + unmet.stream()
            .map(Requirement::toString)
            .collect(Collectors.joining(", "));
  }
}
