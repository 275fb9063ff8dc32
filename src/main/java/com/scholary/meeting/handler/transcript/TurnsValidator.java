package com.scholary.meeting.handler.transcript;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks merged turns against the turns document schema.
 *
 * <p>Problems are reported, never enforced: a slightly malformed turn from the analysis step
 * should not stop the rest of the pipeline.
 */
public class TurnsValidator {

  private static final Logger LOGGER = LoggerFactory.getLogger(TurnsValidator.class);

  private final Validator validator;

  public TurnsValidator(Validator validator) {
    this.validator = validator;
  }

  /**
   * Validate every turn.
   *
   * @param turns the merged turns
   * @return one message per violation, e.g. {@code "Turn 3: speaker must not be blank"}
   */
  public List<String> validate(List<Turn> turns) {
    List<String> errors = new ArrayList<>();
    for (int i = 0; i < turns.size(); i++) {
      Turn turn = turns.get(i);
      if (turn == null) {
        errors.add("Turn " + i + " must be an object");
        continue;
      }
      List<ConstraintViolation<Turn>> violations = new ArrayList<>(validator.validate(turn));
      violations.sort(Comparator.comparing(v -> v.getPropertyPath().toString()));
      for (ConstraintViolation<Turn> violation : violations) {
        errors.add(
            String.format("Turn %d: %s %s", i, violation.getPropertyPath(), violation.getMessage()));
      }
    }

    if (errors.isEmpty()) {
      LOGGER.info("Merged turns passed schema validation");
    } else {
      LOGGER.warn("Merged turns failed validation with {} errors: {}", errors.size(), errors);
    }
    return errors;
  }
}
