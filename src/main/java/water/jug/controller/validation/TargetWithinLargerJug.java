package water.jug.controller.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;
import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Cross-field rule: the target may not exceed the larger of the two capacities.
 *
 * <p>Only evaluated when the single-field rules already hold, so a negative capacity does not
 * also produce this message.
 */
@Documented
@Constraint(validatedBy = TargetWithinLargerJugValidator.class)
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface TargetWithinLargerJug {

  String message() default "Target amount cannot exceed the capacity of the larger jug";

  Class<?>[] groups() default {};

  Class<? extends Payload>[] payload() default {};
}
