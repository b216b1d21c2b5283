package water.jug.controller.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import water.jug.controller.dto.waterjug.SolveRequest;

public class TargetWithinLargerJugValidator
    implements ConstraintValidator<TargetWithinLargerJug, SolveRequest> {

  @Override
  public boolean isValid(SolveRequest request, ConstraintValidatorContext context) {
    if (request == null) {
      return true;
    }
    // left to the field constraints
    if (request.xCapacity() <= 0 || request.yCapacity() <= 0 || request.zAmountWanted() < 0) {
      return true;
    }
    return request.zAmountWanted() <= Math.max(request.xCapacity(), request.yCapacity());
  }
}
