package Tomato.Model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a definition fails validation. Carries every problem found, not just the first.
 */
public class InvalidMachineException extends RuntimeException {
    private final transient List<ValidationError> errors;

    public InvalidMachineException(List<ValidationError> errors) {
        super(errors.stream().map(ValidationError::toString).collect(Collectors.joining("; ")));
        this.errors = List.copyOf(errors);
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    public boolean hasKind(ValidationError.Kind kind) {
        return errors.stream().anyMatch(e -> e.kind() == kind);
    }
}
