package membership;

// Raised by union/intersection when the operands were built with different parameters.
public class IncompatibleFiltersException extends IllegalArgumentException {

    public IncompatibleFiltersException(String message) {
        super(message);
    }
}
