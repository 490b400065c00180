package membership;

import java.io.IOException;

// Serialized filter data whose declared parameters do not match its payload.
public class CorruptFilterException extends IOException {

    public CorruptFilterException(String message) {
        super(message);
    }

    public CorruptFilterException(String message, Throwable cause) {
        super(message, cause);
    }
}
