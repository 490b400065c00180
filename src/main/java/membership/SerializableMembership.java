package membership;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;

/**
 * A {@link Membership} that can be written in the portable binary and text formats.
 * Every implementation pairs these with static {@code readFrom} and {@code fromText} factories.
 */
public interface SerializableMembership extends Membership {

    void writeTo(OutputStream out) throws IOException;

    String toText();

    default byte[] toByteArray() {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        try {
            writeTo(bos);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bos.toByteArray();
    }
}
