package paylink.common;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.time.Instant;

/**
 * Shared Gson instances.
 * Instants are written as ISO-8601 strings, the JDK types are not reflectively accessible on 17+.
 *
 * @since 19/10/2026
 */
public final class JsonSupport {
    private static final Gson COMPACT = baseBuilder().create();
    private static final Gson PRETTY = baseBuilder().setPrettyPrinting().create();

    private JsonSupport() {
        throw new AssertionError("Utility class cannot be instantiated");
    }

    /**
     * Compact Gson - one object per line (wire payloads, transaction log)
     */
    public static Gson compact() {
        return COMPACT;
    }

    /**
     * Pretty-printing Gson (terminal cache snapshot, diagnostics)
     */
    public static Gson pretty() {
        return PRETTY;
    }

    private static GsonBuilder baseBuilder() {
        return new GsonBuilder()
                .disableHtmlEscaping()
                .registerTypeAdapter(Instant.class, new InstantAdapter().nullSafe());
    }

    private static final class InstantAdapter extends TypeAdapter<Instant> {
        @Override
        public void write(JsonWriter out, Instant value) throws IOException {
            out.value(value.toString());
        }

        @Override
        public Instant read(JsonReader in) throws IOException {
            return Instant.parse(in.nextString());
        }
    }
}
