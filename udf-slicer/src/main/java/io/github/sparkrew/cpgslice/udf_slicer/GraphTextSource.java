package io.github.sparkrew.cpgslice.udf_slicer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Supplies the complete text of one exported graph.
 */
@FunctionalInterface
public interface GraphTextSource {

    String read() throws IOException;

    /**
     * Human-readable origin used in logs and reports.
     */
    default String describe() {
        return toString();
    }

    static GraphTextSource ofPath(Path path) {
        return new GraphTextSource() {
            @Override
            public String read() throws IOException {
                return Files.readString(path, StandardCharsets.UTF_8);
            }

            @Override
            public String describe() {
                return path.toString();
            }
        };
    }

    static GraphTextSource ofString(String text, String name) {
        return new GraphTextSource() {
            @Override
            public String read() {
                return text;
            }

            @Override
            public String describe() {
                return name;
            }
        };
    }
}
