package work.arachne.config.module;

import java.io.IOException;

/**
 * Supplies the script text of a module each time it is (re)loaded.
 */
@FunctionalInterface
public interface ModuleSource {
    String read() throws IOException;
}
