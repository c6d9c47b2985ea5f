package work.arachne.config.dsl;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Stack frame classification for diagnostics: a frame is script-originated when it was produced by
 * code evaluated in a config script namespace.
 */
public final class ScriptFrames {
    /** Prefix of every script namespace name (and of the source names guest frames report). */
    public static final String NAMESPACE_PREFIX = "arachne-config-script";

    private static final Pattern SCRIPT_CLASS = Pattern.compile("^arachne_config_script.*");

    private ScriptFrames() {}

    public static boolean isScriptFrame(StackTraceElement frame) {
        if (frame == null) {
            return false;
        }
        String fileName = frame.getFileName();
        if (fileName != null && fileName.startsWith(NAMESPACE_PREFIX)) {
            return true;
        }
        return SCRIPT_CLASS.matcher(frame.getClassName()).matches();
    }

    public static List<StackTraceElement> filter(StackTraceElement[] frames, Predicate<StackTraceElement> predicate) {
        List<StackTraceElement> kept = new ArrayList<>();
        if (frames == null) {
            return kept;
        }
        for (StackTraceElement frame : frames) {
            if (predicate.test(frame)) {
                kept.add(frame);
            }
        }
        return kept;
    }
}
