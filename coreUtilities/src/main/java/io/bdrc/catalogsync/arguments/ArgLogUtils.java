package io.bdrc.catalogsync.arguments;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public class ArgLogUtils {

    private ArgLogUtils() {
        throw new IllegalStateException("Utility class");
    }

    public static final String CENSORED_VALUE = "******";

    /**
     * Copies the command line, replacing the value that follows any censored flag.  Both the
     * {@code --flag value} and {@code --flag=value} spellings are handled.
     */
    public static List<String> getRedactedArgs(String[] args, Collection<String> censoredArgs) {
        List<String> redactedArgs = new ArrayList<>(args.length);
        boolean shouldCensorNext = false;

        for (String arg : args) {
            int equalsAt = arg.indexOf('=');
            if (shouldCensorNext) {
                redactedArgs.add(CENSORED_VALUE);
                shouldCensorNext = false;
            } else if (censoredArgs.contains(arg)) {
                redactedArgs.add(arg);
                shouldCensorNext = true;
            } else if (equalsAt > 0 && censoredArgs.contains(arg.substring(0, equalsAt))) {
                redactedArgs.add(arg.substring(0, equalsAt + 1) + CENSORED_VALUE);
            } else {
                redactedArgs.add(arg);
            }
        }
        return redactedArgs;
    }
}
