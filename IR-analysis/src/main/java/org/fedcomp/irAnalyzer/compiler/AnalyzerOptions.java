package org.fedcomp.irAnalyzer.compiler;

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import org.fedcomp.irAnalyzer.compiler.errors.InvalidArgumentError;
import org.fedcomp.util.Logger;

import java.util.HashMap;
import java.util.Map;

/** Options controlling the analyzer.
 * The analyses themselves are not configurable; these options only
 * control diagnostics. */
@SuppressWarnings("CanBeFinal")
// These fields cannot be final, since JCommander writes them through reflection.
public class AnalyzerOptions {
    @DynamicParameter(names = "-T",
            description = "Specify logging level for a class (can be repeated)")
    public Map<String, String> loggingLevel = new HashMap<>();
    @Parameter(names = {"-h", "--help"}, help = true, description = "Show this message")
    public boolean help = false;

    /** Parse options given as command-line arguments. */
    public static AnalyzerOptions parse(String... argv) {
        AnalyzerOptions options = new AnalyzerOptions();
        JCommander commander = options.commander();
        try {
            commander.parse(argv);
        } catch (ParameterException ex) {
            throw new InvalidArgumentError(ex.getMessage(), ex);
        }
        return options;
    }

    JCommander commander() {
        JCommander commander = JCommander.newBuilder()
                .addObject(this)
                .build();
        commander.setProgramName("ir-analysis");
        return commander;
    }

    public String usage() {
        StringBuilder builder = new StringBuilder();
        this.commander().getUsageFormatter().usage(builder);
        return builder.toString();
    }

    /** Install the logging levels in the {@link Logger}. */
    public void apply() {
        for (Map.Entry<String, String> entry: this.loggingLevel.entrySet()) {
            int level;
            try {
                level = Integer.parseInt(entry.getValue());
            } catch (NumberFormatException ex) {
                throw new InvalidArgumentError(
                        "-T option must be followed by 'class=number'; could not parse " + entry, ex);
            }
            Logger.INSTANCE.setLoggingLevel(entry.getKey(), level);
        }
    }

    @Override
    public String toString() {
        return "AnalyzerOptions{" +
                "\n\tloggingLevel=" + this.loggingLevel +
                ",\n\thelp=" + this.help +
                '}';
    }
}
