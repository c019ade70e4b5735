package Powerset.Config;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Settings for reading tables and running the batch stages.
 * Defaults come from {@code powerset.properties} on the classpath; the command line overrides them.
 */
public class PowersetConfig {
    public static final String RESOURCE = "powerset.properties";

    public static final String EPSILON = "powerset.epsilon";
    public static final String SYMBOLS = "powerset.symbols";
    public static final String UNKNOWN_SYMBOLS = "powerset.unknownSymbols";
    public static final String STATE_PREFIX = "powerset.statePrefix";
    public static final String OUTPUT_DIR = "powerset.outputDir";
    public static final String EMPTY_WORD = "powerset.report.emptyWord";
    public static final String ACCEPTED = "powerset.report.accepted";
    public static final String REJECTED = "powerset.report.rejected";

    private char epsilon = 'h';
    private String symbols = "01";
    private UnknownSymbolPolicy unknownSymbolPolicy = UnknownSymbolPolicy.EPSILON;
    private String statePrefix = "q";
    private Path outputDir = Paths.get("results");
    private String emptyWordMarker = "(empty word)";
    private String acceptedLabel = "accepted";
    private String rejectedLabel = "rejected";
    private Path baOutput;
    private boolean debug;

    /**
     * Defaults from the bundled properties file.
     */
    public static PowersetConfig load() {
        Properties properties = new Properties();
        try (InputStream is = PowersetConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (is != null) {
                properties.load(is);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
        return fromProperties(properties);
    }

    public static PowersetConfig fromProperties(Properties properties) {
        PowersetConfig config = new PowersetConfig();
        String value = properties.getProperty(EPSILON);
        if (value != null) {
            config.epsilon = parseEpsilon(value);
        }
        value = properties.getProperty(SYMBOLS);
        if (value != null) {
            config.symbols = value.trim();
        }
        checkDisjoint(config.epsilon, config.symbols);
        value = properties.getProperty(UNKNOWN_SYMBOLS);
        if (value != null) {
            config.setUnknownSymbolPolicy(UnknownSymbolPolicy.parse(value));
        }
        value = properties.getProperty(STATE_PREFIX);
        if (value != null) {
            config.statePrefix = value.trim();
        }
        value = properties.getProperty(OUTPUT_DIR);
        if (value != null) {
            config.setOutputDir(Paths.get(value.trim()));
        }
        config.emptyWordMarker = properties.getProperty(EMPTY_WORD, config.emptyWordMarker);
        config.acceptedLabel = properties.getProperty(ACCEPTED, config.acceptedLabel);
        config.rejectedLabel = properties.getProperty(REJECTED, config.rejectedLabel);
        return config;
    }

    public char getEpsilon() {
        return epsilon;
    }

    public void setEpsilon(String token) {
        char e = parseEpsilon(token);
        checkDisjoint(e, symbols);
        this.epsilon = e;
    }

    /** Expected NFA input symbols; empty means any single character is accepted. */
    public String getSymbols() {
        return symbols;
    }

    public void setSymbols(String symbols) {
        String s = symbols.trim();
        checkDisjoint(epsilon, s);
        this.symbols = s;
    }

    public UnknownSymbolPolicy getUnknownSymbolPolicy() {
        return unknownSymbolPolicy;
    }

    public void setUnknownSymbolPolicy(UnknownSymbolPolicy unknownSymbolPolicy) {
        this.unknownSymbolPolicy = unknownSymbolPolicy;
    }

    public String getStatePrefix() {
        return statePrefix;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(Path outputDir) {
        this.outputDir = outputDir;
    }

    public String getEmptyWordMarker() {
        return emptyWordMarker;
    }

    public String getAcceptedLabel() {
        return acceptedLabel;
    }

    public String getRejectedLabel() {
        return rejectedLabel;
    }

    /** Where to write the converted DFA in BA format, or null. */
    public Path getBaOutput() {
        return baOutput;
    }

    public void setBaOutput(Path baOutput) {
        this.baOutput = baOutput;
    }

    private static char parseEpsilon(String token) {
        String t = token.trim();
        if (t.length() != 1) {
            throw new IllegalArgumentException("Epsilon token must be a single character: '" + token + "'");
        }
        return t.charAt(0);
    }

    private static void checkDisjoint(char epsilon, String symbols) {
        if (symbols.indexOf(epsilon) >= 0) {
            throw new IllegalArgumentException("Epsilon token '" + epsilon + "' is also an expected symbol");
        }
    }

    public boolean isDebug() {
        return debug;
    }

    public void setDebug(boolean debug) {
        this.debug = debug;
    }
}
