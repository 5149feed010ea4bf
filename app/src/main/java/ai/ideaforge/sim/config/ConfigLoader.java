package ai.ideaforge.sim.config;

import ai.ideaforge.sim.cli.CliArguments;
import ai.ideaforge.sim.scenario.TestScenario;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_USE_MOCK_API = "FF_USE_MOCK_API";
    static final String ENV_MOCK_SCENARIO = "FF_MOCK_SCENARIO";
    static final String ENV_MOCK_VARIABILITY = "FF_MOCK_VARIABILITY";
    static final String ENV_SIMULATE_LATENCY = "FF_SIMULATE_LATENCY";
    static final String ENV_MIN_LATENCY = "FF_MIN_LATENCY";
    static final String ENV_MAX_LATENCY = "FF_MAX_LATENCY";
    static final String ENV_LOG_MOCK_REQUESTS = "FF_LOG_MOCK_REQUESTS";
    static final String ENV_APP_ENV = "APP_ENV";
    static final String ENV_ALLOW_TEST_MODE_IN_PRODUCTION = "ALLOW_TEST_MODE_IN_PRODUCTION";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_LLM_PROVIDER = "LLM_PROVIDER";
    static final String ENV_LLM_MODEL = "LLM_MODEL";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";

    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    private static final Set<String> TRUTHY = Set.of("true", "1", "yes", "on");

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load() {
        return load(new CliArguments());
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        AppEnvironment environment = environmentReader.get(ENV_APP_ENV)
                .filter(ConfigLoader::isNotBlank)
                .map(AppEnvironment::from)
                .orElse(AppEnvironment.DEVELOPMENT);

        boolean mockMode = resolveFlag(ENV_USE_MOCK_API);
        if (mockMode && environment == AppEnvironment.PRODUCTION && !resolveFlag(ENV_ALLOW_TEST_MODE_IN_PRODUCTION)) {
            throw new IllegalStateException(ENV_USE_MOCK_API + " cannot be enabled when " + ENV_APP_ENV
                    + "=production unless " + ENV_ALLOW_TEST_MODE_IN_PRODUCTION + " is set");
        }

        MockServiceConfig mockServiceConfig = new MockServiceConfig(
                resolveScenario(arguments),
                resolveFlag(ENV_MOCK_VARIABILITY),
                resolveFlag(ENV_SIMULATE_LATENCY),
                resolveInteger(ENV_MIN_LATENCY, MockServiceConfig.DEFAULT_MIN_LATENCY_MS),
                resolveInteger(ENV_MAX_LATENCY, MockServiceConfig.DEFAULT_MAX_LATENCY_MS),
                resolveFlag(ENV_LOG_MOCK_REQUESTS));

        LlmProvider provider = environmentReader.get(ENV_LLM_PROVIDER)
                .filter(ConfigLoader::isNotBlank)
                .map(LlmProvider::from)
                .orElse(LlmProvider.OLLAMA);

        String modelName = environmentReader.get(ENV_LLM_MODEL)
                .filter(ConfigLoader::isNotBlank)
                .orElse(defaultModelFor(provider));

        Optional<String> baseUrl = Optional.empty();
        if (provider == LlmProvider.OLLAMA) {
            baseUrl = Optional.of(environmentReader.get(ENV_OLLAMA_BASE_URL)
                    .filter(ConfigLoader::isNotBlank)
                    .orElse(DEFAULT_OLLAMA_BASE_URL));
        }

        Optional<String> geminiApiKey = environmentReader.get(ENV_GEMINI_API_KEY).filter(ConfigLoader::isNotBlank);

        return new Config(mockMode, environment, mockServiceConfig, resolveLogFormat(arguments),
                new ModelConfig(provider, modelName, baseUrl), new Secrets(geminiApiKey));
    }

    private String defaultModelFor(LlmProvider provider) {
        return switch (provider) {
            case GEMINI -> "models/gemini-1.5-flash-latest";
            case OLLAMA -> "llama3.1:8b";
        };
    }

    private TestScenario resolveScenario(CliArguments arguments) {
        TestScenario cliScenario = arguments.scenario();
        if (cliScenario != null) {
            return cliScenario;
        }
        return environmentReader.get(ENV_MOCK_SCENARIO)
                .filter(ConfigLoader::isNotBlank)
                .map(TestScenario::from)
                .orElse(TestScenario.SUCCESS);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private boolean resolveFlag(String key) {
        return environmentReader.get(key)
                .map(value -> value.trim().toLowerCase(Locale.ROOT))
                .map(TRUTHY::contains)
                .orElse(false);
    }

    private int resolveInteger(String key, int defaultValue) {
        return environmentReader.get(key)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(value -> parseNonNegativeInteger(key, value))
                .orElse(defaultValue);
    }

    private static int parseNonNegativeInteger(String key, String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 0) {
                throw new IllegalArgumentException(key + " must be zero or greater");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
