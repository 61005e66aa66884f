package com.initialone.jgiv.llm;

import com.initialone.jgiv.config.GivConfig;
import com.initialone.jgiv.errors.ConfigException;
import okhttp3.OkHttpClient;

import java.util.Locale;
import java.util.Map;

/** Picks and configures a {@link SummarizationClient} from flags, config and environment. */
public final class SummarizationClients {
    static final int DEFAULT_MAX_TOKENS = 8192;

    private SummarizationClients() {}

    public static SummarizationClient create(LlmOptions opts, GivConfig cfg, double defaultTemperature) {
        return create(opts, cfg, defaultTemperature, System.getenv(),
                OpenAiCompatClient.newHttpClient(opts.timeoutSec));
    }

    static SummarizationClient create(LlmOptions opts, GivConfig cfg, double defaultTemperature,
                                      Map<String, String> env, OkHttpClient http) {
        String provider = first(opts.provider, cfg.get(GivConfig.API_PROVIDER).orElse(null), "openai")
                .toLowerCase(Locale.ROOT);
        double temperature = cfg.getDouble(GivConfig.TEMPERATURE).orElse(defaultTemperature);
        int maxTokens = opts.maxTokens != null ? opts.maxTokens
                : cfg.getInt(GivConfig.MAX_TOKENS).orElse(DEFAULT_MAX_TOKENS);
        String cfgUrl = cfg.get(GivConfig.API_URL).orElse(null);
        String cfgModel = cfg.get(GivConfig.API_MODEL).orElse(null);
        String cfgKey = cfg.get(GivConfig.API_KEY).orElse(null);

        switch (provider) {
            case "openai": {
                String key = first(opts.apiKey, cfgKey, env.get("OPENAI_API_KEY"));
                if (key == null) throw missingKey("OPENAI_API_KEY");
                String base = first(opts.endpoint, cfgUrl, env.get("OPENAI_BASE_URL"), "https://api.openai.com");
                return new OpenAiCompatClient(http, base, key, first(opts.model, cfgModel, "gpt-4o-mini"),
                        temperature, maxTokens);
            }
            case "deepseek": {
                String key = first(opts.apiKey, cfgKey, env.get("DEEPSEEK_API_KEY"));
                if (key == null) throw missingKey("DEEPSEEK_API_KEY");
                String base = first(opts.endpoint, cfgUrl, env.get("DEEPSEEK_BASE_URL"), "https://api.deepseek.com/v1");
                return new OpenAiCompatClient(http, base, key, first(opts.model, cfgModel, "deepseek-chat"),
                        temperature, maxTokens);
            }
            case "local": {
                String api = first(opts.localApi, "openai").toLowerCase(Locale.ROOT);
                String model = first(opts.model, cfgModel, "qwen2.5:7b");
                if ("ollama".equals(api)) {
                    String base = first(opts.endpoint, cfgUrl, "http://localhost:11434");
                    return new OllamaClient(http, base, model, temperature, maxTokens);
                }
                if (!"openai".equals(api)) {
                    throw new ConfigException("unsupported --local-api '" + opts.localApi + "' (expected openai | ollama)");
                }
                String key = first(opts.apiKey, cfgKey, env.get("LOCAL_LLM_API_KEY"));
                String base = first(opts.endpoint, cfgUrl, "http://localhost:1234");
                return new OpenAiCompatClient(http, base, key, model, temperature, maxTokens);
            }
            default:
                throw new ConfigException("unknown provider '" + provider + "' (expected openai | deepseek | local)");
        }
    }

    private static ConfigException missingKey(String envName) {
        return new ConfigException("API key missing: pass --api-key, set api.key in .giv/config, or export " + envName);
    }

    private static String first(String... candidates) {
        for (String c : candidates) {
            if (c != null && !c.isBlank()) return c;
        }
        return null;
    }
}
