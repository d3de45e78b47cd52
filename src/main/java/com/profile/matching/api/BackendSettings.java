package com.profile.matching.api;

import com.profile.matching.llm.HuggingFaceReasonBackend;
import com.profile.matching.llm.OllamaReasonBackend;

import java.time.Duration;
import java.util.Map;

/**
 * Connection settings for the reason backends.
 *
 * @param ollamaHost   base URL of the local Ollama server
 * @param ollamaModel  Ollama model name
 * @param hfApiToken   Hugging Face API token, blank when not configured
 * @param hfModel      Hugging Face model id
 */
public record BackendSettings(
        String ollamaHost,
        String ollamaModel,
        String hfApiToken,
        String hfModel
) {
    public static final String DEFAULT_OLLAMA_HOST = "http://localhost:11434";
    public static final String DEFAULT_OLLAMA_MODEL = "mistral";
    public static final String DEFAULT_HF_MODEL = "mistralai/Mistral-7B-Instruct-v0.2";

    public BackendSettings {
        ollamaHost = ollamaHost != null && !ollamaHost.isBlank() ? ollamaHost : DEFAULT_OLLAMA_HOST;
        ollamaModel = ollamaModel != null && !ollamaModel.isBlank() ? ollamaModel : DEFAULT_OLLAMA_MODEL;
        hfApiToken = hfApiToken != null ? hfApiToken : "";
        hfModel = hfModel != null && !hfModel.isBlank() ? hfModel : DEFAULT_HF_MODEL;
    }

    public static BackendSettings defaults() {
        return new BackendSettings(null, null, null, null);
    }

    /**
     * Reads {@code OLLAMA_HOST}, {@code OLLAMA_MODEL}, {@code HF_API_TOKEN} and {@code HF_MODEL}.
     */
    public static BackendSettings fromEnvironment(Map<String, String> env) {
        return new BackendSettings(env.get("OLLAMA_HOST"), env.get("OLLAMA_MODEL"),
                env.get("HF_API_TOKEN"), env.get("HF_MODEL"));
    }

    public OllamaReasonBackend createPrimary(Duration timeout) {
        return OllamaReasonBackend.builder()
                .baseUrl(ollamaHost)
                .model(ollamaModel)
                .timeout(timeout)
                .build();
    }

    public HuggingFaceReasonBackend createSecondary(Duration timeout) {
        return HuggingFaceReasonBackend.builder()
                .model(hfModel)
                .apiToken(hfApiToken)
                .timeout(timeout)
                .build();
    }

    @Override
    public String toString() {
        return "BackendSettings{ollamaHost=" + ollamaHost + ", ollamaModel=" + ollamaModel
                + ", hfApiToken=" + (hfApiToken.isBlank() ? "<unset>" : "<set>") + ", hfModel=" + hfModel + "}";
    }
}
