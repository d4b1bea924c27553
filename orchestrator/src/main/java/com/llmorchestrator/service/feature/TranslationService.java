package com.llmorchestrator.service.feature;

import com.llmorchestrator.model.Message;
import com.llmorchestrator.model.TranslationResult;
import com.llmorchestrator.model.options.ChatOptions;
import com.llmorchestrator.model.options.TranslationOptions;
import com.llmorchestrator.service.LlmServiceManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Translation through chat completions, with language detection and quality scoring.
 */
@Slf4j
@RequiredArgsConstructor
public class TranslationService {

    static final double DEFAULT_TEMPERATURE = 0.3;
    static final int DEFAULT_MAX_TOKENS = 2000;

    private static final Pattern LANGUAGE_CODE = Pattern.compile("^[a-z]{2}(-[A-Z]{2})?$");
    private static final Pattern DETECTED_CODE = Pattern.compile("^[a-z]{2}$");

    private static final Map<String, String> LANGUAGE_NAMES = Map.ofEntries(
            Map.entry("en", "English"),
            Map.entry("de", "German"),
            Map.entry("fr", "French"),
            Map.entry("es", "Spanish"),
            Map.entry("it", "Italian"),
            Map.entry("pt", "Portuguese"),
            Map.entry("nl", "Dutch"),
            Map.entry("pl", "Polish"),
            Map.entry("ru", "Russian"),
            Map.entry("ja", "Japanese"),
            Map.entry("zh", "Chinese"),
            Map.entry("ko", "Korean"),
            Map.entry("ar", "Arabic"));

    private final LlmServiceManager llmManager;

    /**
     * Translates the text. Without a source language it is detected first.
     */
    public Mono<TranslationResult> translate(String text, String targetLanguage, String sourceLanguage,
                                             TranslationOptions options) {
        if (text == null || text.isEmpty()) {
            return Mono.error(new IllegalArgumentException("Text cannot be empty"));
        }
        TranslationOptions resolved = options != null ? options : TranslationOptions.defaults();
        try {
            validateLanguageCode(targetLanguage);
            if (sourceLanguage != null) {
                validateLanguageCode(sourceLanguage);
            }
        } catch (IllegalArgumentException e) {
            return Mono.error(e);
        }
        Mono<String> source = sourceLanguage != null
                ? Mono.just(sourceLanguage)
                : detectLanguage(text, resolved.getProvider());
        return source.flatMap(from -> {
            List<Message> messages = List.of(
                    Message.system(buildSystemPrompt(from, targetLanguage, resolved)),
                    Message.user("Translate this text:\n\n" + text));
            ChatOptions chat = ChatOptions.builder()
                    .provider(resolved.getProvider())
                    .model(resolved.getModel())
                    .temperature(resolved.getTemperature() != null ? resolved.getTemperature() : DEFAULT_TEMPERATURE)
                    .maxTokens(resolved.getMaxTokens() != null ? resolved.getMaxTokens() : DEFAULT_MAX_TOKENS)
                    .build();
            return llmManager.chat(messages, chat)
                    .map(response -> TranslationResult.builder()
                            .translation(response.getContent())
                            .sourceLanguage(from)
                            .targetLanguage(targetLanguage)
                            .confidence(TranslationResult.confidenceFor(response.getFinishReason()))
                            .usage(response.getUsage())
                            .build());
        });
    }

    public Flux<TranslationResult> translateBatch(List<String> texts, String targetLanguage, String sourceLanguage,
                                                  TranslationOptions options) {
        return Flux.fromIterable(texts).concatMap(text -> translate(text, targetLanguage, sourceLanguage, options));
    }

    /**
     * ISO 639-1 code of the text's language; {@code en} when the model does not answer with one.
     */
    public Mono<String> detectLanguage(String text, String provider) {
        List<Message> messages = List.of(
                Message.system("You are a language detection expert. Respond with ONLY the ISO 639-1 language code "
                        + "(e.g., \"en\", \"de\", \"fr\"). No explanation."),
                Message.user("Detect the language of this text:\n\n" + text));
        ChatOptions chat = ChatOptions.builder().provider(provider).temperature(0.1).maxTokens(10).build();
        return llmManager.chat(messages, chat).map(response -> {
            String code = response.getContent().trim().toLowerCase(Locale.ROOT);
            if (!DETECTED_CODE.matcher(code).matches()) {
                log.debug("Language detection answered '{}', falling back to en", code);
                return "en";
            }
            return code;
        });
    }

    /**
     * Model-judged quality of a translation in [0, 1]. An unparseable answer scores 0.
     */
    public Mono<Double> scoreTranslationQuality(String sourceText, String translatedText, String targetLanguage,
                                                String provider) {
        List<Message> messages = List.of(
                Message.system("You are a translation quality expert. Evaluate the translation quality based on "
                        + "accuracy, fluency, and consistency. Respond with ONLY a number between 0.0 and 1.0 "
                        + "(e.g., \"0.85\"). No explanation."),
                Message.user(String.format("Source text:\n%s\n\nTranslation to %s:\n%s\n\nQuality score:",
                        sourceText, targetLanguage, translatedText)));
        ChatOptions chat = ChatOptions.builder().provider(provider).temperature(0.1).maxTokens(10).build();
        return llmManager.chat(messages, chat).map(response -> {
            double score;
            try {
                score = Double.parseDouble(response.getContent().trim());
            } catch (NumberFormatException e) {
                log.debug("Quality score answer '{}' is not a number", response.getContent());
                score = 0.0;
            }
            return Math.max(0.0, Math.min(1.0, score));
        });
    }

    String buildSystemPrompt(String sourceLanguage, String targetLanguage, TranslationOptions options) {
        String domain = options.getDomain() != null ? options.getDomain() : "general";
        StringBuilder prompt = new StringBuilder(String.format(
                "You are a professional %s translator. Translate the following text from %s to %s.\n",
                domain, languageName(sourceLanguage), languageName(targetLanguage)));
        if (options.getFormality() != null && !"default".equals(options.getFormality())) {
            prompt.append(String.format("Maintain %s tone.\n", options.getFormality()));
        }
        if (options.isPreserveFormatting()) {
            prompt.append("Preserve all formatting, HTML tags, markdown, and special characters.\n");
        }
        if (!options.getGlossary().isEmpty()) {
            prompt.append("\nUse these exact term translations:\n");
            options.getGlossary().forEach((term, translation) ->
                    prompt.append(String.format("- %s -> %s\n", term, translation)));
        }
        if (options.getContext() != null && !options.getContext().isEmpty()) {
            prompt.append(String.format("\nContext (for reference only):\n%s\n", options.getContext()));
        }
        prompt.append("\nProvide ONLY the translation, no explanations or notes.");
        return prompt.toString();
    }

    static void validateLanguageCode(String code) {
        if (code == null || !LANGUAGE_CODE.matcher(code).matches()) {
            throw new IllegalArgumentException(
                    "Invalid language code format. Expected ISO 639-1 (e.g., \"en\", \"de-DE\"), got: " + code);
        }
    }

    private static String languageName(String code) {
        String base = code.length() > 2 ? code.substring(0, 2) : code;
        return LANGUAGE_NAMES.getOrDefault(base, code);
    }
}
