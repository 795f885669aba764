package vantage.assist.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vantage.assist.cache.CacheKey;
import vantage.assist.cache.ResponseCache;
import vantage.assist.guidance.GuidanceCatalog;
import vantage.assist.guidance.ToolGuidance;
import vantage.assist.guidance.ToolResolver;
import vantage.assist.llm.ProviderClient;

import java.util.List;
import java.util.Optional;

public class FallbackOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(FallbackOrchestrator.class);

    public static final List<PromptVariant> DEFAULT_PROMPT_SEQUENCE = List.of(
            PromptVariant.TOOL_SPECIFIC,
            PromptVariant.GENERAL,
            PromptVariant.TOOL_SPECIFIC
    );

    static final String INTRO_QUESTION =
            "Briefly introduce how you can help with IT, systems, and networking questions.";

    private final GuidanceCatalog catalog;
    private final ToolResolver toolResolver;
    private final ResponseCache cache;
    private final List<ProviderClient> providers;
    private final PromptBuilder promptBuilder;
    private final AnswerAssembler assembler;
    private final List<PromptVariant> promptSequence;

    public FallbackOrchestrator(
            GuidanceCatalog catalog,
            ToolResolver toolResolver,
            ResponseCache cache,
            List<ProviderClient> providers
    ) {
        this(catalog, toolResolver, cache, providers, new PromptBuilder(), new AnswerAssembler(catalog),
                DEFAULT_PROMPT_SEQUENCE);
    }

    public FallbackOrchestrator(
            GuidanceCatalog catalog,
            ToolResolver toolResolver,
            ResponseCache cache,
            List<ProviderClient> providers,
            PromptBuilder promptBuilder,
            AnswerAssembler assembler,
            List<PromptVariant> promptSequence
    ) {
        if (promptSequence.isEmpty()) {
            throw new IllegalArgumentException("prompt sequence must not be empty");
        }
        this.catalog = catalog;
        this.toolResolver = toolResolver;
        this.cache = cache;
        this.providers = List.copyOf(providers);
        this.promptBuilder = promptBuilder;
        this.assembler = assembler;
        this.promptSequence = List.copyOf(promptSequence);
    }

    public Answer answer(String question, String toolHint, AssistantContext context) {
        AssistantContext ctx = AssistantContext.orEmpty(context);
        String text = question == null ? "" : question.trim();
        if (text.isEmpty()) {
            return introduce();
        }

        ToolGuidance guidance = resolveTool(text, toolHint, ctx).orElse(null);
        String tool = guidance == null ? null : guidance.name();

        CacheKey key = CacheKey.of(tool, ctx.fingerprint(), text);
        Optional<String> cached = cache.get(key);
        if (cached.isPresent()) {
            log.debug("Cache hit tool={}", tool);
            return assembler.generated(guidance, cached.get(), ctx, Answer.PROVIDER_CACHE);
        }

        for (ProviderClient provider : providers) {
            Optional<String> generated = askProvider(provider, text, guidance, ctx);
            if (generated.isPresent()) {
                cache.set(key, generated.get());
                return assembler.generated(guidance, generated.get(), ctx, provider.name());
            }
            if (Thread.currentThread().isInterrupted()) {
                log.info("Request cancelled, skipping remaining providers");
                break;
            }
        }

        log.info("No provider answered (providers={}), using catalog guidance for tool={}", providers.size(), tool);
        return guidance == null ? assembler.unavailable() : assembler.deterministic(guidance, ctx);
    }

    public List<ProviderClient> providers() {
        return providers;
    }

    private Optional<ToolGuidance> resolveTool(String text, String toolHint, AssistantContext ctx) {
        Optional<String> resolved = toolResolver.resolve(text, toolHint);
        if (resolved.isEmpty()) {
            resolved = Optional.ofNullable(ctx.tool());
        }
        return resolved.flatMap(catalog::find);
    }

    private Optional<String> askProvider(ProviderClient provider, String text, ToolGuidance guidance,
                                         AssistantContext ctx) {
        for (PromptVariant variant : promptSequence) {
            if (!provider.isAvailable()) {
                log.debug("Provider {} circuit open, moving on", provider.name());
                return Optional.empty();
            }
            if (Thread.currentThread().isInterrupted()) {
                return Optional.empty();
            }
            String prompt = promptBuilder.build(variant, text, guidance, ctx);
            Optional<String> result = provider.complete(prompt).filter(s -> !s.isBlank());
            if (result.isPresent()) {
                return result;
            }
            log.debug("Provider {} gave no text for {} prompt", provider.name(), variant);
        }
        return Optional.empty();
    }

    private Answer introduce() {
        String prompt = promptBuilder.generalPrompt(INTRO_QUESTION, AssistantContext.EMPTY);
        for (ProviderClient provider : providers) {
            if (!provider.isAvailable()) {
                continue;
            }
            Optional<String> result = provider.complete(prompt).filter(s -> !s.isBlank());
            if (result.isPresent()) {
                return assembler.generated(null, result.get(), AssistantContext.EMPTY, provider.name());
            }
        }
        return assembler.unavailable();
    }
}
