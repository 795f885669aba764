package vantage.assist.orchestrator;

import vantage.assist.guidance.SuggestedActions;
import vantage.assist.guidance.ToolGuidance;

import java.util.List;

public class PromptBuilder {
    static final String PREAMBLE =
            "You are a knowledgeable instructor and technical expert specializing in IT, computer systems, and networking. "
            + "You are helping a user inside the Vantage dashboard, which offers WHOIS, DNS records, IP Geolocation, "
            + "Port Scan, Speed Test, and a combined Domain Research tool. "
            + "Explain the 'why' and 'how' behind technical topics, keep advice actionable, "
            + "and offer practice questions when helpful. "
            + "If a question is unrelated to IT or networking, politely state your scope.";

    static final String INSTRUCTION = "Respond concisely with 2-4 sentences.";

    public String build(PromptVariant variant, String question, ToolGuidance guidance, AssistantContext context) {
        if (variant == PromptVariant.TOOL_SPECIFIC && guidance != null) {
            return toolPrompt(question, guidance, context);
        }
        return generalPrompt(question, context);
    }

    public String toolPrompt(String question, ToolGuidance guidance, AssistantContext context) {
        StringBuilder prompt = new StringBuilder(PREAMBLE).append("\n\n");
        prompt.append("Selected tool: ").append(guidance.name()).append('\n');
        prompt.append("Description: ").append(guidance.description()).append('\n');
        prompt.append("Usage tips:\n").append(bullets(guidance.usage())).append('\n');
        prompt.append("Example call: ").append(guidance.example()).append('\n');
        prompt.append("Suggested actions:\n").append(bullets(SuggestedActions.forTool(guidance))).append('\n');
        prompt.append(contextBlock(context)).append("\n\n");
        prompt.append("User question: ").append(question).append('\n');
        prompt.append(INSTRUCTION);
        return prompt.toString();
    }

    public String generalPrompt(String question, AssistantContext context) {
        return PREAMBLE + "\n\n"
                + contextBlock(context) + "\n"
                + "User question: " + question + "\n"
                + INSTRUCTION;
    }

    private static String contextBlock(AssistantContext context) {
        String line = AssistantContext.orEmpty(context).contextLine();
        return line.isEmpty() ? "" : "\nRecent context: " + line;
    }

    private static String bullets(List<String> items) {
        StringBuilder out = new StringBuilder();
        for (String item : items) {
            if (out.length() > 0) {
                out.append('\n');
            }
            out.append("- ").append(item);
        }
        return out.toString();
    }
}
