package vantage.assist.orchestrator;

public enum PromptVariant {
    /** Includes the resolved tool's description, tips and example. Same as GENERAL when no tool resolved. */
    TOOL_SPECIFIC,
    GENERAL
}
