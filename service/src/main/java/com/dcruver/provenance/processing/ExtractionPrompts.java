package com.dcruver.provenance.processing;

/**
 * Instruction templates for decision and assumption extraction.
 */
final class ExtractionPrompts {

    private ExtractionPrompts() {
    }

    static final String DECISION_SYSTEM_PROMPT = """
        You are an expert at identifying decisions from meeting transcripts and notes.

        A decision is a choice that was made about how to proceed with something.
        Look for patterns like:
        - "We decided to..."
        - "Let's go with..."
        - "The choice is..."
        - "We're going to..."
        - "We'll use..."
        - "The plan is..."

        For each decision found, extract:
        - what: A clear, concise statement of what was decided (the choice made)
        - why: The reasoning or justification given for the decision (if mentioned)
        - confidence: A score from 0.0 to 1.0 indicating how confident you are this is a real decision

        Be conservative - only extract clear decisions, not vague intentions or possibilities.
        If no clear decisions are found, return an empty list.
        """;

    static final String DECISION_USER_PROMPT = """
        Analyze the following text and extract any decisions made.

        TEXT:
        %s

        Respond with a JSON object containing a "decisions" array. Each decision should have:
        - "what": string (the decision made)
        - "why": string (the reasoning, or empty string if not stated)
        - "confidence": number between 0.0 and 1.0

        Example response:
        {"decisions": [{"what": "Use PostgreSQL", "why": "JSON support", "confidence": 0.9}]}

        If no decisions are found, respond with: {"decisions": []}
        """;

    static final String ASSUMPTION_SYSTEM_PROMPT = """
        You are an expert at identifying assumptions from meeting transcripts and notes.

        Assumptions include:
        - Explicit constraints mentioned ("We're assuming the API is stable")
        - Implicit beliefs underlying decisions ("Using React implies a modern browser")
        - Dependencies on external factors ("This works if the server is online")
        - Unstated prerequisites for plans to work

        For each assumption found, extract:
        - statement: A clear statement of what is being assumed
        - explicit: true if the assumption was stated directly, false if it was implied

        Be thorough - look for both stated and unstated assumptions.
        If no assumptions are found, return an empty list.
        """;

    static final String ASSUMPTION_USER_PROMPT = """
        Analyze the following text and extract any assumptions being made.

        TEXT:
        %s

        Respond with a JSON object containing an "assumptions" array. Each assumption should have:
        - "statement": string (what is being assumed)
        - "explicit": boolean (true if stated directly, false if implied)

        Example response:
        {"assumptions": [{"statement": "The API will remain stable", "explicit": true}]}

        If no assumptions are found, respond with: {"assumptions": []}
        """;

    static String decisionPrompt(String content) {
        return String.format(DECISION_USER_PROMPT, content);
    }

    static String assumptionPrompt(String content) {
        return String.format(ASSUMPTION_USER_PROMPT, content);
    }
}
