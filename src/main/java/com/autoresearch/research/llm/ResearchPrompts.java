package com.autoresearch.research.llm;

public final class ResearchPrompts {

    private ResearchPrompts() {
    }

    public static final String PURPOSE_SUB_TOPICS = "sub-topics";
    public static final String PURPOSE_SUB_TOPICS_RETRY = "sub-topics-retry";
    public static final String PURPOSE_CLAIM = "claim";
    public static final String PURPOSE_CLAIM_RETRY = "claim-retry";
    public static final String PURPOSE_DRAFT = "draft";
    public static final String PURPOSE_DRAFT_RETRY = "draft-retry";
    public static final String PURPOSE_EDIT = "edit";

    public static final String SUB_TOPICS_SYSTEM_PROMPT = """
            You are a research planner. Break a research question into the distinct sub-topics a thorough
            answer must cover. Return ONLY a JSON array of 3 to 5 objects, each with a short "label" and a
            "keywords" array of 2 to 4 search keywords. No prose, no code fences.
            """;

    public static final String SUB_TOPICS_RETRY_SYSTEM_PROMPT = """
            List 3 short sub-topics of the question as a JSON array of strings. Output the array only.
            """;

    public static final String CLAIM_SYSTEM_PROMPT = """
            You are a fact checker. Using ONLY the numbered source excerpts, state in one or two sentences what
            the sources jointly support about the sub-topic. Do not add facts that are not in the excerpts.
            Do not mention source numbers.
            """;

    public static final String CLAIM_RETRY_SYSTEM_PROMPT = """
            Summarize the excerpts in one sentence about the sub-topic.
            """;

    public static final String DRAFT_SYSTEM_PROMPT = """
            You are a research writer. Write a clear, well-structured report answering the question using only
            the verified findings and sources provided. Cite sources inline as [n] using their numbers.
            """;

    public static final String DRAFT_RETRY_SYSTEM_PROMPT = """
            Write a short report answering the question from the findings. Cite sources as [n].
            """;

    public static final String EDIT_SYSTEM_PROMPT = """
            You are an editor. Improve clarity, flow and concision of the report without changing its facts or
            its [n] citation markers. Return only the edited report.
            """;
}
