package com.flamingo.ai.nexuschat.agent;

import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/** AI agent that summarises text extracted from an upload and lists its key points. */
public interface TextAnalysisAgent {

  @UserMessage("""
        Summarize and extract key points:

        {{content}}
        """)
  String analyze(@V("content") String content);
}
