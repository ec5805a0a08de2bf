package com.agentflow.fgc.convert.langchain;

import java.util.List;

import com.agentflow.fgc.api.Converter;

/**
 * Built-in LangChain converter catalog.
 */
public final class LangchainConverters {

    private LangchainConverters() {
        // Utility class
    }

    public static List<Converter> all() {
        return List.of(
                new LanguageModelConverter("chatOpenAI", "Chat Models", "ChatOpenAI", "@langchain/openai",
                        "langchain_openai", "langchain-openai", "OPENAI_API_KEY", "gpt-4o-mini", "chatOpenAICustom"),
                new LanguageModelConverter("openAI", "LLMs", "OpenAI", "@langchain/openai",
                        "langchain_openai", "langchain-openai", "OPENAI_API_KEY", "gpt-3.5-turbo-instruct"),
                new LanguageModelConverter("chatAnthropic", "Chat Models", "ChatAnthropic", "@langchain/anthropic",
                        "langchain_anthropic", "langchain-anthropic", "ANTHROPIC_API_KEY", "claude-3-haiku-20240307"),
                new PromptTemplateConverter(),
                new ChatPromptTemplateConverter(),
                new LlmChainConverter(),
                new ConversationChainConverter(),
                BufferMemoryConverter.buffer(),
                BufferMemoryConverter.window(),
                new SerpApiConverter());
    }
}
