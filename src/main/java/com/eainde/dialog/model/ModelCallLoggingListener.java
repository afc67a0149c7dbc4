package com.eainde.dialog.model;

import dev.langchain4j.model.chat.listener.ChatModelErrorContext;
import dev.langchain4j.model.chat.listener.ChatModelListener;
import dev.langchain4j.model.chat.listener.ChatModelRequestContext;
import dev.langchain4j.model.chat.listener.ChatModelResponseContext;
import dev.langchain4j.model.output.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ModelCallLoggingListener implements ChatModelListener {

    private static final Logger log = LoggerFactory.getLogger(ModelCallLoggingListener.class);

    private static final String START_TIME = "startTime";

    @Override
    public void onRequest(ChatModelRequestContext requestContext) {
        log.info("Sending request to model: {} messages, {} tools",
                requestContext.chatRequest().messages().size(),
                requestContext.chatRequest().toolSpecifications() == null
                        ? 0 : requestContext.chatRequest().toolSpecifications().size());
        requestContext.attributes().put(START_TIME, System.currentTimeMillis());
    }

    @Override
    public void onResponse(ChatModelResponseContext responseContext) {
        Object startTime = responseContext.attributes().get(START_TIME);
        long duration = startTime instanceof Long start ? System.currentTimeMillis() - start : -1;

        TokenUsage usage = responseContext.chatResponse().tokenUsage();
        if (usage == null) {
            log.info("Model responded in {}ms", duration);
            return;
        }
        log.info("Model responded in {}ms. Token usage - Input: {}, Output: {}, Total: {}",
                duration,
                usage.inputTokenCount(),
                usage.outputTokenCount(),
                usage.totalTokenCount());
    }

    @Override
    public void onError(ChatModelErrorContext errorContext) {
        log.warn("Model call failed: {}", errorContext.error().getMessage());
    }
}
