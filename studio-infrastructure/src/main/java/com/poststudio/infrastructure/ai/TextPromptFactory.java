package com.poststudio.infrastructure.ai;

import com.poststudio.domain.generation.model.valobj.TextGenerationOptions;
import com.poststudio.domain.generation.model.valobj.TextGenerationRequest;
import org.apache.commons.lang3.StringUtils;

/**
 * 营销文案提示词构建。
 */
public final class TextPromptFactory {

    private static final String DEFAULT_REVISION_INSTRUCTION = "Rewrite the post with fresh wording";

    private TextPromptFactory() {
    }

    public static String buildSystemPrompt(TextGenerationOptions options) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are a social media copywriter for a small organic food producer.\n");
        prompt.append("Write only in ").append(StringUtils.defaultIfBlank(options.getLanguage(), "English")).append(".\n");
        prompt.append("Tone: ").append(StringUtils.defaultIfBlank(options.getTone(), "friendly")).append(".\n");
        if (options.getMaxLength() > 0) {
            prompt.append("Maximum length: ").append(options.getMaxLength()).append(" characters.\n");
        }
        prompt.append(options.isIncludeEmoji() ? "Use fitting emoji.\n" : "Do not use emoji.\n");
        prompt.append("Do not use hashtags. Do not add a title or labels like \"Post:\"; start directly with the text.");
        return prompt.toString();
    }

    public static String buildUserPrompt(TextGenerationRequest request) {
        if (request.isRevision()) {
            String instruction = StringUtils.defaultIfBlank(request.getInstruction(), DEFAULT_REVISION_INSTRUCTION);
            return "Modify the following post according to this instruction: \"" + instruction + "\"\n\n"
                    + "Original post:\n" + request.getSeedText() + "\n\n"
                    + "Keep the language and the core message of the original.";
        }
        return "Write an engaging Facebook post about organic " + request.getSubject() + ".\n"
                + "Cover its health benefits, its natural origin, what makes it special, "
                + "and end with a call to action.";
    }
}
