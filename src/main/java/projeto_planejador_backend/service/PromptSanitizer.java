package projeto_planejador_backend.service;

import org.springframework.stereotype.Service;

@Service
public class PromptSanitizer {

    public String sanitizeForPrompt(String content) {
        if (content == null) {
            return "";
        }

        return content
                .replace("\r\n", "\n")
                .replace("\r", "\n")
                .replace("\t", " ")
                .replaceAll("[ \t]+", " ")
                .replaceAll("\n{3,}", "\n\n")
                .trim();
    }

    /**
     * Drops markdown code fences and any prose around the outermost JSON object of a model reply.
     * Returns the trimmed input unchanged when no object is found.
     */
    public String extractJsonObject(String reply) {
        if (reply == null) {
            return "";
        }
        String trimmed = reply.trim();
        if (trimmed.startsWith("```")) {
            int firstLineEnd = trimmed.indexOf('\n');
            trimmed = firstLineEnd == -1 ? "" : trimmed.substring(firstLineEnd + 1);
            if (trimmed.endsWith("```")) {
                trimmed = trimmed.substring(0, trimmed.length() - 3);
            }
            trimmed = trimmed.trim();
        }
        int start = trimmed.indexOf('{');
        int end = trimmed.lastIndexOf('}');
        if (start == -1 || end <= start) {
            return trimmed;
        }
        return trimmed.substring(start, end + 1);
    }
}
