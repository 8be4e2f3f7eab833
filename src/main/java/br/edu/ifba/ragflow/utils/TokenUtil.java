package br.edu.ifba.ragflow.utils;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;
import com.knuddels.jtokkit.api.IntArrayList;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Token counting for context budgets.
 * Uses jtokkit's cl100k_base encoding and falls back to a character approximation
 * when the encoding cannot be loaded.
 */
public final class TokenUtil {

    private static final Logger logger = LoggerFactory.getLogger(TokenUtil.class);

    /**
     * Average of ~4 characters per token for English text.
     */
    private static final double AVG_CHARS_PER_TOKEN = 4.0;

    private static final String ELLIPSIS = "...";

    private static volatile Encoding encoding;
    private static volatile boolean initializationFailed = false;

    private TokenUtil() {
        throw new UnsupportedOperationException("Utility class");
    }

    @Nullable
    private static Encoding getEncoding() {
        if (encoding == null && !initializationFailed) {
            synchronized (TokenUtil.class) {
                if (encoding == null && !initializationFailed) {
                    try {
                        EncodingRegistry registry = Encodings.newDefaultEncodingRegistry();
                        encoding = registry.getEncoding(EncodingType.CL100K_BASE);
                        logger.info("Initialized jtokkit with cl100k_base encoding");
                    } catch (RuntimeException e) {
                        initializationFailed = true;
                        logger.warn("Failed to initialize jtokkit, falling back to approximation: {}", e.getMessage());
                    }
                }
            }
        }
        return encoding;
    }

    /**
     * Counts the tokens of a text, exactly when jtokkit is available.
     */
    public static int estimateTokens(@Nullable String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        Encoding enc = getEncoding();
        if (enc != null) {
            return enc.countTokens(text);
        }
        return (int) Math.ceil(text.length() / AVG_CHARS_PER_TOKEN);
    }

    /**
     * Checks if adding more content would exceed the budget.
     */
    public static boolean wouldExceedBudget(int currentTokens, @NotNull String additionalText, int maxTokens) {
        return currentTokens + estimateTokens(additionalText) > maxTokens;
    }

    /**
     * Truncates a text to at most {@code maxTokens} tokens, marking the cut with an ellipsis.
     *
     * @param text the text to truncate
     * @param maxTokens maximum tokens allowed
     * @return the text itself when it fits, otherwise its truncated prefix
     */
    @NotNull
    public static String truncateToTokenLimit(@NotNull String text, int maxTokens) {
        if (maxTokens <= 0) {
            return "";
        }
        if (estimateTokens(text) <= maxTokens) {
            return text;
        }

        Encoding enc = getEncoding();
        if (enc != null) {
            IntArrayList tokens = enc.encode(text);
            int truncateAt = Math.max(0, maxTokens - 1);
            IntArrayList truncated = new IntArrayList(truncateAt);
            for (int i = 0; i < truncateAt && i < tokens.size(); i++) {
                truncated.add(tokens.get(i));
            }
            return enc.decode(truncated) + ELLIPSIS;
        }

        int targetChars = (int) (maxTokens * AVG_CHARS_PER_TOKEN);
        if (targetChars >= text.length()) {
            return text;
        }
        return text.substring(0, Math.max(0, targetChars - ELLIPSIS.length())) + ELLIPSIS;
    }
}
