package com.phillippitts.speakermatch.service.scoring;

import com.phillippitts.speakermatch.config.properties.MatchingProperties;
import com.phillippitts.speakermatch.domain.MatchQuery;
import com.phillippitts.speakermatch.domain.SpeakerRecord;
import com.phillippitts.speakermatch.util.LogSanitizer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Builds the per-speaker evaluation prompt.
 *
 * <p>The rubric weights and score bands are fixed and the biography is cut to a fixed number of
 * characters, so identical (query, speaker) pairs always produce identical prompts.
 */
@Component
public class ScoringPromptBuilder {

    private static final String MISSING = "N/A";

    private static final String RUBRIC = String.join("\n",
            "EVALUATION CRITERIA (ALL must be considered):",
            "",
            "1. DIRECT RELEVANCE (40% weight)",
            "   - Does their work DIRECTLY relate to the user's specific product/service?",
            "   - Is there clear overlap in technology, mission, or market?",
            "   - Would they immediately understand the value proposition?",
            "",
            "2. DECISION-MAKING POWER (30% weight)",
            "   - Can they influence purchasing decisions?",
            "   - Do they control budget or procurement?",
            "   - Are they a key stakeholder in relevant programs?",
            "",
            "3. ACTIONABLE OPPORTUNITY (20% weight)",
            "   - Is there a concrete business outcome possible (sale, partnership, introduction)?",
            "   - Can this conversation lead to a specific next step?",
            "   - Is the timing right for engagement?",
            "",
            "4. MUTUAL BENEFIT (10% weight)",
            "   - Is there value for both parties?",
            "   - Does the user have something they need?",
            "",
            "SCORING RULES (be conservative):",
            "- 9-10: EXCEPTIONAL - Direct decision-maker with immediate need for user's offering. "
                    + "Clear path to business outcome.",
            "- 7-8: STRONG - Highly relevant expertise and influence. Likely to lead to concrete opportunity.",
            "- 5-6: MODERATE - Some relevance but indirect. May be useful for information/networking only.",
            "- 3-4: WEAK - Tangential connection. Low probability of business value.",
            "- 0-2: POOR - No meaningful connection. Not worth the conversation time.",
            "",
            "BE STRICT: Only give 9-10 if there's EXCEPTIONAL alignment. Most matches should be 5-7.",
            "",
            "Return ONLY a JSON object:",
            "{",
            "  \"score\": <number 0-10>,",
            "  \"reasoning\": \"<2-3 sentences explaining the score based on criteria above>\"",
            "}"
    );

    private final int bioTruncationChars;

    @Autowired
    public ScoringPromptBuilder(MatchingProperties properties) {
        this(properties.getBioTruncationChars());
    }

    public ScoringPromptBuilder(int bioTruncationChars) {
        if (bioTruncationChars <= 0) {
            throw new IllegalArgumentException("bioTruncationChars must be positive");
        }
        this.bioTruncationChars = bioTruncationChars;
    }

    public String build(MatchQuery query, SpeakerRecord speaker) {
        StringBuilder sb = new StringBuilder(2048);
        sb.append("You are a strategic business advisor evaluating conference networking opportunities. ")
                .append("Be STRICT and SELECTIVE.\n\n");
        sb.append("USER'S BUSINESS/GOALS:\n").append(query.text()).append("\n\n");
        sb.append("SPEAKER:\n");
        sb.append("Name: ").append(orMissing(speaker.name())).append('\n');
        sb.append("Title: ").append(orMissing(speaker.title())).append('\n');
        sb.append("Organization: ").append(orMissing(speaker.organization())).append('\n');
        sb.append("Bio: ").append(orMissing(LogSanitizer.truncate(speaker.bio(), bioTruncationChars))).append("\n\n");
        sb.append(RUBRIC);
        return sb.toString();
    }

    public int getBioTruncationChars() {
        return bioTruncationChars;
    }

    private static String orMissing(String value) {
        return value == null || value.isBlank() ? MISSING : value;
    }
}
