package me.go_gradually.techinterview.domain.interview;

import me.go_gradually.techinterview.domain.util.TextUtils;

import java.util.Map;

/**
 * Canned questions used whenever the oracle gives no usable next question.
 */
public final class FallbackQuestions {
    private static final Map<TopicArea, String> BRIDGES = Map.of(
            TopicArea.TECHNICAL_BASICS, "Let's change direction. Which core tools of your stack do you know best, and how do they work under the hood?",
            TopicArea.PRACTICAL_EXPERIENCE, "Let's change direction. Walk me through a recent project you are proud of and your part in it.",
            TopicArea.PROBLEM_SOLVING, "Let's change direction. How would you approach a problem you have never seen before? Take a recent example.",
            TopicArea.SYSTEM_DESIGN, "Let's change direction. How would you design a service that has to handle a sudden tenfold growth in traffic?",
            TopicArea.SOFT_SKILLS, "Let's change direction. Tell me about a disagreement in your team and how it was resolved."
    );

    private FallbackQuestions() {
    }

    public static String forPhase(InterviewPhase phase, String candidateName, String industry) {
        return switch (phase) {
            case EXPLORATION -> "Please tell me about your experience with the technologies used in "
                    + (TextUtils.isBlank(industry) ? "your industry" : industry.trim()) + ".";
            case VALIDATION -> "Give me a concrete example of a project where you applied the technologies you mentioned.";
            case STRESS_TEST -> "How would you approach optimizing performance in a system under heavy load?";
            case SOFT_SKILLS -> "Tell me about a time you had to work with a team on a complex project.";
            case WRAP_UP -> "Thank you for the interview" + namePart(candidateName) + "! Do you have any questions about the position?";
            case FINISHED -> closing(candidateName);
        };
    }

    public static TopicArea topicForPhase(InterviewPhase phase) {
        return switch (phase) {
            case EXPLORATION -> TopicArea.GENERAL_BACKGROUND;
            case VALIDATION -> TopicArea.PRACTICAL_EXPERIENCE;
            case STRESS_TEST -> TopicArea.SYSTEM_DESIGN;
            case SOFT_SKILLS -> TopicArea.SOFT_SKILLS;
            case WRAP_UP, FINISHED -> TopicArea.GENERAL;
        };
    }

    public static String bridgeTo(TopicArea area) {
        String bridge = BRIDGES.get(area);
        if (bridge != null) {
            return bridge;
        }
        return "Let's change direction and talk about " + area.value().replace('_', ' ')
                + ". What is your hands-on experience there?";
    }

    public static String closing(String candidateName) {
        return "Thank you for your time" + namePart(candidateName) + ". This concludes our interview.";
    }

    private static String namePart(String candidateName) {
        return TextUtils.isBlank(candidateName) ? "" : ", " + candidateName.trim();
    }
}
