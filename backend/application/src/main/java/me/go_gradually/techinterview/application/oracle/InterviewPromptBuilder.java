package me.go_gradually.techinterview.application.oracle;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.go_gradually.techinterview.domain.interview.InterviewContext;
import me.go_gradually.techinterview.domain.profile.ProfileSummary;

public class InterviewPromptBuilder {
    private final ObjectMapper objectMapper;

    public InterviewPromptBuilder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String buildSystemPrompt() {
        StringBuilder sb = new StringBuilder();
        sb.append("You are a senior technical interviewer running an adaptive interview. ");
        sb.append("Ask one question at a time, adapt difficulty to the candidate and never repeat a topic listed in avoid_topics. ");
        sb.append("Phases in order: exploration, validation, stress_test, soft_skills, wrap_up, finished. ");
        sb.append("exploration surveys background, validation checks claimed experience, stress_test probes the limits, ");
        sb.append("soft_skills covers teamwork and communication, wrap_up closes the conversation.\n");
        sb.append("Respond with a single JSON object inside a ```json block with keys: ");
        sb.append("interview_status (continuing|finished), current_phase, next_question, question_area, ");
        sb.append("question_difficulty (easy|medium|hard), previous_answer_analysis {technical_score, communication_score, ");
        sb.append("confidence_score, depth_score, practical_experience (all 0-10), red_flags [], strengths_shown [], analysis_notes}, ");
        sb.append("time_management (continue|accelerate|wrap_up|critical|finish), adaptation_needed (none|clarify|simplify|deepen), ");
        sb.append("interview_plan [], current_area, interviewer_notes.\n");
        sb.append("When opening is true there is no previous answer: leave previous_answer_analysis empty and propose the plan.");
        return sb.toString();
    }

    public String buildUserPrompt(InterviewContext context) {
        try {
            return "Interview context:\n" + objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toNode(context));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Interview context could not be serialized", e);
        }
    }

    private ObjectNode toNode(InterviewContext context) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("phase", context.phase());
        root.put("opening", context.opening());
        root.set("candidate", profileNode(context.profile()));
        root.set("time", objectMapper.valueToTree(context.time()));
        root.put("vacancy_type", context.vacancyType());
        root.set("interview_plan", objectMapper.valueToTree(context.interviewPlan()));
        root.set("covered_areas", objectMapper.valueToTree(context.coveredAreas()));
        root.set("recent_exchanges", objectMapper.valueToTree(context.recentExchanges()));
        root.set("topic_frequency", objectMapper.valueToTree(context.repetition().topicFrequency()));
        root.set("avoid_topics", objectMapper.valueToTree(context.repetition().avoidTopics()));
        root.set("recent_questions", objectMapper.valueToTree(context.repetition().recentQuestions()));
        root.set("strategy", objectMapper.valueToTree(context.strategy()));
        root.put("questions_count", context.questionsCount());
        root.put("last_question", context.lastQuestion());
        root.put("last_answer", context.lastAnswer());
        return root;
    }

    private ObjectNode profileNode(ProfileSummary profile) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("name", profile.name());
        node.put("vacancy", profile.vacancyTitle());
        node.put("industry", profile.industry());
        node.put("technical_level", profile.technicalLevel().code());
        node.put("preliminary_level", profile.preliminaryLevel().code());
        node.put("communication_style", profile.communicationStyle().code());
        node.put("total_answers", profile.totalAnswers());
        node.put("avg_technical", profile.avgTechnical());
        node.put("avg_communication", profile.avgCommunication());
        node.put("avg_confidence", profile.avgConfidence());
        node.set("confirmed_strengths", objectMapper.valueToTree(profile.confirmedStrengths()));
        node.set("confirmed_weaknesses", objectMapper.valueToTree(profile.confirmedWeaknesses()));
        node.set("red_flags", objectMapper.valueToTree(profile.redFlags()));
        node.set("learning_indicators", objectMapper.valueToTree(profile.learningIndicators()));
        node.set("hr_strengths", objectMapper.valueToTree(profile.hrStrengths()));
        node.set("priority_concerns", objectMapper.valueToTree(profile.priorityConcerns()));
        node.set("failed_topics", objectMapper.valueToTree(profile.failedTopics()));
        node.set("strong_topics", objectMapper.valueToTree(profile.strongTopics()));
        return node;
    }
}
