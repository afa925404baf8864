package me.go_gradually.techinterview.application.interview.model;

public record InterviewStatusView(String sessionId,
                                  String candidateName,
                                  String phase,
                                  String currentQuestion,
                                  String currentArea,
                                  String currentDifficulty,
                                  int totalAnswers,
                                  double elapsedMinutes,
                                  double remainingMinutes,
                                  String timeStatus,
                                  String technicalLevel,
                                  boolean completed,
                                  boolean shouldEnd) {
}
