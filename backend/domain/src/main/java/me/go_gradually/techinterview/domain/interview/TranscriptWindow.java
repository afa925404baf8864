package me.go_gradually.techinterview.domain.interview;

/**
 * How much of the transcript is shown to the oracle.
 *
 * @param recentExchanges number of latest question/answer pairs included
 * @param answerCharCap   longer answers are cut and marked with an ellipsis
 */
public record TranscriptWindow(int recentExchanges, int answerCharCap) {
    public TranscriptWindow {
        if (recentExchanges < 0 || answerCharCap < 1) {
            throw new IllegalArgumentException("Transcript window must be non-negative with a positive char cap");
        }
    }

    public static TranscriptWindow defaults() {
        return new TranscriptWindow(3, 200);
    }
}
