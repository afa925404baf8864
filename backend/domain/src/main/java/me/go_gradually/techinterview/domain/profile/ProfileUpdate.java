package me.go_gradually.techinterview.domain.profile;

public record ProfileUpdate(boolean applied, boolean topicNewlyFailed, boolean topicNewlyStrong) {
    public static ProfileUpdate skipped() {
        return new ProfileUpdate(false, false, false);
    }
}
