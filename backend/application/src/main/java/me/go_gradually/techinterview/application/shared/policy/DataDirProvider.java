package me.go_gradually.techinterview.application.shared.policy;

public interface DataDirProvider {
    String getDataDir();
}
