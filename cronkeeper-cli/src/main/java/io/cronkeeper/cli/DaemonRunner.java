package io.cronkeeper.cli;

@FunctionalInterface
public interface DaemonRunner {
    int run() throws Exception;
}
