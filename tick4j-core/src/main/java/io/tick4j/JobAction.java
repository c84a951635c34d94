package io.tick4j;

@FunctionalInterface
public interface JobAction {

    void run() throws Exception;
}
