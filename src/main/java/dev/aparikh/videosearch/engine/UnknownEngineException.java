package dev.aparikh.videosearch.engine;

/**
 * No source is registered under the requested name.
 */
public class UnknownEngineException extends RuntimeException {

    private final String name;

    public UnknownEngineException(String name) {
        super("Unknown engine: " + name);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
