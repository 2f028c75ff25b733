package com.initialone.jyardify.llm;

/** The provider could not produce a response (HTTP error after retries, timeout, bad payload). */
public class GenerationException extends Exception {
    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
