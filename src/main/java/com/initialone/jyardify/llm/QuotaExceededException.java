package com.initialone.jyardify.llm;

/** Account quota, daily request cap or persistent rate limiting; retrying right away will not help. */
public class QuotaExceededException extends GenerationException {
    public QuotaExceededException(String message) {
        super(message);
    }
}
