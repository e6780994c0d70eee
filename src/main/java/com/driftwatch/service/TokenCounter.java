package com.driftwatch.service;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Counts response tokens with the GPT-2 pre-tokenization pattern.
 *
 * <p>One instance is shared by every component that measures LLM output. Holders call
 * {@link #acquire()} when they start and {@link #release()} when they stop; the compiled
 * pattern is dropped once the last holder releases and rebuilt on the next use.
 */
@Slf4j
public class TokenCounter {

    static final String GPT2_PATTERN =
        "'s|'t|'re|'ve|'m|'ll|'d| ?\\p{L}+| ?\\p{N}+| ?[^\\s\\p{L}\\p{N}]+|\\s+(?!\\S)|\\s+";

    private final ReentrantLock lock = new ReentrantLock();
    private volatile Pattern pattern;
    private int holders;

    public TokenCounter acquire() {
        lock.lock();
        try {
            holders++;
            initialise();
        } finally {
            lock.unlock();
        }
        return this;
    }

    public void release() {
        lock.lock();
        try {
            if (holders == 0) {
                return;
            }
            holders--;
            if (holders == 0) {
                pattern = null;
                log.info("Token counter released");
            }
        } finally {
            lock.unlock();
        }
    }

    public int holders() {
        lock.lock();
        try {
            return holders;
        } finally {
            lock.unlock();
        }
    }

    public boolean isInitialised() {
        return pattern != null;
    }

    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        Pattern compiled = pattern;
        if (compiled == null) {
            lock.lock();
            try {
                initialise();
                compiled = pattern;
            } finally {
                lock.unlock();
            }
        }
        Matcher matcher = compiled.matcher(text);
        int tokens = 0;
        while (matcher.find()) {
            tokens++;
        }
        return tokens;
    }

    private void initialise() {
        if (pattern == null) {
            pattern = Pattern.compile(GPT2_PATTERN, Pattern.UNICODE_CHARACTER_CLASS);
            log.info("Token counter initialised | holders={}", holders);
        }
    }
}
