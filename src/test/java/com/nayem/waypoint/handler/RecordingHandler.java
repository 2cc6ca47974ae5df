package com.nayem.waypoint.handler;

import com.nayem.waypoint.core.StateObject;

import java.util.List;

/**
 * Test handler that appends {@code handle:<name>} and {@code rollback:<name>}
 * to a shared journal.
 */
public class RecordingHandler extends AbstractHandler {

    private final String name;
    private final HandlerKind kind;
    private final List<String> journal;
    private boolean failOnHandle;
    private boolean failOnRollback;
    private RuntimeException throwOnHandle;

    public RecordingHandler(String name, List<String> journal) {
        this(name, HandlerKind.CUSTOM, journal);
    }

    public RecordingHandler(String name, HandlerKind kind, List<String> journal) {
        this.name = name;
        this.kind = kind;
        this.journal = journal;
    }

    public RecordingHandler failingHandle() {
        this.failOnHandle = true;
        return this;
    }

    public RecordingHandler failingRollback() {
        this.failOnRollback = true;
        return this;
    }

    public RecordingHandler throwingOnHandle(RuntimeException e) {
        this.throwOnHandle = e;
        return this;
    }

    @Override
    public HandlerKind kind() {
        return kind;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public HandlerResult handle(StateObject object, String targetState) {
        journal.add("handle:" + name);
        if (throwOnHandle != null) {
            throw throwOnHandle;
        }
        if (failOnHandle) {
            return HandlerResult.FAILED;
        }
        return proceed();
    }

    @Override
    public boolean rollback(StateObject object, String targetState) {
        journal.add("rollback:" + name);
        return !failOnRollback;
    }
}
